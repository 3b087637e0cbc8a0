package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.IntakeData;

import java.util.UUID;

public class GenerateLetterCommand {
    public final UUID userId;
    public final String letterType;
    public final IntakeData intakeData;

    public GenerateLetterCommand(UUID userId, String letterType, IntakeData intakeData) {
        this.userId = userId;
        this.letterType = letterType;
        this.intakeData = intakeData;
    }
}
