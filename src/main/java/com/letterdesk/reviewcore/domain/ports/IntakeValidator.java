package com.letterdesk.reviewcore.domain.ports;

import com.letterdesk.reviewcore.domain.IntakeData;

import java.util.List;

public interface IntakeValidator {

    Report validate(String letterType, IntakeData intakeData);

    record Report(boolean valid, List<String> errors) {

        public static Report ok() {
            return new Report(true, List.of());
        }

        public static Report invalid(List<String> errors) {
            return new Report(false, List.copyOf(errors));
        }
    }
}
