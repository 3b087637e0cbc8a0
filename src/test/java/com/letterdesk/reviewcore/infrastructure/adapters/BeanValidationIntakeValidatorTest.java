package com.letterdesk.reviewcore.infrastructure.adapters;

import com.letterdesk.reviewcore.domain.IntakeData;
import com.letterdesk.reviewcore.domain.ports.IntakeValidator;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class BeanValidationIntakeValidatorTest {

    private static ValidatorFactory factory;
    private static BeanValidationIntakeValidator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = new BeanValidationIntakeValidator(factory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void fourRequiredFieldsAreEnough() {
        IntakeValidator.Report report = validator.validate("demand_letter",
                IntakeData.minimal("Alice", "Bob", "Unpaid invoice", "Pay in full"));

        assertThat(report.valid()).isTrue();
        assertThat(report.errors()).isEmpty();
    }

    @Test
    void reportsEveryViolation() {
        IntakeData intake = new IntakeData("", null, "California", "not-an-email", "Bob", null, null, null,
                "Unpaid invoice", "Pay in full", new BigDecimal("-5"), "01/04/2024", null, null);

        IntakeValidator.Report report = validator.validate("demand_letter", intake);

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).containsExactlyInAnyOrder(
                "Sender name is required",
                "Sender state must be a two-letter code",
                "Sender email must be a valid email address",
                "Amount demanded cannot be negative",
                "Deadline date must be YYYY-MM-DD");
    }

    @Test
    void rejectsUnsupportedLetterType() {
        IntakeValidator.Report report = validator.validate("love_letter",
                IntakeData.minimal("Alice", "Bob", "Issue", "Outcome"));

        assertThat(report.errors()).containsExactly("Unsupported letter type: love_letter");
    }

    @Test
    void rejectsMissingIntake() {
        assertThat(validator.validate("demand_letter", null).errors()).containsExactly("Intake data is required");
    }
}
