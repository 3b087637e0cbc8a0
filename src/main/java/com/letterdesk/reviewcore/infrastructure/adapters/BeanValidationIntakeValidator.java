package com.letterdesk.reviewcore.infrastructure.adapters;

import com.letterdesk.reviewcore.domain.IntakeData;
import com.letterdesk.reviewcore.domain.LetterTypes;
import com.letterdesk.reviewcore.domain.ports.IntakeValidator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks intake facts against the constraints declared on {@link IntakeData}.
 */
@Component
public class BeanValidationIntakeValidator implements IntakeValidator {

    private final Validator validator;

    public BeanValidationIntakeValidator(Validator validator) {
        this.validator = validator;
    }

    @Override
    public Report validate(String letterType, IntakeData intakeData) {
        List<String> errors = new ArrayList<>();
        if (letterType == null || letterType.isBlank()) {
            errors.add("Letter type is required");
        } else if (!LetterTypes.isSupported(letterType)) {
            errors.add("Unsupported letter type: " + letterType);
        }
        if (intakeData == null) {
            errors.add("Intake data is required");
        } else {
            validator.validate(intakeData).stream()
                    .sorted(Comparator.comparing((ConstraintViolation<IntakeData> v) -> v.getPropertyPath().toString())
                            .thenComparing(ConstraintViolation::getMessage))
                    .map(ConstraintViolation::getMessage)
                    .forEach(errors::add);
        }
        return errors.isEmpty() ? Report.ok() : Report.invalid(errors);
    }
}
