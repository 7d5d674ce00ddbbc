package com.creatorradar.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

@Component
public class SupportedPlatformValidator implements ConstraintValidator<SupportedPlatform, String> {

    private final JobRequestValidator jobRequestValidator;

    public SupportedPlatformValidator(JobRequestValidator jobRequestValidator) {
        this.jobRequestValidator = jobRequestValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return jobRequestValidator.isSupportedPlatform(value);
    }
}
