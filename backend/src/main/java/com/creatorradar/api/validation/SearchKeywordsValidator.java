package com.creatorradar.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Delegates to JobRequestValidator so the bounds live in one place.
 */
@Component
public class SearchKeywordsValidator implements ConstraintValidator<SearchKeywords, List<String>> {

    private final JobRequestValidator jobRequestValidator;

    public SearchKeywordsValidator(JobRequestValidator jobRequestValidator) {
        this.jobRequestValidator = jobRequestValidator;
    }

    @Override
    public boolean isValid(List<String> value, ConstraintValidatorContext context) {
        return jobRequestValidator.areValidKeywords(value);
    }
}
