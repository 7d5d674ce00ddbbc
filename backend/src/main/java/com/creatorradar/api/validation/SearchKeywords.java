package com.creatorradar.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Non-empty list of at most 50 keywords, each 2..100 characters after trimming.
 * Error code for API: INVALID_KEYWORDS.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = SearchKeywordsValidator.class)
public @interface SearchKeywords {

    String message() default "INVALID_KEYWORDS";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
