package com.creatorradar.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * One of tiktok, instagram, youtube (case-insensitive).
 * Error code for API: INVALID_PLATFORM.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = SupportedPlatformValidator.class)
public @interface SupportedPlatform {

    String message() default "INVALID_PLATFORM";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
