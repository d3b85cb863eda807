package com.wadechandler.identity.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Class-level constraint: at least one of {@code email} or {@code phoneNumber} must be supplied.
 */
@Documented
@Constraint(validatedBy = EmailOrPhoneNumberRequiredValidator.class)
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface EmailOrPhoneNumberRequired {

    String message() default "At least one of email or phoneNumber is required.";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
