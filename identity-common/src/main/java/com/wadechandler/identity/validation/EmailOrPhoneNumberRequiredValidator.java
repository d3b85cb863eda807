package com.wadechandler.identity.validation;

import com.wadechandler.identity.model.dto.IdentifyRequest;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class EmailOrPhoneNumberRequiredValidator
        implements ConstraintValidator<EmailOrPhoneNumberRequired, IdentifyRequest> {

    @Override
    public boolean isValid(IdentifyRequest request, ConstraintValidatorContext context) {
        // null bodies are rejected before validation runs
        if (request == null) {
            return true;
        }
        return request.email() != null || request.phoneNumber() != null;
    }
}
