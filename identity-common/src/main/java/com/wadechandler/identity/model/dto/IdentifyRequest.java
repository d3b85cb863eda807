package com.wadechandler.identity.model.dto;

import com.wadechandler.identity.validation.EmailOrPhoneNumberRequired;
import jakarta.validation.constraints.Email;

/**
 * Body of {@code POST /identify}. Blank values are normalized to {@code null}
 * so "absent" has a single representation downstream.
 */
@EmailOrPhoneNumberRequired
public record IdentifyRequest(
        @Email(message = "Invalid email format") String email,
        String phoneNumber
) {

    public IdentifyRequest {
        email = blankToNull(email);
        phoneNumber = blankToNull(phoneNumber);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
