package com.wadechandler.identity.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Consolidated view of one person-cluster. The primary's email and phone number,
 * when present, are the first entries of their lists.
 * <p>
 * {@code primaryContatctId} is the field name clients already consume; it is kept as-is.
 */
public record ConsolidatedContact(
        @JsonProperty("primaryContatctId") Long primaryContactId,
        List<String> emails,
        List<String> phoneNumbers,
        List<Long> secondaryContactIds
) {

    public ConsolidatedContact {
        emails = List.copyOf(emails);
        phoneNumbers = List.copyOf(phoneNumbers);
        secondaryContactIds = List.copyOf(secondaryContactIds);
    }
}
