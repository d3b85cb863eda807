package com.wadechandler.identity.model;

/**
 * Fields of a contact that has not been stored yet. The store assigns {@code id} and {@code createdAt}.
 */
public record ContactDraft(
        String email,
        String phoneNumber,
        LinkPrecedence linkPrecedence,
        Long linkedId
) {

    public ContactDraft {
        if (linkPrecedence == null) {
            throw new IllegalArgumentException("linkPrecedence is required");
        }
        if ((linkPrecedence == LinkPrecedence.SECONDARY) != (linkedId != null)) {
            throw new IllegalArgumentException("linkedId must be set exactly for secondary contacts");
        }
    }

    public static ContactDraft primary(String email, String phoneNumber) {
        return new ContactDraft(email, phoneNumber, LinkPrecedence.PRIMARY, null);
    }

    public static ContactDraft secondaryOf(Long primaryId, String email, String phoneNumber) {
        return new ContactDraft(email, phoneNumber, LinkPrecedence.SECONDARY, primaryId);
    }
}
