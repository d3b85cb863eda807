package com.wadechandler.identity.repository;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.model.ContactDraft;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Storage operations the reconciliation engine depends on.
 * <p>
 * Every list is ordered oldest first ({@code createdAt}, then {@code id}).
 * Soft-deleted contacts are never returned by {@link #findMatching} or {@link #findCluster}.
 */
public interface ContactStore {

    /**
     * Contacts whose email equals {@code email} or whose phone number equals {@code phoneNumber}.
     * A {@code null} argument does not take part in the match.
     */
    List<Contact> findMatching(String email, String phoneNumber);

    /** Contacts with the given ids, regardless of their precedence. */
    List<Contact> findByIds(Collection<Long> ids);

    /** The primary with {@code primaryId} plus every contact linked to it. */
    List<Contact> findCluster(Long primaryId);

    /** Stores a new contact and returns it with {@code id} and {@code createdAt} assigned. */
    Contact create(ContactDraft draft);

    /**
     * Applies both writes of a merge as one unit of work: either both are visible or neither is.
     */
    void atomically(Demotion demotion, Relink relink);

    /** Turns each of {@code ids} into a secondary of {@code newLinkedId}. */
    record Demotion(Set<Long> ids, Long newLinkedId) {

        public Demotion {
            ids = Set.copyOf(ids);
        }
    }

    /** Re-points every contact linked to one of {@code oldLinkedIds} at {@code newLinkedId}. */
    record Relink(Set<Long> oldLinkedIds, Long newLinkedId) {

        public Relink {
            oldLinkedIds = Set.copyOf(oldLinkedIds);
        }
    }
}
