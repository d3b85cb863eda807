package com.wadechandler.identity.repository;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.model.ContactDraft;
import com.wadechandler.identity.model.LinkPrecedence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link ContactStore} backed by the {@code contacts} table through {@link ContactRepository}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaContactStore implements ContactStore {

    private final ContactRepository contactRepository;

    @Override
    public List<Contact> findMatching(String email, String phoneNumber) {
        if (email != null && phoneNumber != null) {
            return contactRepository.findActiveByEmailOrPhoneNumber(email, phoneNumber);
        }
        if (email != null) {
            return contactRepository.findActiveByEmail(email);
        }
        if (phoneNumber != null) {
            return contactRepository.findActiveByPhoneNumber(phoneNumber);
        }
        return List.of();
    }

    @Override
    public List<Contact> findByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return contactRepository.findByIdInOrderByCreatedAtAscIdAsc(ids);
    }

    @Override
    public List<Contact> findCluster(Long primaryId) {
        return contactRepository.findActiveCluster(primaryId);
    }

    @Override
    public Contact create(ContactDraft draft) {
        Contact contact = Contact.builder()
                .email(draft.email())
                .phoneNumber(draft.phoneNumber())
                .linkPrecedence(draft.linkPrecedence())
                .linkedId(draft.linkedId())
                .build();
        return contactRepository.saveAndFlush(contact);
    }

    /**
     * Locks the survivor and the primaries to demote, re-checks that all of them are still live
     * primaries, then applies both writes. A failed check or a short update count means another
     * merge got there first; the whole unit of work is rolled back.
     */
    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void atomically(Demotion demotion, Relink relink) {
        Set<Long> involved = new HashSet<>(demotion.ids());
        involved.add(demotion.newLinkedId());
        List<Contact> locked = contactRepository.lockByIds(involved);
        if (locked.size() != involved.size()
                || locked.stream().anyMatch(c -> !c.isPrimary() || c.isDeleted())) {
            throw new OptimisticLockingFailureException(
                    "Contacts " + involved + " are no longer all live primaries");
        }

        Instant now = Instant.now();
        int demoted = contactRepository.demote(
                demotion.ids(), demotion.newLinkedId(), LinkPrecedence.SECONDARY, now);
        if (demoted != demotion.ids().size()) {
            throw new OptimisticLockingFailureException(
                    "Demoted " + demoted + " of " + demotion.ids().size() + " primaries");
        }
        int relinked = relink.oldLinkedIds().isEmpty()
                ? 0
                : contactRepository.relink(relink.oldLinkedIds(), relink.newLinkedId(), now);
        log.debug("Merge unit of work: demoted {} primaries, relinked {} secondaries to {}",
                demoted, relinked, demotion.newLinkedId());
    }
}
