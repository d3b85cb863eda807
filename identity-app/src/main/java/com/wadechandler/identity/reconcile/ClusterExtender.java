package com.wadechandler.identity.reconcile;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.model.ContactDraft;
import com.wadechandler.identity.repository.ContactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Appends a secondary to a cluster when the request brings an email or phone number
 * the cluster does not know yet. The new secondary carries both incoming values.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClusterExtender {

    private final ContactStore contactStore;

    public Optional<Contact> extend(Long primaryId, List<Contact> cluster, String email, String phoneNumber) {
        boolean emailIsNew = email != null && cluster.stream()
                .map(Contact::getEmail)
                .filter(Objects::nonNull)
                .noneMatch(email::equals);
        boolean phoneIsNew = phoneNumber != null && cluster.stream()
                .map(Contact::getPhoneNumber)
                .filter(Objects::nonNull)
                .noneMatch(phoneNumber::equals);

        if (!emailIsNew && !phoneIsNew) {
            log.debug("Cluster {} already knows email/phone, nothing to add", primaryId);
            return Optional.empty();
        }

        Contact secondary = contactStore.create(ContactDraft.secondaryOf(primaryId, email, phoneNumber));
        log.info("Extended cluster {} with secondary {} (newEmail={}, newPhone={})",
                primaryId, secondary.getId(), emailIsNew, phoneIsNew);
        return Optional.of(secondary);
    }
}
