package com.wadechandler.identity.reconcile;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.model.dto.ConsolidatedContact;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the de-duplicated view of a cluster: the primary's values first, then
 * the other members' values in cluster order.
 */
@Component
public class ClusterComposer {

    public ConsolidatedContact compose(Long primaryId, List<Contact> cluster) {
        List<String> emails = new ArrayList<>();
        List<String> phoneNumbers = new ArrayList<>();
        List<Long> secondaryIds = new ArrayList<>();

        cluster.stream()
                .filter(c -> c.getId().equals(primaryId))
                .findFirst()
                .ifPresent(primary -> {
                    addIfAbsent(emails, primary.getEmail());
                    addIfAbsent(phoneNumbers, primary.getPhoneNumber());
                });

        for (Contact contact : cluster) {
            if (contact.getId().equals(primaryId)) {
                continue;
            }
            addIfAbsent(emails, contact.getEmail());
            addIfAbsent(phoneNumbers, contact.getPhoneNumber());
            secondaryIds.add(contact.getId());
        }

        return new ConsolidatedContact(primaryId, emails, phoneNumbers, secondaryIds);
    }

    private static <T> void addIfAbsent(List<T> values, T value) {
        if (value != null && !values.contains(value)) {
            values.add(value);
        }
    }
}
