package com.wadechandler.identity.reconcile;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.model.ContactDraft;
import com.wadechandler.identity.model.dto.ConsolidatedContact;
import com.wadechandler.identity.repository.ContactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Resolves incoming contact details to a person-cluster, growing or merging clusters as needed.
 * <p>
 * Stages run strictly in order: match, resolve roots, merge, extend, compose.
 * Only the merge is atomic. Matching and the later create are separate statements, so two
 * concurrent requests with overlapping new details may both create a primary, or both add
 * the same secondary. Serializing the whole pipeline would close that gap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Reconciler {

    private final ContactStore contactStore;
    private final ContactMatcher matcher;
    private final RootResolver resolver;
    private final ClusterMerger merger;
    private final ClusterExtender extender;
    private final ClusterComposer composer;

    /**
     * @param email       incoming email, or {@code null}
     * @param phoneNumber incoming phone number, or {@code null}; at least one of the two is present
     */
    public ConsolidatedContact reconcile(String email, String phoneNumber) {
        try {
            List<Contact> matches = matcher.match(email, phoneNumber);
            Set<Long> roots = resolver.resolveRoots(matches);

            if (roots.isEmpty()) {
                Contact primary = contactStore.create(ContactDraft.primary(email, phoneNumber));
                log.info("No existing identity, created primary {}", primary.getId());
                return composer.compose(primary.getId(), List.of(primary));
            }

            Long primaryId = roots.size() == 1
                    ? roots.iterator().next()
                    : merger.merge(roots);

            List<Contact> cluster = new ArrayList<>(contactStore.findCluster(primaryId));
            extender.extend(primaryId, cluster, email, phoneNumber).ifPresent(cluster::add);

            return composer.compose(primaryId, cluster);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("reconciliation", e);
        }
    }
}
