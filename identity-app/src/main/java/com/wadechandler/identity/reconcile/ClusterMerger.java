package com.wadechandler.identity.reconcile;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.model.Seniority;
import com.wadechandler.identity.repository.ContactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collapses two or more clusters into the one whose primary is oldest.
 * <p>
 * The demotion of the younger primaries and the re-pointing of their secondaries
 * are handed to {@link ContactStore#atomically} as a single unit of work.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClusterMerger {

    private final ContactStore contactStore;

    /**
     * @param roots two or more distinct primary ids
     * @return id of the surviving primary
     */
    public Long merge(Set<Long> roots) {
        List<Contact> primaries = currentPrimaries(roots);
        if (primaries.isEmpty()) {
            throw new MergeConflictException(roots);
        }

        Contact survivor = primaries.stream().reduce(Seniority::olderOf).orElseThrow();
        Set<Long> demotedIds = primaries.stream()
                .map(Contact::getId)
                .filter(id -> !id.equals(survivor.getId()))
                .collect(Collectors.toCollection(LinkedHashSet::new));

        if (demotedIds.isEmpty()) {
            return survivor.getId();
        }

        log.info("Merging clusters {} into primary {}", demotedIds, survivor.getId());
        try {
            contactStore.atomically(
                    new ContactStore.Demotion(demotedIds, survivor.getId()),
                    new ContactStore.Relink(demotedIds, survivor.getId()));
        } catch (ConcurrencyFailureException e) {
            log.warn("Merge of {} into {} aborted by the store: {}", demotedIds, survivor.getId(), e.getMessage());
            return convergedPrimary(roots)
                    .orElseThrow(() -> new MergeConflictException(survivor.getId(), demotedIds, e));
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("merge", e);
        }
        return survivor.getId();
    }

    /**
     * After an aborted merge, checks whether a concurrent merge already collapsed {@code roots}
     * onto a single live primary.
     */
    private Optional<Long> convergedPrimary(Set<Long> roots) {
        List<Contact> primaries = currentPrimaries(roots);
        if (primaries.size() != 1) {
            return Optional.empty();
        }
        Long primaryId = primaries.get(0).getId();
        log.info("Clusters {} were already merged into {} concurrently", roots, primaryId);
        return Optional.of(primaryId);
    }

    /**
     * Fetches the live primaries behind {@code roots}. A root demoted by a concurrent merge since
     * it was resolved is followed to the primary it now points at. Soft-deleted contacts are
     * never candidates for survival.
     */
    private List<Contact> currentPrimaries(Set<Long> roots) {
        List<Contact> fetched = contactStore.findByIds(roots).stream()
                .filter(c -> !c.isDeleted())
                .toList();
        if (fetched.stream().allMatch(Contact::isPrimary)) {
            return fetched;
        }
        Set<Long> refreshed = fetched.stream()
                .map(Contact::rootId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        log.debug("Roots {} moved since matching, now {}", roots, refreshed);
        return contactStore.findByIds(refreshed).stream()
                .filter(c -> c.isPrimary() && !c.isDeleted())
                .toList();
    }
}
