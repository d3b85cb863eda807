package com.wadechandler.identity.reconcile;

import com.wadechandler.identity.model.Contact;
import com.wadechandler.identity.repository.ContactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps matched contacts to the distinct primaries ("roots") they belong to.
 * Iteration order of the result follows the order of the matches.
 * <p>
 * A root whose primary is soft-deleted is dropped: its live secondaries match, but the
 * deleted primary never takes part in a merge or gains new links.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RootResolver {

    private final ContactStore contactStore;

    public Set<Long> resolveRoots(Collection<Contact> matches) {
        Set<Long> roots = new LinkedHashSet<>();
        for (Contact contact : matches) {
            Long root = contact.rootId();
            if (root != null) {
                roots.add(root);
            }
        }

        // matched primaries are live; only roots reached through a secondary need a lookup
        Set<Long> unseen = new LinkedHashSet<>(roots);
        matches.forEach(c -> unseen.remove(c.getId()));
        if (unseen.isEmpty()) {
            return roots;
        }

        Set<Long> live = contactStore.findByIds(unseen).stream()
                .filter(c -> !c.isDeleted())
                .map(Contact::getId)
                .collect(Collectors.toSet());
        unseen.removeAll(live);
        if (!unseen.isEmpty()) {
            log.debug("Ignoring roots {}: primary soft-deleted or missing", unseen);
            roots.removeAll(unseen);
        }
        return roots;
    }
}
