package com.wadechandler.identity.reconcile;

import java.util.Set;

/**
 * The merge unit of work was aborted by the store, for example on a deadlock or lock timeout,
 * or the clusters to merge changed underneath it. No part of the merge was applied.
 */
public class MergeConflictException extends ReconciliationException {

    public MergeConflictException(Long survivorId, Set<Long> demotedIds, Throwable cause) {
        super("Merge of " + demotedIds + " into " + survivorId + " was aborted", cause);
    }

    /** None of {@code roots} is a live primary any more; they changed after matching. */
    public MergeConflictException(Set<Long> roots) {
        super("Roots " + roots + " are no longer live primaries", null);
    }
}
