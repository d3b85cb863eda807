package com.wadechandler.identity.reconcile;

/**
 * A read or write against the contact store failed (connection loss, constraint violation, ...).
 */
public class StorageUnavailableException extends ReconciliationException {

    public StorageUnavailableException(String operation, Throwable cause) {
        super("Contact store failed during " + operation, cause);
    }
}
