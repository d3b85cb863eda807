package com.wadechandler.identity.reconcile;

/**
 * Fatal failure of a reconciliation request. Nothing is retried internally;
 * the caller decides whether to resubmit the whole request.
 */
public abstract class ReconciliationException extends RuntimeException {

    protected ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
