package com.tazifor.popup.exception;

/**
 * A backing store (cap counters, assignment mirror, impression ledger) could not be reached.
 * Callers fail open.
 */
public class TransientStoreException extends PopupEngineException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
