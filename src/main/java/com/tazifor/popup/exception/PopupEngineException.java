package com.tazifor.popup.exception;

/**
 * Root of the engine's failure taxonomy.
 */
public class PopupEngineException extends RuntimeException {

    public PopupEngineException(String message) {
        super(message);
    }

    public PopupEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
