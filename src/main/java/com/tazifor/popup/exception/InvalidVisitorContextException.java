package com.tazifor.popup.exception;

/**
 * The request carries no usable visitorId/sessionId, so capping and experiment
 * stickiness cannot be guaranteed.
 */
public class InvalidVisitorContextException extends PopupEngineException {

    public InvalidVisitorContextException(String message) {
        super(message);
    }
}
