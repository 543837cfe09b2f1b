package com.qqsuccubus.amqp.core.msg;

/**
 * Raised when a control-plane message body does not satisfy its contract.
 */
public class InvalidControlMessageException extends RuntimeException {

    public InvalidControlMessageException(String message) {
        super(message);
    }

    public InvalidControlMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
