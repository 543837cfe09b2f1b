package com.qqsuccubus.amqp.core.util;

/**
 * Raised when a message body cannot be decoded as JSON.
 */
public class JsonDecodeException extends RuntimeException {

    public JsonDecodeException(String message) {
        super(message);
    }

    public JsonDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
