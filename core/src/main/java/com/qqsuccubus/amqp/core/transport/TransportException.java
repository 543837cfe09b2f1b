package com.qqsuccubus.amqp.core.transport;

/**
 * Fatal failure of the broker transport (receive loop, ack/nack or publish primitives).
 * <p>
 * The consumer engine never retries after this exception: it flushes what it can and closes the channel.
 * Reconnecting is up to the caller.
 * </p>
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
