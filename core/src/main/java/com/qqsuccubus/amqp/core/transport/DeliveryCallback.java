package com.qqsuccubus.amqp.core.transport;

import com.qqsuccubus.amqp.core.msg.Envelope;

/**
 * Per-delivery callback invoked by {@link IQueue#consume(DeliveryCallback, String)}.
 */
@FunctionalInterface
public interface DeliveryCallback {
    /**
     * Handles one delivery.
     *
     * @param envelope received message
     * @return {@code true} to keep receiving, {@code false} to leave the receive loop
     * @throws TransportException if an ack/nack issued while handling the delivery failed
     */
    boolean onDelivery(Envelope envelope) throws TransportException;
}
