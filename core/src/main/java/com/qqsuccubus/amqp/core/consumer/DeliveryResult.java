package com.qqsuccubus.amqp.core.consumer;

/**
 * Per-delivery disposition returned by a delivery handler.
 */
public enum DeliveryResult {
    /**
     * Accept the message; it is acknowledged right away together with any deferred ones.
     */
    ACK,

    /**
     * Discard the message without redelivery.
     */
    REJECT,

    /**
     * Discard the message and ask the broker to redeliver it.
     */
    REJECT_REQUEUE,

    /**
     * Accept the message but postpone the acknowledgment until the next block flush.
     */
    DEFER
}
