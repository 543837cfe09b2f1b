package com.qqsuccubus.amqp.core.consumer;

/**
 * Aggregate disposition applied to a whole block of deferred deliveries.
 */
public enum FlushResult {
    ACK,
    REJECT,
    REJECT_REQUEUE
}
