package com.qqsuccubus.amqp.consumer.engine;

/**
 * Error policy consulted when a delivery or flush handler throws.
 */
@FunctionalInterface
public interface ErrorCallback {
    /**
     * @param error    exception raised by the handler
     * @param consumer consumer that caught it
     * @return {@code true} or {@code null} to requeue, {@code false} to discard
     */
    Boolean onError(Exception error, IConsumer consumer);
}
