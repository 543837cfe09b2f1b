package com.qqsuccubus.amqp.consumer.engine;

import com.qqsuccubus.amqp.core.consumer.DeliveryResult;
import com.qqsuccubus.amqp.core.msg.Envelope;

/**
 * Delivery-handling strategy plugged into {@link BatchingConsumer}.
 * <p>
 * The strategy decides what a delivery means; the engine owns counting, acknowledgment and termination.
 * </p>
 */
public interface DeliveryStrategy {

    /**
     * Handles one delivery.
     *
     * @param envelope received message
     * @param context  engine services
     * @return disposition (ignored in {@link AckMode#IMMEDIATE})
     * @throws Exception any failure
     */
    DeliveryResult handleDelivery(Envelope envelope, ConsumerContext context) throws Exception;

    default AckMode ackMode() {
        return AckMode.BATCHED;
    }

    /**
     * How the engine settles deliveries handled by a strategy.
     */
    enum AckMode {
        /**
         * Settle according to the returned {@link DeliveryResult}; DEFER accumulates into the current block.
         */
        BATCHED,

        /**
         * Acknowledge each delivery before the strategy runs. Failures are logged, never redelivered.
         */
        IMMEDIATE
    }
}
