package com.qqsuccubus.amqp.consumer.engine;

import com.qqsuccubus.amqp.core.consumer.DeliveryResult;
import com.qqsuccubus.amqp.core.msg.Envelope;
import com.qqsuccubus.amqp.core.transport.IQueue;

/**
 * Application callback deciding the disposition of one business message.
 */
@FunctionalInterface
public interface DeliveryHandler {
    /**
     * @param envelope received message
     * @param queue    queue the message came from
     * @return disposition; exceptions are routed to the consumer's error policy
     * @throws Exception any processing failure
     */
    DeliveryResult handle(Envelope envelope, IQueue queue) throws Exception;
}
