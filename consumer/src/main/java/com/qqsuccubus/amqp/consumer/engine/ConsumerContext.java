package com.qqsuccubus.amqp.consumer.engine;

import com.qqsuccubus.amqp.core.consumer.DeliveryResult;
import com.qqsuccubus.amqp.core.msg.Envelope;
import com.qqsuccubus.amqp.core.transport.IQueue;
import com.qqsuccubus.amqp.core.transport.TransportException;

/**
 * Engine services available to a {@link DeliveryStrategy} while it handles a delivery.
 */
public interface ConsumerContext {

    IQueue queue();

    String consumerTag();

    /**
     * Applies a control-plane message (shutdown, reconfigure) to the running consumer.
     *
     * @param envelope control message
     * @return ACK when applied, REJECT when the message was invalid
     * @throws TransportException if pushing new prefetch settings failed
     */
    DeliveryResult handleInternalMessage(Envelope envelope) throws TransportException;

    void shutdown();
}
