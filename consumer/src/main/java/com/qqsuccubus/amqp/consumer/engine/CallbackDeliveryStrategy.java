package com.qqsuccubus.amqp.consumer.engine;

import com.qqsuccubus.amqp.core.consumer.DeliveryResult;
import com.qqsuccubus.amqp.core.msg.ControlMessages;
import com.qqsuccubus.amqp.core.msg.Envelope;
import lombok.RequiredArgsConstructor;

/**
 * Default strategy: control-plane messages go to the engine, everything else to the application handler.
 */
@RequiredArgsConstructor
public class CallbackDeliveryStrategy implements DeliveryStrategy {

    private final DeliveryHandler deliveryHandler;

    @Override
    public DeliveryResult handleDelivery(Envelope envelope, ConsumerContext context) throws Exception {
        if (ControlMessages.isInternal(envelope)) {
            return context.handleInternalMessage(envelope);
        }
        return deliveryHandler.handle(envelope, context.queue());
    }
}
