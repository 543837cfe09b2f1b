package com.qqsuccubus.amqp.consumer.rabbit;

import com.qqsuccubus.amqp.core.transport.IExchange;
import com.qqsuccubus.amqp.core.transport.MessageAttributes;
import com.qqsuccubus.amqp.core.transport.TransportException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.io.IOException;

/**
 * Exchange handle publishing through an amqp-client channel.
 */
@RequiredArgsConstructor
public class RabbitExchange implements IExchange {

    private final Channel channel;
    @Getter
    private final String name;

    @Override
    public void publish(byte[] body, String routingKey, MessageAttributes attributes) throws TransportException {
        try {
            channel.basicPublish(name, routingKey, RabbitEnvelopes.toProperties(attributes), body);
        } catch (IOException | ShutdownSignalException e) {
            throw new TransportException("Publish to exchange '" + name + "' failed", e);
        }
    }
}
