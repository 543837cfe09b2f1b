package com.qqsuccubus.amqp.core.transport;

/**
 * Publishing side of the transport.
 */
public interface IExchange {

    String getName();

    /**
     * Publishes a message.
     *
     * @param body       payload
     * @param routingKey routing key
     * @param attributes message properties
     * @throws TransportException if the publish fails
     */
    void publish(byte[] body, String routingKey, MessageAttributes attributes) throws TransportException;
}
