package com.qqsuccubus.amqp.consumer.engine;

import com.qqsuccubus.amqp.core.transport.TransportException;

/**
 * Queue consumer lifecycle (Dependency Inversion Principle).
 */
public interface IConsumer {
    /**
     * Consumes messages until stopped.
     *
     * @param maxMessages number of messages to consume before stopping, 0 = run until shut down
     * @throws TransportException if the transport failed; pending deliveries were flushed and the channel closed
     */
    void consume(int maxMessages) throws TransportException;

    /**
     * Requests a cooperative stop. Safe to call from any thread and more than once.
     */
    void shutdown();

    /**
     * @return false once a shutdown was requested
     */
    boolean isKeepAlive();

    String getConsumerTag();
}
