package com.qqsuccubus.amqp.core.transport;

/**
 * Broker channel owning the queue subscription.
 */
public interface IChannel {

    /**
     * @return current prefetch count (0 = unlimited)
     */
    int getPrefetchCount();

    /**
     * Applies new prefetch limits.
     *
     * @param prefetchSize  prefetch window in bytes (0 = unlimited)
     * @param prefetchCount prefetch window in messages (0 = unlimited)
     * @throws TransportException if the broker refuses the settings
     */
    void qos(int prefetchSize, int prefetchCount) throws TransportException;

    /**
     * Returns the channel's default direct exchange, which routes by queue name.
     *
     * @return exchange handle
     */
    IExchange newExchange();

    /**
     * Closes the channel and, where the driver ties them together, its connection.
     */
    void close();
}
