package com.qqsuccubus.amqp.consumer.rabbit;

import com.qqsuccubus.amqp.core.transport.IChannel;
import com.qqsuccubus.amqp.core.transport.IExchange;
import com.qqsuccubus.amqp.core.transport.TransportException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * amqp-client channel adapter. The broker does not report the active prefetch, so it is tracked here.
 */
public class RabbitChannel implements IChannel {
    private static final Logger log = LoggerFactory.getLogger(RabbitChannel.class);

    private final Channel channel;
    private int prefetchCount;

    public RabbitChannel(Channel channel) {
        this.channel = channel;
    }

    Channel delegate() {
        return channel;
    }

    @Override
    public int getPrefetchCount() {
        return prefetchCount;
    }

    @Override
    public void qos(int prefetchSize, int prefetchCount) throws TransportException {
        try {
            channel.basicQos(prefetchSize, prefetchCount, false);
        } catch (IOException | ShutdownSignalException e) {
            throw new TransportException("basic.qos(" + prefetchSize + ", " + prefetchCount + ") failed", e);
        }
        this.prefetchCount = prefetchCount;
    }

    /**
     * The default exchange is a direct exchange bound to every queue by name.
     */
    @Override
    public IExchange newExchange() {
        return new RabbitExchange(channel, "");
    }

    /**
     * Closes the channel and the connection it belongs to.
     */
    @Override
    public void close() {
        Connection connection = channel.getConnection();
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException e) {
            log.warn("Failed to close channel {}: {}", channel.getChannelNumber(), e.getMessage());
        }
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (IOException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
        }
    }
}
