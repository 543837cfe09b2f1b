package com.qqsuccubus.amqp.consumer.rabbit;

import com.qqsuccubus.amqp.consumer.config.ConsumerConfig;
import com.qqsuccubus.amqp.core.transport.IQueue;
import com.qqsuccubus.amqp.core.transport.TransportException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens RabbitMQ connections and queue handles from a {@link ConsumerConfig}.
 * <p>
 * Queues, exchanges and bindings are expected to exist; declaring them is left to deployment tooling.
 * </p>
 */
public final class RabbitTransport implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RabbitTransport.class);

    private final Connection connection;

    private RabbitTransport(Connection connection) {
        this.connection = connection;
    }

    public static ConnectionFactory connectionFactory(ConsumerConfig config) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(config.getAmqpHost());
        factory.setPort(config.getAmqpPort());
        factory.setUsername(config.getAmqpUser());
        factory.setPassword(config.getAmqpPassword());
        factory.setVirtualHost(config.getAmqpVhost());
        factory.setRequestedHeartbeat(config.getHeartbeatSec());
        factory.setConnectionTimeout((int) config.getConnectionTimeout().toMillis());
        return factory;
    }

    public static RabbitTransport connect(ConsumerConfig config) throws TransportException {
        try {
            Connection connection = connectionFactory(config).newConnection(config.getAppId());
            log.info("Connected to amqp://{}:{}{}", config.getAmqpHost(), config.getAmqpPort(), config.getAmqpVhost());
            return new RabbitTransport(connection);
        } catch (IOException | TimeoutException e) {
            throw new TransportException(
                "Cannot connect to " + config.getAmqpHost() + ":" + config.getAmqpPort(), e
            );
        }
    }

    /**
     * Opens a dedicated channel for one consumer and applies its prefetch count.
     *
     * @param queueName     existing queue
     * @param prefetchCount prefetch count (also the consumer's ack block size)
     * @return queue handle owning the new channel
     * @throws TransportException if the channel cannot be opened
     */
    public IQueue openQueue(String queueName, int prefetchCount) throws TransportException {
        try {
            RabbitChannel channel = new RabbitChannel(connection.createChannel());
            channel.qos(0, prefetchCount);
            return new RabbitQueue(queueName, channel);
        } catch (IOException e) {
            throw new TransportException("Cannot open channel for queue '" + queueName + "'", e);
        }
    }

    @Override
    public void close() {
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (IOException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
        }
    }
}
