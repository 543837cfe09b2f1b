package com.qqsuccubus.amqp.consumer.rabbit;

import com.qqsuccubus.amqp.core.msg.Envelope;
import com.qqsuccubus.amqp.core.transport.DeliveryCallback;
import com.qqsuccubus.amqp.core.transport.IChannel;
import com.qqsuccubus.amqp.core.transport.IQueue;
import com.qqsuccubus.amqp.core.transport.TransportException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Blocking queue subscription on top of amqp-client's push consumer.
 * <p>
 * The client dispatch thread only enqueues; the callback, acks and nacks all run on the thread that called
 * {@link #consume(DeliveryCallback, String)}, in delivery order.
 * </p>
 */
public class RabbitQueue implements IQueue {
    private static final Logger log = LoggerFactory.getLogger(RabbitQueue.class);

    @Getter
    private final String name;
    private final RabbitChannel channel;

    public RabbitQueue(String name, RabbitChannel channel) {
        this.name = name;
        this.channel = channel;
    }

    @Override
    public IChannel getChannel() {
        return channel;
    }

    @Override
    public void consume(DeliveryCallback callback, String consumerTag) throws TransportException {
        Channel delegate = channel.delegate();
        BlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>();

        try {
            delegate.basicConsume(name, false, consumerTag, new DefaultConsumer(delegate) {
                @Override
                public void handleDelivery(String tag, com.rabbitmq.client.Envelope envelope,
                                           AMQP.BasicProperties properties, byte[] body) {
                    inbox.add(Inbound.delivery(RabbitEnvelopes.toEnvelope(envelope, properties, body)));
                }

                @Override
                public void handleCancelOk(String tag) {
                    inbox.add(Inbound.end(null));
                }

                @Override
                public void handleCancel(String tag) {
                    log.warn("Subscription {} on queue {} was cancelled by the broker", tag, name);
                    inbox.add(Inbound.end(null));
                }

                @Override
                public void handleShutdownSignal(String tag, ShutdownSignalException sig) {
                    inbox.add(Inbound.end(sig.isInitiatedByApplication() ? null : sig));
                }
            });
        } catch (IOException e) {
            throw new TransportException("basic.consume on queue '" + name + "' failed", e);
        }

        while (true) {
            Inbound next;
            try {
                next = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while waiting for deliveries on '" + name + "'", e);
            }

            if (next.envelope == null) {
                if (next.failure != null) {
                    throw new TransportException("Channel shut down: " + next.failure.getMessage(), next.failure);
                }
                return;
            }

            if (!callback.onDelivery(next.envelope)) {
                return;
            }
        }
    }

    @Override
    public void ack(long deliveryTag, boolean multiple) throws TransportException {
        try {
            channel.delegate().basicAck(deliveryTag, multiple);
        } catch (IOException | ShutdownSignalException e) {
            throw new TransportException("basic.ack(" + deliveryTag + ") failed", e);
        }
    }

    @Override
    public void nack(long deliveryTag, boolean multiple, boolean requeue) throws TransportException {
        try {
            channel.delegate().basicNack(deliveryTag, multiple, requeue);
        } catch (IOException | ShutdownSignalException e) {
            throw new TransportException("basic.nack(" + deliveryTag + ") failed", e);
        }
    }

    @Override
    public void cancel(String consumerTag) {
        try {
            channel.delegate().basicCancel(consumerTag);
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Failed to cancel subscription {} on queue {}: {}", consumerTag, name, e.getMessage());
        }
    }

    private static final class Inbound {
        @Nullable
        final Envelope envelope;
        @Nullable
        final ShutdownSignalException failure;

        private Inbound(@Nullable Envelope envelope, @Nullable ShutdownSignalException failure) {
            this.envelope = envelope;
            this.failure = failure;
        }

        static Inbound delivery(Envelope envelope) {
            return new Inbound(envelope, null);
        }

        static Inbound end(@Nullable ShutdownSignalException failure) {
            return new Inbound(null, failure);
        }
    }
}
