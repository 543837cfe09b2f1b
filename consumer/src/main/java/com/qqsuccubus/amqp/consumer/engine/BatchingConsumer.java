package com.qqsuccubus.amqp.consumer.engine;

import com.qqsuccubus.amqp.consumer.metrics.MetricsService;
import com.qqsuccubus.amqp.core.consumer.DeliveryResult;
import com.qqsuccubus.amqp.core.consumer.FlushResult;
import com.qqsuccubus.amqp.core.msg.ControlMessages;
import com.qqsuccubus.amqp.core.msg.Envelope;
import com.qqsuccubus.amqp.core.msg.InvalidControlMessageException;
import com.qqsuccubus.amqp.core.transport.IQueue;
import com.qqsuccubus.amqp.core.transport.TransportException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumer engine that batches acknowledgments by count and idle time.
 * <p>
 * <b>Batching:</b> deliveries answered with {@link DeliveryResult#DEFER} accumulate into a block. The block is
 * settled with one cumulative ack/nack (tag of the newest delivery, "multiple" flag) when it reaches the
 * block size (the channel prefetch count) or when more than {@code idleTimeout} seconds passed since the
 * last settlement. {@link DeliveryResult#ACK} settles the block right away. Rejected deliveries are nacked
 * one by one and never join a block, but they do count toward the consume target.
 * </p>
 * <p>
 * <b>Threading:</b> one consumer occupies one thread inside the transport receive loop; all state except
 * {@code keepAlive} is confined to it. {@link #shutdown()} may be called from any thread and is observed
 * once per delivery.
 * </p>
 * <p>
 * The idle timeout is only evaluated when a delivery arrives. A partial block stays pending until the next
 * delivery or until the receive loop ends.
 * </p>
 */
public final class BatchingConsumer implements IConsumer, ConsumerContext {
    private static final Logger log = LoggerFactory.getLogger(BatchingConsumer.class);

    private final IQueue queue;
    private final DeliveryStrategy strategy;
    @Nullable
    private final FlushCallback flushCallback;
    @Nullable
    private final ErrorCallback errorCallback;
    @Getter
    private final String consumerTag;
    private final Clock clock;
    private final MetricsService metrics;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    @Getter
    private int countMessagesConsumed;
    @Getter
    private int countMessagesUnacked;
    // Newest delivery of the pending block; null when nothing is pending.
    @Getter
    @Nullable
    private Long lastDeliveryTag;
    @Getter
    private volatile boolean keepAlive = true;
    @Getter
    private double idleTimeout;
    @Getter
    private int blockSize;
    @Nullable
    private Long timestampLastAck;
    @Nullable
    private Long timestampLastMessage;
    @Getter
    private int target;

    /**
     * @param queue         queue to consume from
     * @param strategy      delivery handling strategy
     * @param flushCallback decides how a deferred block is settled, null = always ack
     * @param errorCallback error policy, null = always requeue
     * @param idleTimeout   seconds after which a partial block is flushed
     * @param consumerTag   subscription tag, random when blank
     * @param clock         time source, system UTC when null
     * @param meterRegistry metrics registry, global registry when null
     */
    @Builder
    private BatchingConsumer(IQueue queue,
                             DeliveryStrategy strategy,
                             @Nullable FlushCallback flushCallback,
                             @Nullable ErrorCallback errorCallback,
                             double idleTimeout,
                             @Nullable String consumerTag,
                             @Nullable Clock clock,
                             @Nullable MeterRegistry meterRegistry) {
        if (queue == null || strategy == null) {
            throw new IllegalArgumentException("queue and strategy are required");
        }
        if (idleTimeout < 0) {
            throw new IllegalArgumentException("idleTimeout must be >= 0, given " + idleTimeout);
        }
        this.queue = queue;
        this.strategy = strategy;
        this.flushCallback = flushCallback;
        this.errorCallback = errorCallback;
        this.idleTimeout = idleTimeout;
        this.consumerTag = ConsumerTags.orRandom(consumerTag);
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.metrics = new MetricsService(
            meterRegistry != null ? meterRegistry : Metrics.globalRegistry,
            this.consumerTag,
            queue.getName()
        );
    }

    @Override
    public void consume(int maxMessages) throws TransportException {
        if (maxMessages < 0) {
            throw new IllegalArgumentException("maxMessages must be >= 0, given " + maxMessages);
        }

        this.target = maxMessages;
        this.blockSize = queue.getChannel().getPrefetchCount();

        if (timestampLastAck == null) {
            timestampLastAck = clock.millis();
        }

        log.info("Consumer {} starting on queue {} (target={}, blockSize={}, idleTimeout={}s)",
            consumerTag, queue.getName(), target, blockSize, idleTimeout);

        try {
            queue.consume(this::onDelivery, consumerTag);
            // Loop left by cancellation: settle what is still pending
            ackOrNackBlock();
        } catch (TransportException e) {
            log.error("Transport failure while consuming from {}: {}", queue.getName(), e.getMessage(), e);
            try {
                ackOrNackBlock();
            } catch (TransportException flushError) {
                log.warn("Could not flush pending block after transport failure: {}", flushError.getMessage());
                e.addSuppressed(flushError);
            }
            queue.getChannel().close();
            throw e;
        }

        log.info("Consumer {} stopped after {} messages", consumerTag, countMessagesConsumed);
    }

    private boolean onDelivery(Envelope envelope) throws TransportException {
        if (strategy.ackMode() == DeliveryStrategy.AckMode.IMMEDIATE) {
            deliverImmediately(envelope);
        } else {
            handleProcessFlag(envelope, deliver(envelope));
        }

        if (countMessagesUnacked > 0
            && (countMessagesUnacked == blockSize || idleTimeoutElapsed(clock.millis()))) {
            ackOrNackBlock();
        }

        if (!keepAlive || (target != 0 && countMessagesConsumed >= target)) {
            ackOrNackBlock();
            shutdown();
            return false;
        }

        return true;
    }

    private DeliveryResult deliver(Envelope envelope) throws TransportException {
        log.debug("Handling delivery of message: routingKey={}, type={}, tag={}",
            envelope.getRoutingKey(), envelope.getType(), envelope.getDeliveryTag());

        long startNanos = System.nanoTime();
        try {
            return strategy.handleDelivery(envelope, this);
        } catch (TransportException e) {
            throw e;
        } catch (Exception e) {
            log.error("Exception during handleDelivery: {}", e.getMessage(), e);
            metrics.recordDeliveryError();
            return handleException(e) ? DeliveryResult.REJECT_REQUEUE : DeliveryResult.REJECT;
        } finally {
            metrics.recordHandleLatency(startNanos);
        }
    }

    private void deliverImmediately(Envelope envelope) throws TransportException {
        countMessagesConsumed++;
        metrics.recordConsumed();
        track(envelope);
        ack();

        long startNanos = System.nanoTime();
        try {
            strategy.handleDelivery(envelope, this);
        } catch (TransportException e) {
            throw e;
        } catch (Exception e) {
            // Already acknowledged: the message is gone either way
            log.error("Exception while handling acknowledged delivery {}: {}",
                envelope.getDeliveryTag(), e.getMessage(), e);
            metrics.recordDeliveryError();
        } finally {
            metrics.recordHandleLatency(startNanos);
        }
    }

    /**
     * Applies a delivery result to the engine state.
     * <p>
     * Every result counts as consumed. Rejections are settled individually; ACK and DEFER join the pending
     * block, and ACK settles it immediately.
     * </p>
     */
    void handleProcessFlag(Envelope envelope, DeliveryResult result) throws TransportException {
        countMessagesConsumed++;
        metrics.recordConsumed();

        boolean pending = switch (result) {
            case REJECT -> {
                queue.nack(envelope.getDeliveryTag(), false, false);
                metrics.recordRejected(1, false);
                log.debug("Rejected message {}", envelope.getDeliveryTag());
                yield false;
            }
            case REJECT_REQUEUE -> {
                queue.nack(envelope.getDeliveryTag(), false, true);
                metrics.recordRejected(1, true);
                log.debug("Rejected and requeued message {}", envelope.getDeliveryTag());
                yield false;
            }
            case ACK, DEFER -> true;
        };

        if (pending) {
            track(envelope);
            if (result == DeliveryResult.ACK) {
                ack();
            }
        }
    }

    private void track(Envelope envelope) {
        countMessagesUnacked++;
        lastDeliveryTag = envelope.getDeliveryTag();
        timestampLastMessage = clock.millis();
    }

    private boolean idleTimeoutElapsed(long nowMillis) {
        return timestampLastAck != null && (nowMillis - timestampLastAck) / 1000.0 > idleTimeout;
    }

    /**
     * Returns true when a failed message (or block) should be requeued.
     *
     * @throws ErrorPolicyException if the error callback itself fails
     */
    boolean handleException(Exception error) {
        if (errorCallback == null) {
            return true;
        }

        Boolean requeue;
        try {
            requeue = errorCallback.onError(error, this);
        } catch (RuntimeException callbackFailure) {
            throw new ErrorPolicyException("The error callback failed while handling: " + error, callbackFailure);
        }

        return requeue == null || requeue;
    }

    /**
     * Decides how the pending block is settled. Without a flush callback the block is acknowledged.
     */
    FlushResult flushDeferred() {
        if (flushCallback == null) {
            return FlushResult.ACK;
        }

        FlushResult result;
        try {
            result = flushCallback.flush(queue);
        } catch (Exception e) {
            log.error("Exception during flushDeferred: {}", e.getMessage(), e);
            metrics.recordFlushError();
            return handleException(e) ? FlushResult.REJECT_REQUEUE : FlushResult.REJECT;
        }

        if (result == null) {
            throw new IllegalStateException("The flush callback must return a FlushResult, given null");
        }
        return result;
    }

    /**
     * Cumulatively acknowledges the pending block.
     */
    void ack() throws TransportException {
        if (lastDeliveryTag == null) {
            return;
        }

        queue.ack(lastDeliveryTag, true);
        log.info("Acknowledged {} messages at {} msg/s", countMessagesUnacked, throughput());
        metrics.recordAcked(countMessagesUnacked);
        resetBlock();
    }

    /**
     * Cumulatively rejects the pending block.
     *
     * @param requeue ask the broker to redeliver the block
     */
    void nackAll(boolean requeue) throws TransportException {
        if (lastDeliveryTag == null) {
            return;
        }

        queue.nack(lastDeliveryTag, true, requeue);
        log.info("Not acknowledged {} messages at {} msg/s", countMessagesUnacked, throughput());
        metrics.recordRejected(countMessagesUnacked, requeue);
        resetBlock();
    }

    private String throughput() {
        long delta = (timestampLastMessage == null || timestampLastAck == null)
            ? 0
            : timestampLastMessage - timestampLastAck;
        double rate = delta > 0 ? countMessagesUnacked / (delta / 1000.0) : 0;
        return String.format("%.0f", rate);
    }

    private void resetBlock() {
        lastDeliveryTag = null;
        countMessagesUnacked = 0;
        timestampLastAck = clock.millis();
    }

    /**
     * Settles the pending block according to {@link #flushDeferred()}; no-op when nothing is pending.
     */
    void ackOrNackBlock() throws TransportException {
        if (lastDeliveryTag == null) {
            return;
        }

        FlushResult result = flushDeferred();
        metrics.recordFlush(result);

        switch (result) {
            case ACK -> ack();
            case REJECT -> nackAll(false);
            case REJECT_REQUEUE -> nackAll(true);
        }
    }

    @Override
    public DeliveryResult handleInternalMessage(Envelope envelope) throws TransportException {
        String type = envelope.getType() == null ? "" : envelope.getType();
        metrics.recordControlMessage(type);

        switch (type) {
            case ControlMessages.SHUTDOWN:
                log.info("Shutdown message received");
                shutdown();
                return DeliveryResult.ACK;

            case ControlMessages.RECONFIGURE:
                log.info("Reconfigure message received");
                ControlMessages.Reconfigure reconfigure;
                try {
                    reconfigure = ControlMessages.Reconfigure.fromJson(envelope.getBody());
                } catch (InvalidControlMessageException e) {
                    log.error("Exception during reconfiguration: {}", e.getMessage());
                    return DeliveryResult.REJECT;
                }

                queue.getChannel().qos(reconfigure.getPrefetchSize(), reconfigure.getPrefetchCount());
                this.idleTimeout = reconfigure.getIdleTimeout();
                this.target = reconfigure.getTarget();
                this.blockSize = reconfigure.getPrefetchCount();
                log.info("Reconfigured: idleTimeout={}s, target={}, prefetchSize={}, prefetchCount={}",
                    idleTimeout, target, reconfigure.getPrefetchSize(), blockSize);
                return DeliveryResult.ACK;

            default:
                log.error("Invalid internal message: {}", type);
                return DeliveryResult.REJECT;
        }
    }

    @Override
    public void shutdown() {
        keepAlive = false;
        if (cancelRequested.compareAndSet(false, true)) {
            log.info("Cancelling subscription {}", consumerTag);
            queue.cancel(consumerTag);
        }
    }

    @Override
    public IQueue queue() {
        return queue;
    }

    @Override
    public String consumerTag() {
        return consumerTag;
    }
}
