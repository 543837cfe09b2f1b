package com.qqsuccubus.amqp.jsonrpc;

import com.qqsuccubus.amqp.consumer.engine.BatchingConsumer;
import com.qqsuccubus.amqp.consumer.engine.ConsumerTags;
import com.qqsuccubus.amqp.consumer.engine.IConsumer;
import com.qqsuccubus.amqp.core.transport.IQueue;
import com.qqsuccubus.amqp.core.transport.TransportException;
import com.qqsuccubus.amqp.jsonrpc.metrics.RpcMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.Builder;

import javax.annotation.Nullable;
import java.time.Clock;

/**
 * JSON-RPC 2.0 server on top of {@link BatchingConsumer}.
 */
public final class JsonRpcServer implements IConsumer {

    public static final String JSONRPC_VERSION = "2.0";

    /**
     * Message header carrying the protocol version on requests and replies.
     */
    public static final String JSONRPC_HEADER = "jsonrpc";

    private final BatchingConsumer consumer;

    /**
     * @param queue         request queue
     * @param handler       application handler
     * @param errorFactory  error messages, {@link JsonRpcErrorFactory} when null
     * @param appId         app id stamped on replies
     * @param returnTrace   include stack traces in error data
     * @param idleTimeout   seconds, see {@link BatchingConsumer}
     * @param consumerTag   subscription tag, random when blank
     * @param clock         time source, system UTC when null
     * @param meterRegistry metrics registry, global registry when null
     */
    @Builder
    private JsonRpcServer(IQueue queue,
                          JsonRpcHandler handler,
                          @Nullable ErrorFactory errorFactory,
                          @Nullable String appId,
                          boolean returnTrace,
                          double idleTimeout,
                          @Nullable String consumerTag,
                          @Nullable Clock clock,
                          @Nullable MeterRegistry meterRegistry) {
        if (queue == null || handler == null) {
            throw new IllegalArgumentException("queue and handler are required");
        }
        MeterRegistry registry = meterRegistry != null ? meterRegistry : Metrics.globalRegistry;

        JsonRpcDeliveryStrategy strategy = new JsonRpcDeliveryStrategy(
            queue.getChannel().newExchange(),
            handler,
            errorFactory != null ? errorFactory : new JsonRpcErrorFactory(),
            appId == null ? "" : appId,
            returnTrace,
            new RpcMetrics(registry, queue.getName())
        );

        this.consumer = BatchingConsumer.builder()
            .queue(queue)
            .strategy(strategy)
            .idleTimeout(idleTimeout)
            .consumerTag(ConsumerTags.orRandom(consumerTag))
            .clock(clock)
            .meterRegistry(registry)
            .build();
    }

    @Override
    public void consume(int maxMessages) throws TransportException {
        consumer.consume(maxMessages);
    }

    @Override
    public void shutdown() {
        consumer.shutdown();
    }

    @Override
    public boolean isKeepAlive() {
        return consumer.isKeepAlive();
    }

    @Override
    public String getConsumerTag() {
        return consumer.getConsumerTag();
    }
}
