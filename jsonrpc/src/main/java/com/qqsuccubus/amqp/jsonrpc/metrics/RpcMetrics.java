package com.qqsuccubus.amqp.jsonrpc.metrics;

import com.qqsuccubus.amqp.core.metrics.MetricsNames;
import com.qqsuccubus.amqp.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Metrics for JSON-RPC replies.
 */
public class RpcMetrics {

    private final MeterRegistry registry;
    private final String queueName;
    private final Counter serializationFailures;

    public RpcMetrics(MeterRegistry registry, String queueName) {
        this.registry = registry;
        this.queueName = queueName;

        serializationFailures = Counter.builder(MetricsNames.RPC_SERIALIZATION_FAILURES_TOTAL)
            .tag(MetricsTags.QUEUE, queueName)
            .description("Replies replaced by the canned internal error payload")
            .register(registry);
    }

    /**
     * Counts a published reply.
     *
     * @param code error code, 0 for a result
     */
    public void recordReply(int code) {
        Counter.builder(MetricsNames.RPC_REPLIES_TOTAL)
            .tag(MetricsTags.QUEUE, queueName)
            .tag(MetricsTags.CODE, Integer.toString(code))
            .description("JSON-RPC replies published")
            .register(registry)
            .increment();
    }

    public void recordSerializationFailure() {
        serializationFailures.increment();
    }
}
