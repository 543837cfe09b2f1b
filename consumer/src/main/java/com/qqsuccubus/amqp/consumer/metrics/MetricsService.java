package com.qqsuccubus.amqp.consumer.metrics;

import com.qqsuccubus.amqp.core.consumer.FlushResult;
import com.qqsuccubus.amqp.core.metrics.MetricsNames;
import com.qqsuccubus.amqp.core.metrics.MetricsTags;
import com.qqsuccubus.amqp.core.msg.ControlMessages;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized metrics for one consumer instance.
 */
public class MetricsService {

    static final String INVALID_CONTROL_TYPE = "invalid";

    private final Counter consumed;

    // Settlement counters
    private final Counter acked;
    private final Counter rejected;
    private final Counter requeued;

    private final Counter deliveryErrors;
    private final Counter flushErrors;

    private final Map<FlushResult, Counter> flushes = new EnumMap<>(FlushResult.class);
    private final Map<String, Counter> controlMessages = new HashMap<>();

    private final MeterRegistry registry;
    private final String consumerTag;
    private final String queueName;

    private final Timer handleLatency;

    public MetricsService(MeterRegistry registry, String consumerTag, String queueName) {
        this.registry = registry;
        this.consumerTag = consumerTag;
        this.queueName = queueName;

        consumed = Counter.builder(MetricsNames.CONSUMER_CONSUMED_TOTAL)
            .tag(MetricsTags.CONSUMER_TAG, consumerTag)
            .tag(MetricsTags.QUEUE, queueName)
            .description("Deliveries handed to the consumer")
            .register(registry);

        acked = settled("ack", "Deliveries acknowledged");
        rejected = settled("reject", "Deliveries rejected without requeue");
        requeued = settled("requeue", "Deliveries rejected and requeued");

        deliveryErrors = handlerErrors("delivery");
        flushErrors = handlerErrors("flush");

        for (FlushResult result : FlushResult.values()) {
            flushes.put(result, Counter.builder(MetricsNames.CONSUMER_FLUSHES_TOTAL)
                .tag(MetricsTags.CONSUMER_TAG, consumerTag)
                .tag(MetricsTags.QUEUE, queueName)
                .tag(MetricsTags.OUTCOME, result.name().toLowerCase())
                .description("Deferred block flushes")
                .register(registry));
        }

        for (String type : new String[]{ControlMessages.SHUTDOWN, ControlMessages.RECONFIGURE, INVALID_CONTROL_TYPE}) {
            controlMessages.put(type, Counter.builder(MetricsNames.CONSUMER_CONTROL_TOTAL)
                .tag(MetricsTags.CONSUMER_TAG, consumerTag)
                .tag(MetricsTags.QUEUE, queueName)
                .tag(MetricsTags.TYPE, type)
                .description("Control-plane messages received")
                .register(registry));
        }

        handleLatency = Timer.builder(MetricsNames.CONSUMER_HANDLE_LATENCY)
            .tag(MetricsTags.CONSUMER_TAG, consumerTag)
            .tag(MetricsTags.QUEUE, queueName)
            .description("Time spent in the delivery handler")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofMillis(1000)
            )
            .register(registry);
    }

    private Counter settled(String outcome, String description) {
        return Counter.builder(MetricsNames.CONSUMER_SETTLED_TOTAL)
            .tag(MetricsTags.CONSUMER_TAG, consumerTag)
            .tag(MetricsTags.QUEUE, queueName)
            .tag(MetricsTags.OUTCOME, outcome)
            .description(description)
            .register(registry);
    }

    private Counter handlerErrors(String stage) {
        return Counter.builder(MetricsNames.CONSUMER_HANDLER_ERRORS_TOTAL)
            .tag(MetricsTags.CONSUMER_TAG, consumerTag)
            .tag(MetricsTags.QUEUE, queueName)
            .tag(MetricsTags.STAGE, stage)
            .description("Exceptions raised by consumer handlers")
            .register(registry);
    }

    public void recordConsumed() {
        consumed.increment();
    }

    public void recordAcked(int count) {
        acked.increment(count);
    }

    public void recordRejected(int count, boolean requeue) {
        if (requeue) {
            requeued.increment(count);
        } else {
            rejected.increment(count);
        }
    }

    public void recordDeliveryError() {
        deliveryErrors.increment();
    }

    public void recordFlushError() {
        flushErrors.increment();
    }

    public void recordFlush(FlushResult result) {
        flushes.get(result).increment();
    }

    /**
     * Counts a control-plane message. Unknown types share the {@code invalid} tag.
     *
     * @param type control message type as received
     */
    public void recordControlMessage(String type) {
        String tag = ControlMessages.SHUTDOWN.equals(type) || ControlMessages.RECONFIGURE.equals(type)
            ? type
            : INVALID_CONTROL_TYPE;
        controlMessages.get(tag).increment();
    }

    /**
     * Records time spent in the delivery handler.
     *
     * @param startNanos start nanos
     */
    public void recordHandleLatency(long startNanos) {
        handleLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
