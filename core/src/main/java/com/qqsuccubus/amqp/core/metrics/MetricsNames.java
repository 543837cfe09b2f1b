package com.qqsuccubus.amqp.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code amqp.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Deliveries handed to the consumer (including rejected ones).
     * <p>
     * Tags: consumer_tag, queue
     * </p>
     */
    public static final String CONSUMER_CONSUMED_TOTAL = "amqp.consumer.consumed.total";

    /**
     * Counter: Deliveries settled, by outcome.
     * <p>
     * Tags: consumer_tag, queue, outcome (ack/reject/requeue)
     * </p>
     */
    public static final String CONSUMER_SETTLED_TOTAL = "amqp.consumer.settled.total";

    /**
     * Counter: Exceptions raised by delivery or flush handlers.
     * <p>
     * Tags: consumer_tag, queue, stage (delivery/flush)
     * </p>
     */
    public static final String CONSUMER_HANDLER_ERRORS_TOTAL = "amqp.consumer.handler.errors.total";

    /**
     * Counter: Block flushes, by flush result.
     * <p>
     * Tags: consumer_tag, queue, outcome
     * </p>
     */
    public static final String CONSUMER_FLUSHES_TOTAL = "amqp.consumer.flushes.total";

    /**
     * Counter: Control-plane messages, by type.
     * <p>
     * Tags: consumer_tag, queue, type (shutdown/reconfigure/invalid)
     * </p>
     */
    public static final String CONSUMER_CONTROL_TOTAL = "amqp.consumer.control.total";

    /**
     * Timer: Time spent inside the delivery handler.
     * <p>
     * Tags: consumer_tag, queue
     * </p>
     */
    public static final String CONSUMER_HANDLE_LATENCY = "amqp.consumer.handle.latency";

    /**
     * Counter: JSON-RPC replies published, by error code ("0" for results).
     * <p>
     * Tags: queue, code
     * </p>
     */
    public static final String RPC_REPLIES_TOTAL = "amqp.rpc.replies.total";

    /**
     * Counter: JSON-RPC replies whose payload could not be serialized.
     * <p>
     * Tags: queue
     * </p>
     */
    public static final String RPC_SERIALIZATION_FAILURES_TOTAL = "amqp.rpc.serialization.failures.total";
}
