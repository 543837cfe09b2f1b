package com.qqsuccubus.amqp.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String CONSUMER_TAG = "consumer_tag";

    public static final String QUEUE = "queue";

    /**
     * Tag key for settlement outcome (ack/reject/requeue).
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for the handler stage that failed (delivery/flush).
     */
    public static final String STAGE = "stage";

    /**
     * Tag key for control message type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for JSON-RPC error code.
     */
    public static final String CODE = "code";
}
