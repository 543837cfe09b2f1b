package com.qqsuccubus.amqp.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.amqp.core.util.JsonDecodeException;
import com.qqsuccubus.amqp.core.util.JsonUtils;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * Control-plane messages used by operators to manage a running consumer.
 * <p>
 * A control message is any delivery whose {@code appId} equals {@link #INTERNAL_APP_ID}. The message
 * {@code type} selects the action:
 * <ul>
 *   <li>{@code shutdown}: flush pending acknowledgments, cancel the subscription, stop consuming</li>
 *   <li>{@code reconfigure}: replace idle timeout, target and prefetch settings at runtime</li>
 * </ul>
 * </p>
 */
public final class ControlMessages {
    private ControlMessages() {
    }

    /**
     * Reserved {@code appId} marking control-plane messages.
     */
    public static final String INTERNAL_APP_ID = "com.qqsuccubus.amqp";

    public static final String SHUTDOWN = "shutdown";

    public static final String RECONFIGURE = "reconfigure";

    /**
     * Returns true when the envelope carries a control-plane message.
     *
     * @param envelope received envelope
     * @return whether the envelope was sent with the reserved app id
     */
    public static boolean isInternal(Envelope envelope) {
        return INTERNAL_APP_ID.equals(envelope.getAppId());
    }

    /**
     * Builds a shutdown control message (empty body).
     *
     * @return envelope template, without broker delivery metadata
     */
    public static Envelope shutdown() {
        return Envelope.builder()
            .appId(INTERNAL_APP_ID)
            .type(SHUTDOWN)
            .build();
    }

    /**
     * Builds a reconfigure control message.
     *
     * @param reconfigure new settings
     * @return envelope template, without broker delivery metadata
     */
    public static Envelope reconfigure(Reconfigure reconfigure) {
        return Envelope.builder()
            .appId(INTERNAL_APP_ID)
            .type(RECONFIGURE)
            .contentType("application/json")
            .contentEncoding("UTF-8")
            .body(reconfigure.toJson().getBytes(StandardCharsets.UTF_8))
            .build();
    }

    /**
     * Runtime reconfiguration request.
     * <p>
     * Wire format is a JSON array {@code [idleTimeoutSeconds, target, prefetchSize, prefetchCount]}.
     * All four values are required and must be non-negative; the idle timeout may be fractional
     * (or a numeric string), the other three must be integers.
     * </p>
     */
    @Value
    @Builder(toBuilder = true)
    public static class Reconfigure {
        /**
         * Idle timeout in seconds after which a partial block is flushed.
         */
        double idleTimeout;

        /**
         * Number of messages to consume before stopping (0 = unbounded).
         */
        int target;

        int prefetchSize;

        /**
         * New prefetch count, also used as the batch block size.
         */
        int prefetchCount;

        public String toJson() {
            return JsonUtils.writeValueAsString(new Object[]{idleTimeout, target, prefetchSize, prefetchCount});
        }

        /**
         * Parses and validates a reconfigure body.
         *
         * @param body raw message body
         * @return validated settings
         * @throws InvalidControlMessageException if the body is not a valid 4-tuple
         */
        public static Reconfigure fromJson(byte[] body) {
            JsonNode node;
            try {
                node = JsonUtils.readTree(body);
            } catch (JsonDecodeException e) {
                throw new InvalidControlMessageException("Reconfigure body is not valid JSON", e);
            }

            if (!node.isArray() || node.size() < 4) {
                throw new InvalidControlMessageException(
                    "Reconfigure body must be [idleTimeout, target, prefetchSize, prefetchCount]"
                );
            }

            return Reconfigure.builder()
                .idleTimeout(idleTimeout(node.get(0)))
                .target(nonNegativeInt(node.get(1), "target"))
                .prefetchSize(nonNegativeInt(node.get(2), "prefetchSize"))
                .prefetchCount(nonNegativeInt(node.get(3), "prefetchCount"))
                .build();
        }

        private static double idleTimeout(JsonNode value) {
            double idleTimeout;
            if (value.isNumber()) {
                idleTimeout = value.doubleValue();
            } else if (value.isTextual()) {
                try {
                    idleTimeout = Double.parseDouble(value.textValue().trim());
                } catch (NumberFormatException e) {
                    throw new InvalidControlMessageException("idleTimeout is not numeric: " + value.textValue(), e);
                }
            } else {
                throw new InvalidControlMessageException("idleTimeout is not numeric: " + value);
            }

            if (Double.isNaN(idleTimeout) || Double.isInfinite(idleTimeout) || idleTimeout < 0) {
                throw new InvalidControlMessageException("idleTimeout must be a non-negative number: " + value);
            }
            return idleTimeout;
        }

        private static int nonNegativeInt(JsonNode value, String name) {
            if (!value.isIntegralNumber() || !value.canConvertToInt()) {
                throw new InvalidControlMessageException(name + " must be an integer: " + value);
            }
            int result = value.intValue();
            if (result < 0) {
                throw new InvalidControlMessageException(name + " must be >= 0, given " + result);
            }
            return result;
        }
    }
}
