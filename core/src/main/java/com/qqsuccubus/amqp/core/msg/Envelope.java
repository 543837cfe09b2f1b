package com.qqsuccubus.amqp.core.msg;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable view of one broker delivery: payload plus delivery metadata.
 * <p>
 * Produced by the transport for every delivery and only read by the consumer engine.
 * </p>
 * <p>
 * <b>Delivery tag:</b> monotonic per channel. Acknowledging a tag with the "multiple" flag settles
 * every older unacknowledged delivery on the same channel as well.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Envelope {
    /**
     * Opaque payload bytes.
     */
    @Builder.Default
    byte[] body = new byte[0];

    String routingKey;

    /**
     * Exchange the message was published to (empty string for the default exchange).
     */
    String exchangeName;

    /**
     * Free-text message kind. For JSON-RPC requests this is the method name.
     */
    String type;

    /**
     * Sender identity tag.
     */
    String appId;

    String correlationId;

    String replyTo;

    /**
     * Per-channel delivery identifier used for ack/nack.
     */
    long deliveryTag;

    String contentType;

    String contentEncoding;

    /**
     * Per-message TTL as sent by the publisher (milliseconds, string encoded on the wire).
     */
    String expiration;

    Instant timestamp;

    @Singular
    Map<String, Object> headers;

    /**
     * Returns a header value, or {@code null} when the header is absent.
     *
     * @param name header name
     * @return header value
     */
    @Nullable
    public Object getHeader(String name) {
        return headers.get(name);
    }

    /**
     * @return copy of the payload bytes
     */
    public byte[] getBody() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
