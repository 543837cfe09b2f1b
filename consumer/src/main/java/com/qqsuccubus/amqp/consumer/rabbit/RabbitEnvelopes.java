package com.qqsuccubus.amqp.consumer.rabbit;

import com.qqsuccubus.amqp.core.msg.Envelope;
import com.qqsuccubus.amqp.core.transport.MessageAttributes;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;

import java.util.HashMap;
import java.util.Map;

/**
 * Conversions between amqp-client types and the transport-neutral message model.
 */
public final class RabbitEnvelopes {
    private RabbitEnvelopes() {
    }

    public static Envelope toEnvelope(com.rabbitmq.client.Envelope envelope,
                                      AMQP.BasicProperties properties,
                                      byte[] body) {
        Envelope.EnvelopeBuilder builder = Envelope.builder()
            .body(body != null ? body : new byte[0])
            .deliveryTag(envelope.getDeliveryTag())
            .routingKey(envelope.getRoutingKey())
            .exchangeName(envelope.getExchange());

        if (properties != null) {
            builder.type(properties.getType())
                .appId(properties.getAppId())
                .correlationId(properties.getCorrelationId())
                .replyTo(properties.getReplyTo())
                .contentType(properties.getContentType())
                .contentEncoding(properties.getContentEncoding())
                .expiration(properties.getExpiration())
                .timestamp(properties.getTimestamp() != null ? properties.getTimestamp().toInstant() : null);

            if (properties.getHeaders() != null) {
                properties.getHeaders().forEach((name, value) -> builder.header(name, headerValue(value)));
            }
        }

        return builder.build();
    }

    public static AMQP.BasicProperties toProperties(MessageAttributes attributes) {
        Map<String, Object> headers = new HashMap<>(attributes.getHeaders());
        return new AMQP.BasicProperties.Builder()
            .contentType(attributes.getContentType())
            .contentEncoding(attributes.getContentEncoding())
            .deliveryMode(attributes.getDeliveryMode() > 0 ? attributes.getDeliveryMode() : null)
            .correlationId(attributes.getCorrelationId())
            .appId(attributes.getAppId())
            .headers(headers)
            .build();
    }

    // amqp-client hands string headers over as LongString
    private static Object headerValue(Object value) {
        return value instanceof LongString ? value.toString() : value;
    }
}
