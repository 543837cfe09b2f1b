package com.qqsuccubus.amqp.core.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Message properties attached to a published message.
 */
@Value
@Builder(toBuilder = true)
public class MessageAttributes {
    /**
     * Delivery mode value for messages that survive a broker restart.
     */
    public static final int PERSISTENT = 2;

    String contentType;

    String contentEncoding;

    /**
     * 1 = transient, 2 = persistent.
     */
    int deliveryMode;

    String correlationId;

    String appId;

    @Singular
    Map<String, Object> headers;
}
