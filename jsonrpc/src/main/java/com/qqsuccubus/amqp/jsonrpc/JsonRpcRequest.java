package com.qqsuccubus.amqp.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * JSON-RPC request decoded from a queue delivery.
 */
@Value
@Builder(toBuilder = true)
public class JsonRpcRequest {
    /**
     * Destination service (the exchange the request was published to).
     */
    String target;

    /**
     * Method name, carried in the message {@code type}.
     */
    String method;

    /**
     * Decoded message body.
     */
    JsonNode params;

    /**
     * Request id, carried in the message correlation id. Null for notifications.
     */
    @Nullable
    String id;

    String routingKey;

    /**
     * Message TTL in milliseconds, 0 when absent.
     */
    int expiration;

    @Nullable
    Instant timestamp;
}
