package com.qqsuccubus.amqp.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.amqp.consumer.engine.ConsumerContext;
import com.qqsuccubus.amqp.consumer.engine.DeliveryStrategy;
import com.qqsuccubus.amqp.core.consumer.DeliveryResult;
import com.qqsuccubus.amqp.core.msg.ControlMessages;
import com.qqsuccubus.amqp.core.msg.Envelope;
import com.qqsuccubus.amqp.core.transport.IExchange;
import com.qqsuccubus.amqp.core.transport.MessageAttributes;
import com.qqsuccubus.amqp.core.transport.TransportException;
import com.qqsuccubus.amqp.core.util.JsonDecodeException;
import com.qqsuccubus.amqp.core.util.JsonUtils;
import com.qqsuccubus.amqp.jsonrpc.exception.InvalidJsonRpcRequestException;
import com.qqsuccubus.amqp.jsonrpc.exception.InvalidJsonRpcVersionException;
import com.qqsuccubus.amqp.jsonrpc.metrics.RpcMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request/reply strategy: every delivery is acknowledged up front and answered with exactly one reply.
 * <p>
 * Requests carry the method in the message {@code type}, the id in the correlation id and the params as a
 * UTF-8 JSON body; the {@code jsonrpc} header must be {@value JsonRpcServer#JSONRPC_VERSION}. Replies go to
 * the default exchange with the request's {@code replyTo} as routing key.
 * </p>
 */
public class JsonRpcDeliveryStrategy implements DeliveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcDeliveryStrategy.class);

    static final String APPLICATION_JSON = "application/json";
    static final String UTF_8 = "UTF-8";
    static final String MISSING_ID_MESSAGE = "There was an error in detecting the id in the Request object";

    private static final byte[] SERIALIZATION_FALLBACK =
        "{\"error\":{\"code\":-32603,\"message\":\"Internal error\"}}".getBytes(StandardCharsets.UTF_8);

    private final IExchange replyExchange;
    private final JsonRpcHandler handler;
    private final ErrorFactory errorFactory;
    private final String appId;
    private final boolean returnTrace;
    private final RpcMetrics metrics;

    public JsonRpcDeliveryStrategy(IExchange replyExchange,
                                   JsonRpcHandler handler,
                                   ErrorFactory errorFactory,
                                   String appId,
                                   boolean returnTrace,
                                   RpcMetrics metrics) {
        this.replyExchange = replyExchange;
        this.handler = handler;
        this.errorFactory = errorFactory;
        this.appId = appId;
        this.returnTrace = returnTrace;
        this.metrics = metrics;
    }

    @Override
    public AckMode ackMode() {
        return AckMode.IMMEDIATE;
    }

    @Override
    public DeliveryResult handleDelivery(Envelope envelope, ConsumerContext context) throws TransportException {
        if (ControlMessages.isInternal(envelope)) {
            DeliveryResult result = context.handleInternalMessage(envelope);
            JsonRpcResponse response = result == DeliveryResult.ACK
                ? JsonRpcResponse.withResult(envelope.getCorrelationId(), "OK")
                : JsonRpcResponse.withError(envelope.getCorrelationId(),
                    errorFactory.create(JsonRpcError.METHOD_NOT_FOUND));
            sendReply(response, envelope);
            return result;
        }

        sendReply(dispatch(envelope), envelope);
        return DeliveryResult.ACK;
    }

    /**
     * Decodes and handles a request. Never throws: every failure becomes an error response.
     */
    JsonRpcResponse dispatch(Envelope envelope) {
        String correlationId = envelope.getCorrelationId();
        try {
            JsonRpcRequest request = requestFromEnvelope(envelope);
            if (request.getId() == null) {
                return JsonRpcResponse.withError(correlationId,
                    errorFactory.create(JsonRpcError.INVALID_REQUEST, MISSING_ID_MESSAGE, null));
            }

            Object result = handler.handle(request);
            if (result instanceof JsonRpcResponse response) {
                return response;
            }
            return JsonRpcResponse.withResult(correlationId, result);
        } catch (InvalidJsonRpcVersionException e) {
            log.error("Invalid json rpc version: {}", e.getMessage());
            return errorResponse(correlationId, JsonRpcError.INVALID_REQUEST, e);
        } catch (InvalidJsonRpcRequestException e) {
            log.error("Invalid json rpc request: {}", e.getMessage());
            return errorResponse(correlationId, JsonRpcError.INVALID_REQUEST, e);
        } catch (JsonDecodeException e) {
            log.error("Json parse error: {}", e.getMessage());
            return errorResponse(correlationId, JsonRpcError.PARSE_ERROR, e);
        } catch (Throwable e) {
            log.error("Exception occurred while handling {} (id={}, routingKey={}, replyTo={}): {}",
                envelope.getType(), correlationId, envelope.getRoutingKey(), envelope.getReplyTo(),
                e.getMessage(), e);
            return errorResponse(correlationId, JsonRpcError.INTERNAL_ERROR, e);
        }
    }

    private JsonRpcResponse errorResponse(@Nullable String correlationId, int code, Throwable e) {
        Object data = returnTrace ? stackTrace(e) : null;
        return JsonRpcResponse.withError(correlationId, errorFactory.create(code, null, data));
    }

    /**
     * Validates protocol headers and decodes a request.
     *
     * @throws InvalidJsonRpcVersionException if the {@code jsonrpc} header is missing or not 2.0
     * @throws InvalidJsonRpcRequestException if the body is not UTF-8 encoded JSON
     * @throws JsonDecodeException            if the body cannot be parsed
     */
    JsonRpcRequest requestFromEnvelope(Envelope envelope) {
        Object version = envelope.getHeader(JsonRpcServer.JSONRPC_HEADER);
        if (version == null || !JsonRpcServer.JSONRPC_VERSION.equals(version.toString())) {
            throw new InvalidJsonRpcVersionException("Expected jsonrpc header " + JsonRpcServer.JSONRPC_VERSION
                + ", given " + version);
        }

        if (!UTF_8.equals(envelope.getContentEncoding())
            || !APPLICATION_JSON.equals(envelope.getContentType())) {
            throw new InvalidJsonRpcRequestException("Expected " + APPLICATION_JSON + " in " + UTF_8
                + ", given " + envelope.getContentType() + " in " + envelope.getContentEncoding());
        }

        JsonNode params = JsonUtils.readTree(envelope.getBody());
        String id = envelope.getCorrelationId();

        return JsonRpcRequest.builder()
            .target(envelope.getExchangeName())
            .method(envelope.getType())
            .params(params)
            .id(id == null || id.isBlank() ? null : id)
            .routingKey(envelope.getRoutingKey())
            .expiration(parseExpiration(envelope.getExpiration()))
            .timestamp(envelope.getTimestamp())
            .build();
    }

    private static int parseExpiration(@Nullable String expiration) {
        if (expiration == null || expiration.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(expiration.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric expiration {}", expiration);
            return 0;
        }
    }

    /**
     * Publishes the reply for a request. Falls back to a canned internal error when the payload cannot be
     * serialized.
     */
    void sendReply(JsonRpcResponse response, Envelope envelope) throws TransportException {
        MessageAttributes attributes = MessageAttributes.builder()
            .contentType(APPLICATION_JSON)
            .contentEncoding(UTF_8)
            .deliveryMode(MessageAttributes.PERSISTENT)
            .correlationId(envelope.getCorrelationId())
            .appId(appId)
            .header(JsonRpcServer.JSONRPC_HEADER, JsonRpcServer.JSONRPC_VERSION)
            .build();

        int code = response.isError() ? response.getError().getCode() : 0;
        byte[] body;
        try {
            body = JsonUtils.writeValueAsBytes(payload(response));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize reply to {}: {}", envelope.getCorrelationId(), e.getMessage());
            metrics.recordSerializationFailure();
            body = SERIALIZATION_FALLBACK;
            code = JsonRpcError.INTERNAL_ERROR;
        }

        String replyTo = envelope.getReplyTo() == null ? "" : envelope.getReplyTo();
        replyExchange.publish(body, replyTo, attributes);
        metrics.recordReply(code);
        log.debug("Sent reply to {} (correlationId={}, code={})", replyTo, envelope.getCorrelationId(), code);
    }

    private static Map<String, Object> payload(JsonRpcResponse response) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (response.isError()) {
            JsonRpcError error = response.getError();
            Map<String, Object> errorPayload = new LinkedHashMap<>();
            errorPayload.put("code", error.getCode());
            errorPayload.put("message", error.getMessage());
            if (error.getData() != null) {
                errorPayload.put("data", error.getData());
            }
            payload.put("error", errorPayload);
        } else {
            payload.put("result", response.getResult());
        }
        return payload;
    }

    private static String stackTrace(Throwable e) {
        StringWriter writer = new StringWriter();
        e.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
