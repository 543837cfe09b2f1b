package com.qqsuccubus.amqp.jsonrpc;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Default error factory using the messages defined by the JSON-RPC 2.0 specification.
 */
public class JsonRpcErrorFactory implements ErrorFactory {

    private static final Map<Integer, String> MESSAGES = Map.of(
        JsonRpcError.PARSE_ERROR, "Parse error",
        JsonRpcError.INVALID_REQUEST, "Invalid Request",
        JsonRpcError.METHOD_NOT_FOUND, "Method not found",
        JsonRpcError.INVALID_PARAMS, "Invalid params",
        JsonRpcError.INTERNAL_ERROR, "Internal error"
    );

    @Override
    public JsonRpcError create(int code, @Nullable String message, @Nullable Object data) {
        if (message == null) {
            message = defaultMessage(code);
        }
        return new JsonRpcError(code, message, data);
    }

    private static String defaultMessage(int code) {
        String message = MESSAGES.get(code);
        if (message != null) {
            return message;
        }
        if (code >= JsonRpcError.SERVER_ERROR_MIN && code <= JsonRpcError.SERVER_ERROR_MAX) {
            return "Server error";
        }
        throw new IllegalArgumentException("No default message for error code " + code + ", a message is required");
    }
}
