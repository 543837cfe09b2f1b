package com.qqsuccubus.amqp.jsonrpc;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * JSON-RPC response: either a result or an error, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JsonRpcResponse {

    @Nullable
    String id;

    @Nullable
    Object result;

    @Nullable
    JsonRpcError error;

    public static JsonRpcResponse withResult(@Nullable String id, @Nullable Object result) {
        return new JsonRpcResponse(id, result, null);
    }

    public static JsonRpcResponse withError(@Nullable String id, JsonRpcError error) {
        if (error == null) {
            throw new IllegalArgumentException("error is required");
        }
        return new JsonRpcResponse(id, null, error);
    }

    public boolean isError() {
        return error != null;
    }
}
