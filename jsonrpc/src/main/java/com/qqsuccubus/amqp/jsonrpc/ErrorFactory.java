package com.qqsuccubus.amqp.jsonrpc;

import javax.annotation.Nullable;

/**
 * Creates the error objects sent back to clients.
 */
public interface ErrorFactory {
    /**
     * @param code    JSON-RPC error code
     * @param message message, null for the factory's default message for the code
     * @param data    additional data, may be null
     * @return error object
     */
    JsonRpcError create(int code, @Nullable String message, @Nullable Object data);

    default JsonRpcError create(int code) {
        return create(code, null, null);
    }
}
