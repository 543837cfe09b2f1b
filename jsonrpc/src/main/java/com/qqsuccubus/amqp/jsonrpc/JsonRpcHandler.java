package com.qqsuccubus.amqp.jsonrpc;

/**
 * Application-side request handler.
 */
@FunctionalInterface
public interface JsonRpcHandler {
    /**
     * @param request validated request with a non-null id
     * @return a {@link JsonRpcResponse}, or any other value, which is sent back as the result
     * @throws Exception any failure; reported to the client as an internal error
     */
    Object handle(JsonRpcRequest request) throws Exception;
}
