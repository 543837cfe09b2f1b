package com.qqsuccubus.amqp.jsonrpc.exception;

/**
 * A delivery does not conform to the JSON-RPC over AMQP conventions.
 */
public class JsonRpcProtocolException extends RuntimeException {

    public JsonRpcProtocolException(String message) {
        super(message);
    }
}
