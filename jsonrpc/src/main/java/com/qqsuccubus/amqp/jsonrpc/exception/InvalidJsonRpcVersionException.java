package com.qqsuccubus.amqp.jsonrpc.exception;

public class InvalidJsonRpcVersionException extends JsonRpcProtocolException {

    public InvalidJsonRpcVersionException(String message) {
        super(message);
    }
}
