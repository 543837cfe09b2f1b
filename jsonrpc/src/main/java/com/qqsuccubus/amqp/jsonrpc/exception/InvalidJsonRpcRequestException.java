package com.qqsuccubus.amqp.jsonrpc.exception;

public class InvalidJsonRpcRequestException extends JsonRpcProtocolException {

    public InvalidJsonRpcRequestException(String message) {
        super(message);
    }
}
