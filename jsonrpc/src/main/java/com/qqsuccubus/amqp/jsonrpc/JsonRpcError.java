package com.qqsuccubus.amqp.jsonrpc;

import lombok.Value;

import javax.annotation.Nullable;

/**
 * JSON-RPC error object.
 */
@Value
public class JsonRpcError {
    /**
     * Invalid JSON was received.
     */
    public static final int PARSE_ERROR = -32700;

    /**
     * The message is not a valid request (protocol version, content type/encoding, missing id).
     */
    public static final int INVALID_REQUEST = -32600;

    public static final int METHOD_NOT_FOUND = -32601;

    public static final int INVALID_PARAMS = -32602;

    public static final int INTERNAL_ERROR = -32603;

    /**
     * Lower bound of the implementation-defined server error range.
     */
    public static final int SERVER_ERROR_MIN = -32099;

    /**
     * Upper bound of the implementation-defined server error range.
     */
    public static final int SERVER_ERROR_MAX = -32000;

    int code;

    String message;

    @Nullable
    Object data;
}
