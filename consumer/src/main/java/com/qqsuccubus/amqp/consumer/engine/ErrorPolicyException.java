package com.qqsuccubus.amqp.consumer.engine;

/**
 * The configured error callback itself failed. This is a configuration error and stops the consumer.
 */
public class ErrorPolicyException extends RuntimeException {

    public ErrorPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
