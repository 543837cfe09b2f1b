package com.qqsuccubus.amqp.consumer.engine;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Consumer tag helpers.
 */
public final class ConsumerTags {
    private ConsumerTags() {
    }

    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * @return 48 hex characters from 24 random bytes
     */
    public static String random() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static String orRandom(String consumerTag) {
        return consumerTag == null || consumerTag.isBlank() ? random() : consumerTag;
    }
}
