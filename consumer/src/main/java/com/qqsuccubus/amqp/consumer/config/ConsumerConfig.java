package com.qqsuccubus.amqp.consumer.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for a consumer process, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ConsumerConfig {

    // Broker connection
    String amqpHost;
    int amqpPort;
    String amqpUser;
    String amqpPassword;
    String amqpVhost;
    int heartbeatSec;
    Duration connectionTimeout;

    // Consumer
    String queueName;
    String consumerTag;     // blank = random
    String appId;           // identity used on published replies
    double idleTimeoutSec;  // flush a partial block after this many idle seconds
    int prefetchCount;      // also the ack block size
    int target;             // messages to consume before stopping, 0 = unbounded
    boolean returnTrace;    // echo stack traces in JSON-RPC errors

    // Ops endpoint, 0 disables it
    int httpPort;

    public static ConsumerConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Builds the configuration from a variable map, applying defaults for missing keys.
     *
     * @param env variables
     * @return configuration
     */
    public static ConsumerConfig fromMap(Map<String, String> env) {
        return ConsumerConfig.builder()
            .amqpHost(get(env, "AMQP_HOST", "localhost"))
            .amqpPort(Integer.parseInt(get(env, "AMQP_PORT", "5672")))
            .amqpUser(get(env, "AMQP_USER", "guest"))
            .amqpPassword(get(env, "AMQP_PASSWORD", "guest"))
            .amqpVhost(get(env, "AMQP_VHOST", "/"))
            .heartbeatSec(Integer.parseInt(get(env, "AMQP_HEARTBEAT_SEC", "0")))
            .connectionTimeout(Duration.ofSeconds(Integer.parseInt(get(env, "AMQP_CONNECTION_TIMEOUT_SEC", "1"))))
            .queueName(get(env, "QUEUE_NAME", "rpc-server"))
            .consumerTag(get(env, "CONSUMER_TAG", ""))
            .appId(get(env, "APP_ID", "amqp-consumer"))
            .idleTimeoutSec(Double.parseDouble(get(env, "IDLE_TIMEOUT_SEC", "5.0")))
            .prefetchCount(Integer.parseInt(get(env, "PREFETCH_COUNT", "3")))
            .target(Integer.parseInt(get(env, "TARGET", "0")))
            .returnTrace(Boolean.parseBoolean(get(env, "RETURN_TRACE", "false")))
            .httpPort(Integer.parseInt(get(env, "HTTP_PORT", "0")))
            .build();
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }
}
