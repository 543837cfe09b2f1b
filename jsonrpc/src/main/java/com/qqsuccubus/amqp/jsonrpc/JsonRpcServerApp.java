package com.qqsuccubus.amqp.jsonrpc;

import com.qqsuccubus.amqp.consumer.config.ConsumerConfig;
import com.qqsuccubus.amqp.consumer.http.HttpServer;
import com.qqsuccubus.amqp.consumer.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.amqp.consumer.rabbit.RabbitTransport;
import com.qqsuccubus.amqp.consumer.runner.ConsumerRunner;
import com.qqsuccubus.amqp.core.transport.IQueue;
import com.qqsuccubus.amqp.core.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Main entry point for a JSON-RPC server process.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Connect to RabbitMQ and subscribe to {@code QUEUE_NAME}</li>
 *   <li>Answer requests through a {@link JsonRpcHandler}</li>
 *   <li>Accept shutdown/reconfigure control messages</li>
 *   <li>Expose /healthz and /metrics endpoints when {@code HTTP_PORT} is set</li>
 * </ul>
 * </p>
 * <p>
 * Launched directly, the server answers the built-in {@code ping} and {@code echo} methods.
 * </p>
 */
public class JsonRpcServerApp {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcServerApp.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    public static void main(String[] args) {
        try {
            run(ConsumerConfig.fromEnv(), JsonRpcServerApp::builtinMethods);
        } catch (TransportException e) {
            log.error("Server stopped on transport failure: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Runs a server for the given handler in the calling thread until it is shut down.
     *
     * @param config  process configuration
     * @param handler application handler
     * @throws TransportException if the broker connection failed
     */
    public static void run(ConsumerConfig config, JsonRpcHandler handler) throws TransportException {
        String appId = config.getAppId().isBlank() ? config.getQueueName() : config.getAppId();
        MDC.put("appId", appId);

        log.info("Starting JSON-RPC server: {}", appId);
        log.info("  Broker: {}:{}{}", config.getAmqpHost(), config.getAmqpPort(), config.getAmqpVhost());
        log.info("  Queue: {} (prefetch={}, idleTimeout={}s)",
            config.getQueueName(), config.getPrefetchCount(), config.getIdleTimeoutSec());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(appId);

        try (RabbitTransport transport = RabbitTransport.connect(config)) {
            IQueue queue = transport.openQueue(config.getQueueName(), config.getPrefetchCount());

            JsonRpcServer server = JsonRpcServer.builder()
                .queue(queue)
                .handler(handler)
                .appId(appId)
                .returnTrace(config.isReturnTrace())
                .idleTimeout(config.getIdleTimeoutSec())
                .consumerTag(config.getConsumerTag())
                .meterRegistry(metricsExporter.getRegistry())
                .build();

            HttpServer httpServer = config.getHttpPort() > 0
                ? new HttpServer(config.getHttpPort(), server, metricsExporter)
                : null;

            new ConsumerRunner(server, httpServer, SHUTDOWN_GRACE).run(config.getTarget());
        } finally {
            MDC.remove("appId");
        }

        log.info("JSON-RPC server {} stopped", appId);
    }

    static Object builtinMethods(JsonRpcRequest request) {
        String method = request.getMethod() == null ? "" : request.getMethod();
        return switch (method) {
            case "ping" -> "pong";
            case "echo" -> request.getParams();
            default -> JsonRpcResponse.withError(request.getId(),
                new JsonRpcErrorFactory().create(JsonRpcError.METHOD_NOT_FOUND));
        };
    }
}
