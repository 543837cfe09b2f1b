package com.qqsuccubus.amqp.consumer.http;

import com.qqsuccubus.amqp.consumer.engine.IConsumer;
import com.qqsuccubus.amqp.consumer.metrics.PrometheusMetricsExporter;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;

/**
 * Ops endpoint of a consumer process.
 * <ul>
 *   <li>{@code GET /healthz}: 200 while consuming, 503 once a shutdown was requested</li>
 *   <li>{@code GET /metrics}: Prometheus scrape</li>
 *   <li>{@code POST /shutdown}: same effect as a shutdown control message</li>
 * </ul>
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final int port;
    private final IConsumer consumer;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(port)
            .option(ChannelOption.SO_REUSEADDR, true)
            .route(routes -> routes
                .get("/healthz", (req, res) -> consumer.isKeepAlive()
                    ? res.status(200).sendString(Mono.just("OK"))
                    : res.status(503).sendString(Mono.just("Stopping")))
                .get("/metrics", (req, res) ->
                    res.header(HttpHeaderNames.CONTENT_TYPE, "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.fromSupplier(metricsExporter::scrape))
                )
                .post("/shutdown", (req, res) -> {
                    log.info("Shutdown requested over HTTP for consumer {}", consumer.getConsumerTag());
                    consumer.shutdown();
                    return res.status(202).sendString(Mono.just("Stopping " + consumer.getConsumerTag()));
                })
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("Ops HTTP server listening on port {}", server.port());
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(10));
            server = null;
        }
    }
}
