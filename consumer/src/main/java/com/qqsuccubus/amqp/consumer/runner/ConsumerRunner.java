package com.qqsuccubus.amqp.consumer.runner;

import com.qqsuccubus.amqp.consumer.engine.IConsumer;
import com.qqsuccubus.amqp.consumer.http.HttpServer;
import com.qqsuccubus.amqp.core.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs a consumer in the calling thread and turns process signals into a cooperative shutdown.
 * <p>
 * SIGTERM, SIGINT and SIGHUP start the JVM shutdown hooks; the hook registered here calls
 * {@link IConsumer#shutdown()} and waits (up to the grace period) for the receive loop to flush and return.
 * </p>
 */
public class ConsumerRunner {
    private static final Logger log = LoggerFactory.getLogger(ConsumerRunner.class);

    private final IConsumer consumer;
    @Nullable
    private final HttpServer httpServer;
    private final Duration shutdownGrace;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public ConsumerRunner(IConsumer consumer, @Nullable HttpServer httpServer, Duration shutdownGrace) {
        this.consumer = consumer;
        this.httpServer = httpServer;
        this.shutdownGrace = shutdownGrace;
    }

    /**
     * Consumes until the target is reached, a shutdown is requested or the transport fails.
     *
     * @param maxMessages messages to consume, 0 = unbounded
     * @throws TransportException if the transport failed
     */
    public void run(int maxMessages) throws TransportException {
        MDC.put("consumerTag", consumer.getConsumerTag());
        Thread hook = new Thread(this::handleSignal, "consumer-shutdown-" + consumer.getConsumerTag());
        Runtime.getRuntime().addShutdownHook(hook);

        if (httpServer != null) {
            httpServer.start();
        }

        try {
            consumer.consume(maxMessages);
        } finally {
            stopped.countDown();
            if (httpServer != null) {
                httpServer.stop();
            }
            removeHook(hook);
            MDC.remove("consumerTag");
        }
    }

    /**
     * Signal handler body: request shutdown, then wait for the consume loop to finish.
     */
    void handleSignal() {
        MDC.put("consumerTag", consumer.getConsumerTag());
        log.info("Shutdown signal received, stopping consumer {}", consumer.getConsumerTag());
        consumer.shutdown();

        try {
            if (!stopped.await(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consumer {} did not stop within {}", consumer.getConsumerTag(), shutdownGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for consumer {} to stop", consumer.getConsumerTag());
        }
    }

    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already running the hooks
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}
