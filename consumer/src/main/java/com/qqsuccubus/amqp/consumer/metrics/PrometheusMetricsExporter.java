package com.qqsuccubus.amqp.consumer.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the process-wide Micrometer registry in Prometheus text format.
 * <p>
 * Consumer meters are registered on {@link Metrics#globalRegistry}; the Prometheus registry is added to it as a
 * child so every meter created afterwards is scrapeable. All meters carry an {@code app_id} tag.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String appId) {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId is required for the app_id metrics tag");
        }

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Metrics.globalRegistry.add(prometheusRegistry);
        Metrics.globalRegistry.config().commonTags("app_id", appId);
        this.registry = Metrics.globalRegistry;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new UptimeMetrics().bindTo(registry);
        log.info("Prometheus exporter attached to the global registry (app_id={})", appId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
