package com.power.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    // one gauge per model tag, registered on first publish
    private final Map<String, AtomicLong> publishedModelVersions = new ConcurrentHashMap<>();

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTraining(String tag, String outcome) {
        Counter.builder("training.count")
                .tag("tag", tag)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRowsParsed(String operation, int parsed, int dropped) {
        Counter.builder("parser.rows")
                .tag("operation", operation)
                .tag("status", "parsed")
                .register(registry)
                .increment(parsed);
        Counter.builder("parser.rows")
                .tag("operation", operation)
                .tag("status", "dropped")
                .register(registry)
                .increment(dropped);
    }

    public void recordPrediction(String operation, int totalRecords, int anomalyCount) {
        Counter.builder("prediction.count")
                .tag("operation", operation)
                .register(registry)
                .increment();

        DistributionSummary.builder("prediction.records")
                .tag("operation", operation)
                .register(registry)
                .record(totalRecords);

        Counter.builder("prediction.anomalies")
                .tag("operation", operation)
                .register(registry)
                .increment(anomalyCount);
    }

    public void updatePublishedModelVersion(String tag, long version) {
        publishedModelVersions.computeIfAbsent(tag, t -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder("model.published.version", holder, AtomicLong::get)
                    .tag("tag", t)
                    .register(registry);
            return holder;
        }).set(version);
    }
}
