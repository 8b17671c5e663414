package com.mouse.oneup.service;

import com.mouse.oneup.enums.LeadEngineType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class EngineMetricsService {

    private final AtomicInteger priced = new AtomicInteger(0);
    private final AtomicInteger insufficientData = new AtomicInteger(0);
    private final AtomicInteger degenerate = new AtomicInteger(0);
    private final AtomicInteger failed = new AtomicInteger(0);
    private final AtomicInteger skipped = new AtomicInteger(0);
    private final Map<LeadEngineType, AtomicInteger> pricedByStrategy = new EnumMap<>(LeadEngineType.class);

    public EngineMetricsService() {
        for (LeadEngineType type : LeadEngineType.values()) {
            pricedByStrategy.put(type, new AtomicInteger(0));
        }
    }

    public void recordPriced(LeadEngineType strategy) {
        priced.incrementAndGet();
        pricedByStrategy.get(strategy).incrementAndGet();
    }

    public void recordInsufficientData() {
        insufficientData.incrementAndGet();
    }

    public void recordDegenerate() {
        degenerate.incrementAndGet();
    }

    public void recordFailure() {
        failed.incrementAndGet();
    }

    public void recordSkipped() {
        skipped.incrementAndGet();
    }

    public Map<String, Object> getMetrics() {
        int total = priced.get() + insufficientData.get() + failed.get();

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("priced", priced.get());
        metrics.put("insufficientData", insufficientData.get());
        metrics.put("degenerate", degenerate.get());
        metrics.put("failed", failed.get());
        metrics.put("skipped", skipped.get());
        metrics.put("successRate", total > 0 ? (priced.get() * 100.0 / total) : 0.0);
        pricedByStrategy.forEach((type, count) -> metrics.put("priced." + type.name(), count.get()));
        return metrics;
    }

    public void logMetrics() {
        Map<String, Object> metrics = getMetrics();
        log.info("📊 1UP Engine Metrics: {}", metrics);

        int failures = failed.get();
        if (failures > 0) {
            log.warn("⚠️ {} pricing request(s) failed", failures);
        }
    }
}
