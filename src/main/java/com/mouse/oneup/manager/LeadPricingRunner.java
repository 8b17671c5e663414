package com.mouse.oneup.manager;

import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.interfaces.PriceRecordSink;
import com.mouse.oneup.model.PriceRecordKey;
import com.mouse.oneup.model.PricingRequest;
import com.mouse.oneup.model.RunSummary;
import com.mouse.oneup.service.EngineMetricsService;
import com.mouse.oneup.service.LeadPricingEngine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prices a batch of requests on a fixed worker pool and hands every record to a single
 * writer thread. Requests already present in the sink are skipped; a failing request is
 * logged and counted without stopping the others.
 */
@Slf4j
@Component
public class LeadPricingRunner {

    private static final String EMOJI_START = "🚀";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_SKIP = "⏭️";
    private static final String EMOJI_ERROR = "❌";

    private final LeadPricingEngine engine;
    private final PriceRecordSink sink;
    private final EngineMetricsService metrics;

    private final ExecutorService workerExecutor;
    private final ExecutorService writerExecutor = Executors.newSingleThreadExecutor();

    public LeadPricingRunner(LeadPricingEngine engine, PriceRecordSink sink,
                             EngineMetricsService metrics, PricingSettings settings) {
        this.engine = engine;
        this.sink = sink;
        this.metrics = metrics;
        this.workerExecutor = Executors.newFixedThreadPool(settings.getRunnerWorkers());
    }

    public RunSummary run(List<PricingRequest> requests) {
        log.info("{} Starting 1UP run | Requests: {} | Engine: {}", EMOJI_START, requests.size(), engine.getEngineVersion());

        AtomicInteger priced = new AtomicInteger();
        AtomicInteger insufficient = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        int skipped = 0;

        Set<PriceRecordKey> scheduled = new HashSet<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (PricingRequest request : requests) {
            PriceRecordKey key = new PriceRecordKey(request.getEventId(), request.getSnapshotId(),
                    engine.getEngineVersion(), request.getSourceIdentity());
            if (!scheduled.add(key) || sink.exists(key)) {
                log.debug("{} Already priced | Key: {}", EMOJI_SKIP, key);
                metrics.recordSkipped();
                skipped++;
                continue;
            }
            futures.add(CompletableFuture
                    .supplyAsync(() -> engine.price(request), workerExecutor)
                    .thenAcceptAsync(record -> {
                        sink.write(record);
                        if (record.isPriced()) {
                            priced.incrementAndGet();
                        } else {
                            insufficient.incrementAndGet();
                        }
                    }, writerExecutor)
                    .exceptionally(error -> {
                        failed.incrementAndGet();
                        metrics.recordFailure();
                        log.error("{} Pricing failed | Event: {} | Source: {}", EMOJI_ERROR,
                                request.getEventId(), request.getSourceIdentity(), error);
                        return null;
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        RunSummary summary = new RunSummary(priced.get(), insufficient.get(), skipped, failed.get());
        log.info("{} 1UP run finished | Total: {} | Priced: {} | Insufficient: {} | Skipped: {} | Failed: {}", EMOJI_SUCCESS,
                summary.total(), summary.priced(), summary.insufficientData(), summary.skipped(), summary.failed());
        metrics.logMetrics();
        return summary;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down LeadPricingRunner...");
        workerExecutor.shutdown();
        writerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
            if (!writerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                writerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            writerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("LeadPricingRunner shut down");
    }
}
