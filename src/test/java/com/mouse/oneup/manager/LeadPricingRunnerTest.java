package com.mouse.oneup.manager;

import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.enums.MarketFamily;
import com.mouse.oneup.enums.PricingStatus;
import com.mouse.oneup.exception.PricingException;
import com.mouse.oneup.interfaces.PriceRecordSink;
import com.mouse.oneup.model.LeadPriceRecord;
import com.mouse.oneup.model.MarketBook;
import com.mouse.oneup.model.PriceRecordKey;
import com.mouse.oneup.model.PricingRequest;
import com.mouse.oneup.model.RunSummary;
import com.mouse.oneup.service.EngineMetricsService;
import com.mouse.oneup.service.LeadPricingEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeadPricingRunnerTest {

    private static final String VERSION = "oneup/exact-dp/ratio-piecewise-v2";

    @Mock
    private LeadPricingEngine engine;

    @Mock
    private PriceRecordSink sink;

    private EngineMetricsService metrics;
    private LeadPricingRunner runner;

    @BeforeEach
    void setUp() {
        metrics = new EngineMetricsService();
        PricingSettings settings = PricingSettings.builder()
                .calibrationVersion(CalibrationVersion.RATIO_PIECEWISE_V2)
                .runnerWorkers(4)
                .build();
        lenient().when(engine.getEngineVersion()).thenReturn(VERSION);
        runner = new LeadPricingRunner(engine, sink, metrics, settings);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    /* -------------------------- Helpers -------------------------- */

    private static PricingRequest request(String eventId) {
        return PricingRequest.builder()
                .eventId(eventId)
                .snapshotId("SNAP-1")
                .sourceIdentity("sporty")
                .markets(MarketBook.empty())
                .build();
    }

    private static LeadPriceRecord record(PricingRequest request, PricingStatus status) {
        return LeadPriceRecord.builder()
                .status(status)
                .eventId(request.getEventId())
                .snapshotId(request.getSnapshotId())
                .sourceIdentity(request.getSourceIdentity())
                .engineVersion(VERSION)
                .build();
    }

    /* ========================= TESTS ========================= */

    @Test
    @DisplayName("run_pricesEveryRequestAndWritesEachRecord")
    void run_pricesEveryRequestAndWritesEachRecord() {
        List<PricingRequest> requests = List.of(request("E1"), request("E2"), request("E3"));
        for (PricingRequest r : requests) {
            when(engine.price(r)).thenReturn(record(r, PricingStatus.PRICED));
        }

        RunSummary summary = runner.run(requests);

        assertThat(summary).isEqualTo(new RunSummary(3, 0, 0, 0));
        verify(sink, times(3)).write(any(LeadPriceRecord.class));
    }

    @Test
    @DisplayName("run_existingKey_skippedWithoutPricing")
    void run_existingKey_skippedWithoutPricing() {
        PricingRequest done = request("E1");
        PricingRequest fresh = request("E2");
        lenient().when(sink.exists(new PriceRecordKey("E1", "SNAP-1", VERSION, "sporty"))).thenReturn(true);
        when(engine.price(fresh)).thenReturn(record(fresh, PricingStatus.PRICED));

        RunSummary summary = runner.run(List.of(done, fresh));

        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.priced()).isEqualTo(1);
        verify(engine, never()).price(done);
        assertThat(metrics.getMetrics()).containsEntry("skipped", 1);
    }

    @Test
    @DisplayName("run_duplicateRequestInBatch_pricedOnce")
    void run_duplicateRequestInBatch_pricedOnce() {
        PricingRequest r = request("E1");
        when(engine.price(r)).thenReturn(record(r, PricingStatus.PRICED));

        RunSummary summary = runner.run(List.of(r, r));

        assertThat(summary).isEqualTo(new RunSummary(1, 0, 1, 0));
        verify(engine, times(1)).price(r);
    }

    @Test
    @DisplayName("run_oneFailure_othersStillWritten")
    void run_oneFailure_othersStillWritten() {
        PricingRequest ok = request("E1");
        PricingRequest broken = request("E2");
        PricingRequest thin = request("E3");
        when(engine.price(ok)).thenReturn(record(ok, PricingStatus.PRICED));
        when(engine.price(broken)).thenThrow(new PricingException("boom"));
        when(engine.price(thin)).thenReturn(LeadPriceRecord.insufficientData(thin, VERSION, List.of(MarketFamily.TOTAL_GOALS)));

        RunSummary summary = runner.run(List.of(ok, broken, thin));

        assertThat(summary).isEqualTo(new RunSummary(1, 1, 0, 1));
        verify(sink, times(2)).write(any(LeadPriceRecord.class));
        verify(sink, never()).write(argThat(rec -> "E2".equals(rec.getEventId())));
        assertThat(metrics.getMetrics()).containsEntry("failed", 1);
    }

    @Test
    @DisplayName("run_writesHappenOnSingleThread")
    void run_writesHappenOnSingleThread() {
        Set<String> writerThreads = ConcurrentHashMap.newKeySet();
        List<PricingRequest> requests = List.of(request("E1"), request("E2"), request("E3"), request("E4"), request("E5"));
        for (PricingRequest r : requests) {
            when(engine.price(r)).thenReturn(record(r, PricingStatus.PRICED));
        }
        doAnswer(invocation -> {
            writerThreads.add(Thread.currentThread().getName());
            return null;
        }).when(sink).write(any(LeadPriceRecord.class));

        runner.run(requests);

        assertThat(writerThreads).hasSize(1);
    }

    @Test
    @DisplayName("run_failingSink_countedAsFailure")
    void run_failingSink_countedAsFailure() {
        PricingRequest r = request("E1");
        when(engine.price(r)).thenReturn(record(r, PricingStatus.PRICED));
        doThrow(new PricingException("disk full")).when(sink).write(any(LeadPriceRecord.class));

        RunSummary summary = runner.run(List.of(r));

        assertThat(summary).isEqualTo(new RunSummary(0, 0, 0, 1));
        ArgumentCaptor<LeadPriceRecord> captor = ArgumentCaptor.forClass(LeadPriceRecord.class);
        verify(sink).write(captor.capture());
        assertThat(captor.getValue().getEventId()).isEqualTo("E1");
    }
}
