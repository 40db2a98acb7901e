/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.config.ExecutorProducer;
import com.ammann.wearable.enumeration.ParticipantRunStatus;
import com.ammann.wearable.exception.AnalysisInProgressException;
import com.ammann.wearable.exception.MisalignedInputException;
import com.ammann.wearable.model.AnalysisReport;
import com.ammann.wearable.model.CorrelationResult;
import com.ammann.wearable.model.ParticipantAnalysis;
import com.ammann.wearable.model.ParticipantSeries;
import com.ammann.wearable.model.ParticipantStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

/**
 * Orchestrates an analysis run over every participant in the {@link TimeSeriesStore}.
 *
 * <p>Each participant is an independent unit submitted to the participant executor. A unit
 * catches its own failures and reports them as a {@link ParticipantStatus}, so one broken
 * series never stops the run. Cohort correlation is a reduction over the finished units and
 * starts only after every unit has completed.
 *
 * <p>An abort request takes effect between units: units that have not started yet are
 * recorded as {@link ParticipantRunStatus#SKIPPED} and the cohort reduction is left out.
 */
@ApplicationScoped
public class CohortAnalysisService {

    private static final Logger LOG = Logger.getLogger(CohortAnalysisService.class);

    static final String RUN_TIMER = "wearable.analysis.run";
    static final String PARTICIPANT_COUNTER = "wearable.analysis.participants";
    static final String FAILURE_COUNTER = "wearable.analysis.failures";
    static final String EPISODE_COUNTER = "wearable.analysis.episodes";

    private final TimeSeriesStore store;
    private final ParticipantAnalysisService participantAnalysisService;
    private final CorrelationService correlationService;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean abortRequested = new AtomicBoolean();
    private final AtomicReference<String> currentRunId = new AtomicReference<>();
    private final AtomicReference<AnalysisReport> latestReport = new AtomicReference<>();

    @Inject
    public CohortAnalysisService(
            TimeSeriesStore store,
            ParticipantAnalysisService participantAnalysisService,
            CorrelationService correlationService,
            @Named(ExecutorProducer.PARTICIPANT_EXECUTOR) ExecutorService executor,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.participantAnalysisService = participantAnalysisService;
        this.correlationService = correlationService;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs the full analysis over a snapshot of the store and publishes the report as the
     * latest one.
     *
     * @return the finished report
     * @throws AnalysisInProgressException if another run is still executing
     */
    public AnalysisReport runAnalysis() {
        String runId = UUID.randomUUID().toString();
        if (!running.compareAndSet(false, true)) {
            throw new AnalysisInProgressException(String.valueOf(currentRunId.get()));
        }
        currentRunId.set(runId);
        abortRequested.set(false);

        Timer.Sample timer = Timer.start(meterRegistry);
        try {
            AnalysisReport report = execute(runId, store.snapshot());
            latestReport.set(report);
            return report;
        } finally {
            timer.stop(
                    Timer.builder(RUN_TIMER)
                            .description("Duration of complete analysis runs")
                            .register(meterRegistry));
            currentRunId.set(null);
            running.set(false);
        }
    }

    /**
     * Requests that the current run stops handing out participant units.
     *
     * @return {@code true} if a run was in progress
     */
    public boolean requestAbort() {
        if (!running.get()) {
            return false;
        }
        abortRequested.set(true);
        LOG.warnf("Abort requested for analysis run %s", currentRunId.get());
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<AnalysisReport> latestReport() {
        return Optional.ofNullable(latestReport.get());
    }

    AnalysisReport execute(String runId, SortedMap<String, ParticipantSeries> cohort) {
        Instant startedAt = Instant.now();
        LOG.infof("Analysis run %s started for %d participants", runId, cohort.size());

        Map<String, CompletableFuture<UnitOutcome>> units = new LinkedHashMap<>();
        for (ParticipantSeries series : cohort.values()) {
            units.put(
                    series.participantId(),
                    CompletableFuture.supplyAsync(() -> analyzeUnit(series), executor));
        }

        // Barrier: cohort aggregation needs every unit's daily intermediates.
        CompletableFuture.allOf(units.values().toArray(new CompletableFuture<?>[0])).join();

        Map<String, ParticipantStatus> statuses = new LinkedHashMap<>();
        Map<String, ParticipantAnalysis> analyses = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<UnitOutcome>> entry : units.entrySet()) {
            UnitOutcome outcome = entry.getValue().join();
            statuses.put(entry.getKey(), outcome.status());
            if (outcome.analysis() != null) {
                analyses.put(entry.getKey(), outcome.analysis());
            }
            recordUnitMetrics(outcome);
        }

        boolean aborted = abortRequested.get();
        List<CorrelationResult> cohortCorrelations;
        if (aborted) {
            LOG.warnf("Analysis run %s aborted, cohort aggregation skipped", runId);
            cohortCorrelations = List.of();
        } else {
            cohortCorrelations = correlationService.correlateCohort(new ArrayList<>(analyses.values()));
        }

        AnalysisReport report =
                new AnalysisReport(
                        runId,
                        startedAt,
                        Instant.now(),
                        aborted,
                        statuses,
                        analyses,
                        cohortCorrelations);

        LOG.infof(
                "Analysis run %s finished: %d completed, %d insufficient data, %d failed, %d skipped",
                runId,
                report.countByStatus(ParticipantRunStatus.COMPLETED),
                report.countByStatus(ParticipantRunStatus.INSUFFICIENT_DATA),
                report.countByStatus(ParticipantRunStatus.FAILED),
                report.countByStatus(ParticipantRunStatus.SKIPPED));
        return report;
    }

    UnitOutcome analyzeUnit(ParticipantSeries series) {
        String participantId = series.participantId();
        if (abortRequested.get()) {
            return new UnitOutcome(
                    ParticipantStatus.of(participantId, ParticipantRunStatus.SKIPPED), null);
        }
        try {
            ParticipantAnalysis analysis = participantAnalysisService.analyze(series);
            ParticipantRunStatus status =
                    analysis.hasFindings()
                            ? ParticipantRunStatus.COMPLETED
                            : ParticipantRunStatus.INSUFFICIENT_DATA;
            return new UnitOutcome(ParticipantStatus.of(participantId, status), analysis);
        } catch (MisalignedInputException e) {
            LOG.warnf("Participant %s rejected: %s", participantId, e.getMessage());
            return new UnitOutcome(ParticipantStatus.failed(participantId, e), null);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Analysis of participant %s failed", participantId);
            return new UnitOutcome(ParticipantStatus.failed(participantId, e), null);
        }
    }

    private void recordUnitMetrics(UnitOutcome outcome) {
        ParticipantRunStatus status = outcome.status().status();
        Counter.builder(PARTICIPANT_COUNTER)
                .description("Participant analysis units by outcome")
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
        if (status == ParticipantRunStatus.FAILED) {
            Counter.builder(FAILURE_COUNTER)
                    .description("Participant analysis units that failed")
                    .register(meterRegistry)
                    .increment();
        }
        if (outcome.analysis() != null) {
            Counter.builder(EPISODE_COUNTER)
                    .description("Anomaly episodes detected")
                    .register(meterRegistry)
                    .increment(outcome.analysis().episodes().size());
        }
    }

    record UnitOutcome(ParticipantStatus status, ParticipantAnalysis analysis) {}
}
