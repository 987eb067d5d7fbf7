package com.example.paperdigest.orchestrator;

import com.example.paperdigest.agent.RelevanceFilterAgent;
import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.DailyReport;
import com.example.paperdigest.model.ExtractionBatch;
import com.example.paperdigest.model.FilterResult;
import com.example.paperdigest.model.PeriodTrend;
import com.example.paperdigest.model.Resolution;
import com.example.paperdigest.model.RunOutcome;
import com.example.paperdigest.model.RunRequest;
import com.example.paperdigest.model.SpotlightItem;
import com.example.paperdigest.model.UsageSummary;
import com.example.paperdigest.port.ArchivePersistenceException;
import com.example.paperdigest.port.ArchivePort;
import com.example.paperdigest.service.AuditTrail;
import com.example.paperdigest.service.CallBudget;
import com.example.paperdigest.service.SpotlightScorer;
import com.example.paperdigest.service.TimeWindowResolver;
import com.example.paperdigest.service.TrendAggregator;
import com.example.paperdigest.thread.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Daily digest pipeline.
 * Pipeline:
 * 1. Period resolution and harvest (no LLM)
 * 2. Two-stage relevance filtering
 * 3. Structured extraction of the selected papers
 * 4. Day trend, then week/month trends and spotlight in parallel
 * 5. Report assembly
 * 6. Single archive write
 * <p>
 * Runs are serialized: a second request while one is running fails fast.
 */
@Service
public class DigestPipelineCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DigestPipelineCoordinator.class);

    public static final String MDC_RUN_ID = "runId";

    private final TimeWindowResolver resolver;
    private final RelevanceFilterAgent filterAgent;
    private final ExtractionOrchestrator extractionOrchestrator;
    private final TrendAggregator trendAggregator;
    private final SpotlightScorer spotlightScorer;
    private final ArchivePort archive;
    private final CallBudget budget;
    private final DigestProperties properties;
    private final ExecutorService stageExecutor;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    public DigestPipelineCoordinator(TimeWindowResolver resolver,
                                     RelevanceFilterAgent filterAgent,
                                     ExtractionOrchestrator extractionOrchestrator,
                                     TrendAggregator trendAggregator,
                                     SpotlightScorer spotlightScorer,
                                     ArchivePort archive,
                                     CallBudget budget,
                                     DigestProperties properties,
                                     @Qualifier("stageExecutor") ExecutorService stageExecutor,
                                     Clock clock) {
        this.resolver = resolver;
        this.filterAgent = filterAgent;
        this.extractionOrchestrator = extractionOrchestrator;
        this.trendAggregator = trendAggregator;
        this.spotlightScorer = spotlightScorer;
        this.archive = archive;
        this.budget = budget;
        this.properties = properties;
        this.stageExecutor = stageExecutor;
        this.clock = clock;
    }

    /**
     * Runs the whole pipeline once.
     *
     * @throws RunInProgressException       if another run holds the lock
     * @throws ArchivePersistenceException  if the report could not be written
     */
    public RunOutcome run(RunRequest request) {
        if (!runLock.tryLock()) {
            throw new RunInProgressException("A digest run is already in progress");
        }
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        try {
            return execute(request != null ? request : RunRequest.auto());
        } finally {
            MDC.remove(MDC_RUN_ID);
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    private RunOutcome execute(RunRequest request) {
        DigestProperties.Run runConfig = properties.run();
        budget.start(runConfig.maxCalls(), runConfig.maxTokens());
        Instant startedAt = clock.instant();
        Duration wallClock = runConfig.wallClockBudget();
        Instant deadline = wallClock != null && !wallClock.isZero() && !wallClock.isNegative()
                ? startedAt.plus(wallClock)
                : null;
        AuditTrail audit = new AuditTrail(clock);

        log.info("═══════════════════════════════════════════════");
        log.info("Starting digest run (date={}, dryRun={}, deadline={})",
                request.hasPinnedDate() ? request.date() : "auto", request.dryRun(), deadline);
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Resolution ──
        log.info("[1/6] Resolving the update period...");
        Resolution resolution = resolver.resolve(request, audit);
        if (!resolution.resolved()) {
            log.info("[1/6] No update found after {} probes, nothing to do", resolution.probes());
            return RunOutcome.noUpdate(resolution.probes());
        }
        log.info("[1/6] Resolved {} ({}): {} candidates in [{}, {})", resolution.dateLabel(),
                resolution.mode(), resolution.candidates().size(), resolution.start(), resolution.end());

        if (request.dryRun()) {
            log.info("Dry run: stopping after harvest");
            return RunOutcome.dryRun(resolution.dateLabel(), resolution.candidates(), resolution.probes());
        }

        // ── Step 2: Relevance filtering ──
        log.info("[2/6] Filtering {} candidates...", resolution.candidates().size());
        FilterResult filtered = filterAgent.filter(resolution.candidates(), request.maxSelected(), deadline, audit);
        log.info("[2/6] {} selected", filtered.selected().size());

        // ── Step 3: Extraction ──
        log.info("[3/6] Extracting {} papers...", filtered.selected().size());
        ExtractionBatch batch = extractionOrchestrator.extract(filtered, deadline, audit);
        log.info("[3/6] {} records, {} failures", batch.records().size(), batch.failures().size());

        // ── Step 4: Trends and spotlight ──
        log.info("[4/6] Trends and spotlight...");
        LocalDate reportDate = LocalDate.parse(resolution.dateLabel());
        PeriodTrend dayTrend = trendAggregator.dayTrend(reportDate, batch.records(), audit);

        CompletableFuture<TrendAggregator.Rollups> rollupsFuture = CompletableFuture.supplyAsync(
                MdcContext.wrapSupplier(() -> trendAggregator.rollups(reportDate, batch.records(), audit)),
                stageExecutor);
        CompletableFuture<List<SpotlightItem>> spotlightFuture = CompletableFuture.supplyAsync(
                MdcContext.wrapSupplier(() -> spotlightScorer.spotlight(batch.records(), resolution.end(), deadline, audit)),
                stageExecutor);

        TrendAggregator.Rollups rollups = join(rollupsFuture);
        List<SpotlightItem> spotlight = join(spotlightFuture);
        log.info("[4/6] Weekly: {}, monthly: {}, spotlight: {} papers",
                describe(rollups.weekly()), describe(rollups.monthly()), spotlight.size());

        // ── Step 5: Assembly ──
        log.info("[5/6] Assembling report...");
        UsageSummary usage = budget.snapshot();
        DailyReport report = new DailyReport(
                resolution.dateLabel(),
                clock.instant(),
                resolution.start(),
                resolution.end(),
                resolution.mode(),
                runConfig.domain(),
                properties.search().categories(),
                properties.search().keywordsInclude(),
                resolution.candidates().size(),
                dayTrend,
                batch.records(),
                batch.failures(),
                filtered.judgments(),
                rollups.weekly(),
                rollups.monthly(),
                spotlight,
                audit.entries(),
                usage);

        // ── Step 6: Persistence ──
        log.info("[6/6] Writing report {}...", reportDate);
        try {
            archive.write(reportDate, report);
        } catch (ArchivePersistenceException e) {
            log.error("[6/6] Report {} could not be written, run failed", reportDate, e);
            throw e;
        }

        log.info("═══════════════════════════════════════════════");
        log.info("Run completed in {}s: {} papers, {} failures, {} audit entries, {} calls, {} tokens",
                Duration.between(startedAt, clock.instant()).toSeconds(), report.papers().size(),
                report.failures().size(), report.audit().size(), usage.calls(), usage.totalTokens());
        log.info("═══════════════════════════════════════════════");
        return RunOutcome.completed(report, resolution.probes());
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    private static String describe(PeriodTrend trend) {
        if (trend == null) return "disabled";
        return trend.noData() ? "no data" : trend.recordCount() + " records";
    }
}
