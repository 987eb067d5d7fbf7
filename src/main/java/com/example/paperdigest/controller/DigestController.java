package com.example.paperdigest.controller;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.DailyReport;
import com.example.paperdigest.model.ReportStats;
import com.example.paperdigest.model.RunOutcome;
import com.example.paperdigest.model.RunRequest;
import com.example.paperdigest.model.UsageSummary;
import com.example.paperdigest.orchestrator.DigestPipelineCoordinator;
import com.example.paperdigest.orchestrator.RunInProgressException;
import com.example.paperdigest.port.ArchivePersistenceException;
import com.example.paperdigest.port.ArchivePort;
import com.example.paperdigest.port.CandidateSourceException;
import com.example.paperdigest.service.CallBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * REST controller for digest runs and the report archive.
 */
@RestController
@RequestMapping("/api")
public class DigestController {

    private static final Logger log = LoggerFactory.getLogger(DigestController.class);

    private static final int MAX_RANGE_DAYS = 366;

    private final DigestPipelineCoordinator coordinator;
    private final ArchivePort archive;
    private final CallBudget budget;
    private final DigestProperties properties;
    private final Clock clock;

    public DigestController(DigestPipelineCoordinator coordinator,
                            ArchivePort archive,
                            CallBudget budget,
                            DigestProperties properties,
                            Clock clock) {
        this.coordinator = coordinator;
        this.archive = archive;
        this.budget = budget;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs the pipeline synchronously and returns its outcome.
     *
     * <p>Endpoint: POST /api/digest/run
     * <p>Body (optional): {"date": "2025-02-03", "maxResults": 200, "maxSelected": 10, "dryRun": false}
     */
    @PostMapping("/digest/run")
    public ResponseEntity<?> run(@RequestBody(required = false) RunRequest request) {
        RunRequest effective = request != null ? request : RunRequest.auto();
        log.info("Received run request (date={}, dryRun={})", effective.date(), effective.dryRun());

        RunOutcome outcome = coordinator.run(effective);
        UsageSummary usage = budget.snapshot();
        log.info("Run {}: {} calls, {} fast tokens, {} smart tokens", outcome.status(),
                usage.calls(), usage.fastTierTokens(), usage.smartTierTokens());

        return ResponseEntity.ok()
                .headers(usageHeaders(usage))
                .body(outcome);
    }

    /**
     * Exports the archived report of one date.
     *
     * <p>Endpoint: GET /api/reports/{date}
     */
    @GetMapping("/reports/{date}")
    public ResponseEntity<?> report(@PathVariable String date) {
        LocalDate day = LocalDate.parse(date);
        return archive.read(day)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "No report for " + day)));
    }

    /**
     * Reports of an inclusive date range, oldest first.
     *
     * <p>Endpoint: GET /api/reports?from=YYYY-MM-DD&to=YYYY-MM-DD
     */
    @GetMapping("/reports")
    public ResponseEntity<?> range(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                   @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if (to.isBefore(from)) {
            return badRequest("'to' must not be before 'from'");
        }
        if (from.plusDays(MAX_RANGE_DAYS - 1L).isBefore(to)) {
            return badRequest("Range too large. Maximum: " + MAX_RANGE_DAYS + " days.");
        }
        List<DailyReport> reports = archive.readRange(from, to);
        return ResponseEntity.ok(reports);
    }

    /**
     * Counters of the reports archived over the last {@code days} days, newest last.
     *
     * <p>Endpoint: GET /api/reports/stats?days=30
     */
    @GetMapping("/reports/stats")
    public ResponseEntity<?> stats(@RequestParam(defaultValue = "30") int days) {
        if (days < 1 || days > MAX_RANGE_DAYS) {
            return badRequest("days must be between 1 and " + MAX_RANGE_DAYS);
        }
        LocalDate today = LocalDate.now(clock.withZone(properties.search().zone()));
        List<ReportStats> stats = archive.readRange(today.minusDays(days - 1L), today).stream()
                .map(ReportStats::of)
                .toList();
        return ResponseEntity.ok(stats);
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "Paper Digest",
                "runInProgress", coordinator.isRunning(),
                "time", clock.instant().toString()
        ));
    }

    // ── Error mapping ──

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<Map<String, String>> onRunInProgress(RunInProgressException e) {
        return error(HttpStatus.CONFLICT, "Run already in progress", e);
    }

    @ExceptionHandler(CandidateSourceException.class)
    public ResponseEntity<Map<String, String>> onSourceFailure(CandidateSourceException e) {
        log.error("Candidate source failure", e);
        return error(HttpStatus.BAD_GATEWAY, "Candidate source unavailable", e);
    }

    @ExceptionHandler(ArchivePersistenceException.class)
    public ResponseEntity<Map<String, String>> onPersistenceFailure(ArchivePersistenceException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Report could not be archived", e);
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeParseException.class})
    public ResponseEntity<Map<String, String>> onBadInput(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request", e);
    }

    private static HttpHeaders usageHeaders(UsageSummary usage) {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Usage-Calls", String.valueOf(usage.calls()));
        headers.add("X-Usage-Fast-Tokens", String.valueOf(usage.fastTierTokens()));
        headers.add("X-Usage-Smart-Tokens", String.valueOf(usage.smartTierTokens()));
        headers.add("X-Usage-Total-Tokens", String.valueOf(usage.totalTokens()));
        headers.add("X-Budget-Exhausted", String.valueOf(usage.budgetExhausted()));
        return headers;
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, Exception e) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
        ));
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
