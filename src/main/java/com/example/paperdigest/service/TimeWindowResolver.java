package com.example.paperdigest.service;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.AuditOutcome;
import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.model.Resolution;
import com.example.paperdigest.model.ResolutionMode;
import com.example.paperdigest.model.RetryPolicy;
import com.example.paperdigest.model.RunRequest;
import com.example.paperdigest.port.CandidateQuery;
import com.example.paperdigest.port.CandidateSourceException;
import com.example.paperdigest.port.CandidateSourcePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Random;

/**
 * Decides which calendar period counts as "today's update" and harvests its candidates.
 * Probes run strictly one after the other and never call a model.
 */
@Service
public class TimeWindowResolver {

    private static final Logger log = LoggerFactory.getLogger(TimeWindowResolver.class);

    private final CandidateSourcePort source;
    private final DigestProperties.Search config;
    private final Clock clock;
    private final Random jitter = new Random();

    public TimeWindowResolver(CandidateSourcePort source, DigestProperties properties, Clock clock) {
        this.source = source;
        this.config = properties.search();
        this.clock = clock;
    }

    public Resolution resolve(RunRequest request, AuditTrail audit) {
        ZoneId zone = config.zone();
        int cap = request.maxResults() != null && request.maxResults() > 0 ? request.maxResults() : config.maxResults();
        AttemptCounter counter = new AttemptCounter(config.maxTotalAttempts());

        if (request.hasPinnedDate()) {
            LocalDate day = parseDate(request.date());
            return probeSingleDay(day, zone, cap, counter, audit);
        }
        if (config.mode() == ResolutionMode.FIXED_WINDOW) {
            return fixedWindow(zone, cap, counter, audit);
        }
        return latestUpdate(zone, cap, counter, audit);
    }

    // ── Modes ────────────────────────────────────────────────────────────────

    private Resolution latestUpdate(ZoneId zone, int cap, AttemptCounter counter, AuditTrail audit) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        int lookback = Math.max(1, config.lookbackDays());
        int probes = 0;
        boolean anySucceeded = false;

        for (int offset = 0; offset < lookback; offset++) {
            if (counter.exhausted()) {
                log.warn("Resolver: attempt ceiling {} reached after {} probes, stopping", counter.limit, probes);
                break;
            }
            LocalDate day = today.minusDays(offset);
            Instant start = day.atStartOfDay(zone).toInstant();
            Instant end = day.plusDays(1).atStartOfDay(zone).toInstant();
            probes++;

            List<Candidate> found = probe(day.toString(), start, end, cap, counter, audit);
            if (found == null) {
                continue;
            }
            anySucceeded = true;
            if (!found.isEmpty()) {
                log.info("Resolver: {} has {} candidates (probe {}/{})", day, found.size(), probes, lookback);
                return new Resolution(true, day.toString(), start, end, ResolutionMode.LATEST_UPDATE, found, probes);
            }
            log.info("Resolver: {} is empty (probe {}/{})", day, probes, lookback);
        }

        if (!anySucceeded) {
            throw new CandidateSourceException("No probe succeeded in " + probes + " attempts over "
                    + lookback + " days");
        }
        log.info("Resolver: no update within {} days", lookback);
        return Resolution.noUpdate(ResolutionMode.LATEST_UPDATE, probes);
    }

    private Resolution fixedWindow(ZoneId zone, int cap, AttemptCounter counter, AuditTrail audit) {
        Instant end = clock.instant();
        Duration window = config.fixedWindow() != null ? config.fixedWindow() : Duration.ofHours(24);
        Instant start = end.minus(window);
        String label = LocalDate.ofInstant(end, zone).toString();

        List<Candidate> found = probe(label, start, end, cap, counter, audit);
        if (found == null) {
            throw new CandidateSourceException("Fixed window [" + start + ", " + end + ") could not be fetched");
        }
        if (found.isEmpty()) {
            log.info("Resolver: fixed window [{}, {}) is empty, reporting it anyway", start, end);
        }
        return new Resolution(true, label, start, end, ResolutionMode.FIXED_WINDOW, found, 1);
    }

    private Resolution probeSingleDay(LocalDate day, ZoneId zone, int cap, AttemptCounter counter, AuditTrail audit) {
        Instant start = day.atStartOfDay(zone).toInstant();
        Instant end = day.plusDays(1).atStartOfDay(zone).toInstant();

        List<Candidate> found = probe(day.toString(), start, end, cap, counter, audit);
        if (found == null) {
            throw new CandidateSourceException("Pinned date " + day + " could not be fetched");
        }
        if (found.isEmpty()) {
            log.info("Resolver: pinned date {} has no candidates, reporting it anyway", day);
        }
        return new Resolution(true, day.toString(), start, end, ResolutionMode.PINNED_DATE, found, 1);
    }

    // ── Probe with retry ─────────────────────────────────────────────────────

    /**
     * @return the deduplicated candidates of the window, or null when every attempt failed
     */
    private List<Candidate> probe(String label, Instant start, Instant end, int cap,
                                  AttemptCounter counter, AuditTrail audit) {
        RetryPolicy policy = config.retry().toPolicy();
        CandidateQuery query = new CandidateQuery(config.categories(), start, end, cap);
        String lastError = null;
        int attempt = 0;

        while (attempt < policy.maxAttempts() && !counter.exhausted()) {
            attempt++;
            counter.increment();
            try {
                return CandidateDeduplicator.dedupe(source.search(query));
            } catch (CandidateSourceException e) {
                lastError = Backoff.rootCauseMessage(e);
                if (policy.hasAttemptAfter(attempt) && !counter.exhausted()) {
                    Duration delay = policy.delayAfter(attempt, jitter);
                    log.warn("Resolver: probe {} attempt {}/{} failed ({}), retrying in {}ms...",
                            label, attempt, policy.maxAttempts(), lastError, delay.toMillis());
                    if (!Backoff.pause(delay)) {
                        break;
                    }
                }
            }
        }
        log.warn("Resolver: probe {} failed after {} attempts: {}", label, attempt, lastError);
        audit.record(label, "resolve", AuditOutcome.PROBE_FAILED, Math.max(0, attempt - 1), lastError);
        return null;
    }

    private static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date '" + raw + "', expected YYYY-MM-DD", e);
        }
    }

    private static final class AttemptCounter {
        private final int limit;
        private int used;

        AttemptCounter(int limit) {
            this.limit = limit > 0 ? limit : Integer.MAX_VALUE;
        }

        void increment() {
            used++;
        }

        boolean exhausted() {
            return used >= limit;
        }
    }
}
