package com.example.paperdigest.service;

import com.example.paperdigest.agent.TrendNarrativeAgent;
import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.AuditOutcome;
import com.example.paperdigest.model.DailyReport;
import com.example.paperdigest.model.KeywordWeight;
import com.example.paperdigest.model.PaperRecord;
import com.example.paperdigest.model.PeriodTrend;
import com.example.paperdigest.model.TrendPeriod;
import com.example.paperdigest.port.ArchivePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the day, week and month trends: keyword weights plus a narrative per window.
 * Past days come from the archive; the current day's records are passed in because the
 * current report has not been written yet.
 */
@Service
public class TrendAggregator {

    private static final Logger log = LoggerFactory.getLogger(TrendAggregator.class);

    static final String FALLBACK_PREFIX = "Narrative unavailable. Top keywords: ";

    /** Weekly and monthly trends; either is null when disabled. */
    public record Rollups(PeriodTrend weekly, PeriodTrend monthly) {}

    private final ArchivePort archive;
    private final TrendNarrativeAgent narrativeAgent;
    private final CallBudget budget;
    private final DigestProperties.Trend config;

    public TrendAggregator(ArchivePort archive, TrendNarrativeAgent narrativeAgent,
                           CallBudget budget, DigestProperties properties) {
        this.archive = archive;
        this.narrativeAgent = narrativeAgent;
        this.budget = budget;
        this.config = properties.trend();
    }

    public PeriodTrend dayTrend(LocalDate reportDate, List<PaperRecord> current, AuditTrail audit) {
        return summarize(TrendPeriod.DAY, reportDate, reportDate, current, audit);
    }

    public Rollups rollups(LocalDate reportDate, List<PaperRecord> current, AuditTrail audit) {
        PeriodTrend weekly = null;
        PeriodTrend monthly = null;
        if (config.enableWeekly()) {
            LocalDate start = windowStart(TrendPeriod.WEEK, reportDate);
            weekly = summarize(TrendPeriod.WEEK, start, reportDate, window(start, reportDate, current), audit);
        }
        if (config.enableMonthly()) {
            LocalDate start = windowStart(TrendPeriod.MONTH, reportDate);
            monthly = summarize(TrendPeriod.MONTH, start, reportDate, window(start, reportDate, current), audit);
        }
        return new Rollups(weekly, monthly);
    }

    LocalDate windowStart(TrendPeriod period, LocalDate reportDate) {
        boolean calendar = config.windowMode() == DigestProperties.WindowMode.CALENDAR;
        if (period == TrendPeriod.WEEK) {
            return calendar
                    ? reportDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    : reportDate.minusDays(Math.max(1, config.weeklyDays()) - 1L);
        }
        if (period == TrendPeriod.MONTH) {
            return calendar
                    ? reportDate.withDayOfMonth(1)
                    : reportDate.minusDays(Math.max(1, config.monthlyDays()) - 1L);
        }
        return reportDate;
    }

    /**
     * Current records first, then archived days newest first; the first occurrence of a base id
     * wins, so a re-listed paper counts once with its newest content.
     */
    private List<PaperRecord> window(LocalDate start, LocalDate reportDate, List<PaperRecord> current) {
        List<DailyReport> history = List.of();
        LocalDate lastArchived = reportDate.minusDays(1);
        if (!start.isAfter(lastArchived)) {
            try {
                history = archive.readRange(start, lastArchived).stream()
                        .filter(r -> !reportDate.toString().equals(r.date()))
                        .sorted(Comparator.comparing(DailyReport::date).reversed())
                        .toList();
            } catch (RuntimeException e) {
                log.warn("TrendAggregator: archive read [{}, {}] failed, using current records only: {}",
                        start, lastArchived, Backoff.rootCauseMessage(e));
            }
        }

        Map<String, PaperRecord> byBaseId = new LinkedHashMap<>();
        current.forEach(r -> byBaseId.putIfAbsent(r.baseId(), r));
        for (DailyReport report : history) {
            report.papers().forEach(r -> byBaseId.putIfAbsent(r.baseId(), r));
        }
        return new ArrayList<>(byBaseId.values());
    }

    private PeriodTrend summarize(TrendPeriod period, LocalDate start, LocalDate end,
                                  List<PaperRecord> records, AuditTrail audit) {
        String startDate = start.toString();
        String endDate = end.toString();
        if (records.isEmpty()) {
            return PeriodTrend.noData(period, startDate, endDate);
        }

        List<KeywordWeight> keywords = KeywordExtractor.topKeywords(records, config.topK());
        String summary;
        if (budget.isExhausted()) {
            log.warn("TrendAggregator: budget exhausted, {} narrative replaced by fallback", period);
            audit.record(period.name(), "trend", AuditOutcome.NARRATIVE_SKIPPED, 0, "budget exhausted");
            summary = fallback(keywords);
        } else {
            try {
                summary = narrativeAgent.narrate(period, startDate, endDate, records, keywords)
                        .orElseGet(() -> {
                            audit.record(period.name(), "trend", AuditOutcome.NARRATIVE_FAILED, 1, "invalid output");
                            return fallback(keywords);
                        });
            } catch (RuntimeException e) {
                log.warn("TrendAggregator: {} narrative failed: {}", period, Backoff.rootCauseMessage(e));
                audit.record(period.name(), "trend", AuditOutcome.NARRATIVE_FAILED, 0, Backoff.rootCauseMessage(e));
                summary = fallback(keywords);
            }
        }

        log.info("TrendAggregator: {} {}..{}: {} records, {} keywords", period, startDate, endDate,
                records.size(), keywords.size());
        return new PeriodTrend(period, startDate, endDate, summary, keywords, records.size(), false);
    }

    static String fallback(List<KeywordWeight> keywords) {
        return FALLBACK_PREFIX + keywords.stream()
                .limit(5)
                .map(KeywordWeight::term)
                .collect(Collectors.joining(", ")) + ".";
    }
}
