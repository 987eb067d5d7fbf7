package com.example.paperdigest.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * The persisted digest for one resolved date. Self-contained: rendering needs nothing else.
 */
@Document(collection = "daily_reports")
public record DailyReport(
        @Id String date,
        Instant generatedAt,
        Instant windowStart,
        Instant windowEnd,
        ResolutionMode resolutionMode,
        String domain,
        List<String> categories,
        List<String> keywords,
        int candidateCount,
        PeriodTrend dayTrend,
        List<PaperRecord> papers,
        List<ExtractionFailure> failures,
        List<JudgedCandidate> judgments,
        PeriodTrend weeklyTrend,
        PeriodTrend monthlyTrend,
        List<SpotlightItem> spotlight,
        List<AuditEntry> audit,
        UsageSummary usage
) {
    public DailyReport {
        categories = categories != null ? List.copyOf(categories) : List.of();
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        papers = papers != null ? List.copyOf(papers) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        judgments = judgments != null ? List.copyOf(judgments) : List.of();
        spotlight = spotlight != null ? List.copyOf(spotlight) : List.of();
        audit = audit != null ? List.copyOf(audit) : List.of();
    }
}
