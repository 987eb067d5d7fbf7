package com.example.paperdigest.model;

/**
 * Per-date counters of an archived report.
 */
public record ReportStats(
        String date,
        int candidates,
        int judged,
        int papers,
        int failures,
        int spotlight,
        int calls,
        long tokens
) {

    public static ReportStats of(DailyReport r) {
        UsageSummary usage = r.usage();
        return new ReportStats(
                r.date(),
                r.candidateCount(),
                r.judgments().size(),
                r.papers().size(),
                r.failures().size(),
                r.spotlight().size(),
                usage != null ? usage.calls() : 0,
                usage != null ? usage.totalTokens() : 0L
        );
    }
}
