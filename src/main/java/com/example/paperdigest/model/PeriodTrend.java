package com.example.paperdigest.model;

import java.util.List;

/**
 * Trend summary over a window of selected papers.
 *
 * @param period      Window kind
 * @param startDate   First day of the window (ISO date, inclusive)
 * @param endDate     Last day of the window (ISO date, inclusive)
 * @param summary     Narrative summary
 * @param keywords    Top-K keywords ordered by weight
 * @param recordCount Number of distinct papers aggregated
 * @param noData      True when the window held no papers
 */
public record PeriodTrend(
        TrendPeriod period,
        String startDate,
        String endDate,
        String summary,
        List<KeywordWeight> keywords,
        int recordCount,
        boolean noData
) {
    public static final String NO_DATA_SUMMARY = "No selected papers in this period.";

    public PeriodTrend {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    public static PeriodTrend noData(TrendPeriod period, String startDate, String endDate) {
        return new PeriodTrend(period, startDate, endDate, NO_DATA_SUMMARY, List.of(), 0, true);
    }
}
