package com.example.paperdigest.model;

import java.time.Instant;

/**
 * One metric value reported by an external attention source.
 *
 * @param source    Source identifier (e.g. semantic_scholar)
 * @param metric    Metric identifier (e.g. citation_count)
 * @param value     Raw metric value
 * @param fetchedAt When the value was fetched
 */
public record AttentionSignal(
        String source,
        String metric,
        double value,
        Instant fetchedAt
) {}
