package com.example.paperdigest.port;

import java.time.Instant;
import java.util.List;

/**
 * Category and time scoped search.
 *
 * @param categories Categories to search (empty = all)
 * @param start      Window start, inclusive
 * @param end        Window end, exclusive
 * @param maxResults Result cap
 */
public record CandidateQuery(
        List<String> categories,
        Instant start,
        Instant end,
        int maxResults
) {
    public CandidateQuery {
        categories = categories != null ? List.copyOf(categories) : List.of();
    }
}
