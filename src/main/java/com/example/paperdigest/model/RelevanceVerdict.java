package com.example.paperdigest.model;

import java.util.List;

/**
 * Relevance classification of one candidate.
 *
 * @param relevant     Whether the paper matches the configured interests
 * @param score        Relevance score, clamped to [0,100]
 * @param matchedTerms Interest terms the paper matched
 * @param rationale    Short explanation
 * @param stage        Filter step that produced this verdict
 */
public record RelevanceVerdict(
        boolean relevant,
        int score,
        List<String> matchedTerms,
        String rationale,
        VerdictStage stage
) {
    public RelevanceVerdict {
        score = Math.max(0, Math.min(100, score));
        matchedTerms = matchedTerms != null ? List.copyOf(matchedTerms) : List.of();
        rationale = rationale != null ? rationale : "";
    }

    public static RelevanceVerdict failed(String reason) {
        return new RelevanceVerdict(false, 0, List.of(), reason, VerdictStage.FAILED);
    }
}
