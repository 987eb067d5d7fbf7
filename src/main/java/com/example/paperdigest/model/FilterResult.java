package com.example.paperdigest.model;

import java.util.List;

/**
 * Output of the relevance filter.
 *
 * @param judgments One entry per input candidate, in input order
 * @param selected  Selected candidates in ranking order
 */
public record FilterResult(
        List<JudgedCandidate> judgments,
        List<Candidate> selected
) {
    public RelevanceVerdict verdictFor(String candidateId) {
        return judgments.stream()
                .filter(j -> j.candidateId().equals(candidateId))
                .map(JudgedCandidate::verdict)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No verdict for " + candidateId));
    }
}
