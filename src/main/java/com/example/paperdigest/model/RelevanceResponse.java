package com.example.paperdigest.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw relevance classification as returned by the model.
 */
public record RelevanceResponse(
        Boolean isRelevant,
        Integer relevanceScore,
        List<String> matchedTerms,
        String reason
) implements StructuredOutput {

    @Override
    public List<String> violations() {
        List<String> out = new ArrayList<>();
        if (isRelevant == null) out.add("isRelevant is missing");
        if (relevanceScore == null) {
            out.add("relevanceScore is missing");
        } else if (relevanceScore < 0 || relevanceScore > 100) {
            out.add("relevanceScore must be between 0 and 100, got " + relevanceScore);
        }
        if (reason == null || reason.isBlank()) out.add("reason is missing");
        return out;
    }

    public RelevanceVerdict toVerdict(VerdictStage stage) {
        return new RelevanceVerdict(isRelevant, relevanceScore, matchedTerms, reason.trim(), stage);
    }
}
