package com.example.paperdigest.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured single-paper analysis as returned by the model.
 */
public record ExtractionResponse(
        String localizedTitle,
        String problem,
        String method,
        String paradigmRelation,
        Integer qualityScore
) implements StructuredOutput {

    @Override
    public List<String> violations() {
        List<String> out = new ArrayList<>();
        if (problem == null || problem.isBlank()) out.add("problem is missing");
        if (method == null || method.isBlank()) out.add("method is missing");
        if (paradigmRelation == null || paradigmRelation.isBlank()) out.add("paradigmRelation is missing");
        if (qualityScore == null) {
            out.add("qualityScore is missing");
        } else if (qualityScore < 1 || qualityScore > 5) {
            out.add("qualityScore must be between 1 and 5, got " + qualityScore);
        }
        return out;
    }
}
