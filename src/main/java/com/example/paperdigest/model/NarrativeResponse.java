package com.example.paperdigest.model;

import java.util.List;

/**
 * Free-text narrative wrapped in a one-field object so it goes through the same parsing path.
 */
public record NarrativeResponse(String text) implements StructuredOutput {

    @Override
    public List<String> violations() {
        return text == null || text.isBlank() ? List.of("text is missing") : List.of();
    }
}
