package com.example.paperdigest.model;

/**
 * Aggregated term with its relative weight (the top term of a window has weight 1.0).
 */
public record KeywordWeight(
        String term,
        double weight
) {}
