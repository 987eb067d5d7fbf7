package com.example.paperdigest.model;

/**
 * One entry of the full judgment list: every candidate appears exactly once.
 */
public record JudgedCandidate(
        String candidateId,
        String title,
        RelevanceVerdict verdict,
        boolean selected
) {}
