package com.example.paperdigest.model;

/**
 * Marker emitted instead of a {@link PaperRecord} when extraction gives up.
 *
 * @param candidateId Versioned identifier of the candidate
 * @param reason      Last error seen
 * @param attempts    Number of attempts made
 */
public record ExtractionFailure(
        String candidateId,
        String reason,
        int attempts
) {}
