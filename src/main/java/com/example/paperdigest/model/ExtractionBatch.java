package com.example.paperdigest.model;

import java.util.List;

/**
 * Output of the extraction stage. Records keep the selection ranking.
 */
public record ExtractionBatch(
        List<PaperRecord> records,
        List<ExtractionFailure> failures
) {}
