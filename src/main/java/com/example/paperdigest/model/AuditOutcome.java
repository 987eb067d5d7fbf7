package com.example.paperdigest.model;

public enum AuditOutcome {
    PROBE_FAILED,
    CLASSIFICATION_FAILED,
    REVIEW_SKIPPED,
    EXTRACTED,
    EXTRACTED_AFTER_RETRY,
    EXTRACTION_FAILED,
    SIGNAL_UNAVAILABLE,
    NARRATIVE_FAILED,
    NARRATIVE_SKIPPED
}
