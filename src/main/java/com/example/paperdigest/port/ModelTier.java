package com.example.paperdigest.port;

/**
 * Which model a request goes to.
 */
public enum ModelTier {
    /** Lightweight model for bulk classification. */
    FAST,
    /** Stronger model for review, extraction and narratives. */
    SMART
}
