package com.example.paperdigest.model;

public enum ResolutionMode {
    /** Newest calendar day with upstream results, within the lookback. */
    LATEST_UPDATE,
    /** Rolling window ending now. */
    FIXED_WINDOW,
    /** Explicitly requested calendar day. */
    PINNED_DATE
}
