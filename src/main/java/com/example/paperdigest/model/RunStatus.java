package com.example.paperdigest.model;

public enum RunStatus {
    COMPLETED,
    /** Upstream had nothing new within the lookback; no report was produced. */
    NO_UPDATE,
    /** Harvest only, nothing judged or persisted. */
    DRY_RUN
}
