package com.example.paperdigest.port;

public enum SignalStatus {
    /** The source answered with at least one metric. */
    AVAILABLE,
    /** The source answered but knows nothing about the paper. */
    NO_DATA,
    /** The source could not be reached or refused the request. */
    UNAVAILABLE
}
