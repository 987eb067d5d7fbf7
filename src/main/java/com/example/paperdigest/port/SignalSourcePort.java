package com.example.paperdigest.port;

/**
 * One external attention-metric provider.
 */
public interface SignalSourcePort {

    /** Stable source identifier, used in signals, cache keys and configuration. */
    String sourceId();

    /**
     * Fetches the metrics for one paper. Never throws for transport problems: those are
     * reported as {@link SignalStatus#UNAVAILABLE}.
     *
     * @param arxivId identifier without version suffix
     */
    SignalFetch fetch(String arxivId);
}
