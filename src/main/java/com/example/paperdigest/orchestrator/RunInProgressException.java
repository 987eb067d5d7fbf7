package com.example.paperdigest.orchestrator;

/**
 * Thrown when a digest run is requested while another one is still running.
 */
public class RunInProgressException extends RuntimeException {

    public RunInProgressException(String message) {
        super(message);
    }
}
