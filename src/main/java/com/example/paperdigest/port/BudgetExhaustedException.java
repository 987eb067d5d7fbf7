package com.example.paperdigest.port;

/**
 * Thrown when a model call would exceed the run's call or token ceiling.
 */
public class BudgetExhaustedException extends RuntimeException {

    public BudgetExhaustedException(String message) {
        super(message);
    }
}
