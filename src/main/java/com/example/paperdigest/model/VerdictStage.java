package com.example.paperdigest.model;

/**
 * Which step of the relevance filter produced a verdict.
 */
public enum VerdictStage {
    /** Rule-based: exclusion terms, empty include list or include prefilter. */
    HEURISTIC,
    /** Stage-1 classification by the fast model. */
    FAST,
    /** Stage-2 re-scoring by the stronger model. */
    REVIEW,
    /** Classification could not be obtained. */
    FAILED
}
