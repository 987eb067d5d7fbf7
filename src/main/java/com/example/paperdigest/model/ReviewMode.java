package com.example.paperdigest.model;

public enum ReviewMode {
    FAST_ONLY, FAST_THEN_REVIEW
}
