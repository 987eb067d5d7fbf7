package com.example.paperdigest.model;

import java.util.List;

/**
 * A paper singled out by external attention signals.
 *
 * @param paperId        Versioned identifier
 * @param title          Paper title
 * @param attentionScore Score in [0,100] computed from {@code signals} only
 * @param signals        The signals the score was computed from
 * @param introduction   Narrative introduction
 */
public record SpotlightItem(
        String paperId,
        String title,
        int attentionScore,
        List<AttentionSignal> signals,
        String introduction
) {
    public SpotlightItem {
        signals = signals != null ? List.copyOf(signals) : List.of();
    }

    public SpotlightItem withIntroduction(String text) {
        return new SpotlightItem(paperId, title, attentionScore, signals, text);
    }
}
