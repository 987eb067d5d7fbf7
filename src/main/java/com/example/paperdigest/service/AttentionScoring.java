package com.example.paperdigest.service;

import com.example.paperdigest.config.DigestProperties.MetricRule;
import com.example.paperdigest.config.DigestProperties.Normalization;
import com.example.paperdigest.model.AttentionSignal;

import java.util.List;
import java.util.OptionalInt;

/**
 * Deterministic attention score in [0, 100] from external signals.
 * <p>
 * Each configured metric is normalized to [0, 1] and the weights of the metrics actually
 * returned are renormalized to sum to 1, so a missing source never drags the score down.
 * Same signals and rules always give the same score.
 */
public final class AttentionScoring {

    private AttentionScoring() {
    }

    /**
     * @return the score, or empty when none of the configured metrics was returned
     */
    public static OptionalInt score(List<AttentionSignal> signals, List<MetricRule> rules) {
        double weighted = 0.0;
        double weights = 0.0;
        for (MetricRule rule : rules) {
            if (rule.weight() <= 0) continue;
            for (AttentionSignal s : signals) {
                if (s.source().equals(rule.source()) && s.metric().equals(rule.metric())) {
                    weighted += rule.weight() * normalize(s.value(), rule);
                    weights += rule.weight();
                    break;
                }
            }
        }
        if (weights == 0.0) {
            return OptionalInt.empty();
        }
        long rounded = (long) Math.floor(weighted / weights * 100.0 + 0.5);
        return OptionalInt.of((int) Math.max(0, Math.min(100, rounded)));
    }

    static double normalize(double value, MetricRule rule) {
        double v = Math.max(0.0, value);
        double scale = rule.scale() > 0 ? rule.scale() : 1.0;
        double n = rule.normalization() == Normalization.LINEAR
                ? v / scale
                : Math.log1p(v) / Math.log1p(scale);
        return Math.min(1.0, n);
    }
}
