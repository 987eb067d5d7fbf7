package com.example.paperdigest.service;

import com.example.paperdigest.config.DigestProperties.MetricRule;
import com.example.paperdigest.config.DigestProperties.Normalization;
import com.example.paperdigest.model.AttentionSignal;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AttentionScoringTest {

    private static final List<MetricRule> RULES = List.of(
            new MetricRule("semantic_scholar", "citation_count", 0.6, Normalization.LOG, 100),
            new MetricRule("openalex", "cited_by_count", 0.4, Normalization.LINEAR, 50));

    private static AttentionSignal signal(String source, String metric, double value) {
        return new AttentionSignal(source, metric, value, Instant.EPOCH);
    }

    @Test
    void weightsAreRenormalizedOverReturnedMetrics() {
        // only the 0.4 metric came back: its normalized value is the whole score
        assertThat(AttentionScoring.score(List.of(signal("openalex", "cited_by_count", 25)), RULES))
                .hasValue(50);
    }

    @Test
    void combinesAllReturnedMetrics() {
        List<AttentionSignal> both = List.of(
                signal("semantic_scholar", "citation_count", 100),
                signal("openalex", "cited_by_count", 25));

        // 0.6 * 1.0 + 0.4 * 0.5
        assertThat(AttentionScoring.score(both, RULES)).hasValue(80);
    }

    @Test
    void normalizedValuesAreCappedAtOne() {
        assertThat(AttentionScoring.score(List.of(signal("openalex", "cited_by_count", 10_000)), RULES))
                .hasValue(100);
        assertThat(AttentionScoring.score(List.of(signal("semantic_scholar", "citation_count", 1e9)), RULES))
                .hasValue(100);
    }

    @Test
    void roundsHalfUp() {
        List<MetricRule> linear = List.of(new MetricRule("openalex", "cited_by_count", 1.0, Normalization.LINEAR, 8));

        assertThat(AttentionScoring.score(List.of(signal("openalex", "cited_by_count", 5)), linear)).hasValue(63);
    }

    @Test
    void logNormalization() {
        MetricRule rule = new MetricRule("s", "m", 1.0, Normalization.LOG, 100);

        assertThat(AttentionScoring.normalize(0, rule)).isZero();
        assertThat(AttentionScoring.normalize(100, rule)).isEqualTo(1.0);
        assertThat(AttentionScoring.normalize(9, rule)).isCloseTo(Math.log(10) / Math.log(101), within(1e-12));
        assertThat(AttentionScoring.normalize(-5, rule)).isZero();
    }

    @Test
    void noConfiguredMetricReturnedMeansNoScore() {
        assertThat(AttentionScoring.score(List.of(signal("altmetric", "tweets", 300)), RULES)).isEmpty();
        assertThat(AttentionScoring.score(List.of(), RULES)).isEmpty();
    }

    @Test
    void sameSignalsGiveTheSameScoreWhateverTheirOrder() {
        List<AttentionSignal> signals = new ArrayList<>(List.of(
                signal("semantic_scholar", "citation_count", 37),
                signal("openalex", "cited_by_count", 11),
                signal("semantic_scholar", "influential_citation_count", 2)));
        int first = AttentionScoring.score(signals, RULES).getAsInt();
        Collections.reverse(signals);

        assertThat(AttentionScoring.score(signals, RULES)).hasValue(first);
        assertThat(AttentionScoring.score(signals, RULES)).hasValue(first);
    }
}
