package com.example.paperdigest.service;

import com.example.paperdigest.model.Candidate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.example.paperdigest.DigestFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;

class CandidateDeduplicatorTest {

    private static final Instant T = Instant.parse("2025-02-03T10:00:00Z");

    @Test
    void highestVersionReplacesEarlierVersions() {
        List<Candidate> out = CandidateDeduplicator.dedupe(List.of(
                candidate("2502.00001v1", "old title", T),
                candidate("2502.00002v1", "other", T),
                candidate("2502.00001v3", "newest title", T),
                candidate("2502.00001v2", "middle title", T)));

        assertThat(out).extracting(Candidate::id).containsExactly("2502.00001v3", "2502.00002v1");
        assertThat(out.get(0).title()).isEqualTo("newest title");
    }

    @Test
    void unversionedIdIsTreatedAsVersionOne() {
        List<Candidate> out = CandidateDeduplicator.dedupe(List.of(
                candidate("2502.00001", "plain", T),
                candidate("2502.00001v2", "v2", T)));

        assertThat(out).extracting(Candidate::id).containsExactly("2502.00001v2");
    }

    @Test
    void baseIdStripsVersionSuffixOnly() {
        assertThat(Candidate.baseIdOf("2502.01234v12")).isEqualTo("2502.01234");
        assertThat(Candidate.baseIdOf("hep-th/9901001v1")).isEqualTo("hep-th/9901001");
        assertThat(Candidate.baseIdOf("2502.01234")).isEqualTo("2502.01234");
    }
}
