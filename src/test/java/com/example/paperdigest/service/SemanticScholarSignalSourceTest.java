package com.example.paperdigest.service;

import com.example.paperdigest.DigestFixtures;
import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.port.SignalFetch;
import com.example.paperdigest.port.SignalStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticScholarSignalSourceTest {

    // nothing listens on port 1, so every request is refused
    private static DigestProperties unreachable() {
        DigestProperties base = DigestFixtures.defaults();
        DigestProperties.Spotlight spotlight = new DigestProperties.Spotlight(true, 14, 40, 3,
                Duration.ofMillis(500), 1, List.of("semantic_scholar", "openalex"), List.of(),
                "http://127.0.0.1:1", "http://127.0.0.1:1", 10);
        return new DigestProperties(base.search(), base.filter(), base.extraction(), base.trend(), spotlight,
                base.run());
    }

    @Test
    void refusedConnectionIsUnavailableNotNoData() {
        SignalFetch fetch = new SemanticScholarSignalSource(unreachable(), Clock.systemUTC()).fetch("2502.01234");

        assertThat(fetch.source()).isEqualTo(SemanticScholarSignalSource.SOURCE_ID);
        assertThat(fetch.status()).isEqualTo(SignalStatus.UNAVAILABLE);
        assertThat(fetch.signals()).isEmpty();
    }

    @Test
    void openAlexReportsUnavailabilityTheSameWay() {
        SignalFetch fetch = new OpenAlexSignalSource(unreachable(), Clock.systemUTC()).fetch("2502.01234");

        assertThat(fetch.source()).isEqualTo(OpenAlexSignalSource.SOURCE_ID);
        assertThat(fetch.isUnavailable()).isTrue();
    }
}
