package com.example.paperdigest.service;

import com.example.paperdigest.DigestFixtures;
import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.AuditOutcome;
import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.model.Resolution;
import com.example.paperdigest.model.ResolutionMode;
import com.example.paperdigest.model.ReviewMode;
import com.example.paperdigest.model.RunRequest;
import com.example.paperdigest.port.CandidateQuery;
import com.example.paperdigest.port.CandidateSourceException;
import com.example.paperdigest.port.CandidateSourcePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.paperdigest.DigestFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeWindowResolverTest {

    private static final Instant NOW = Instant.parse("2025-02-05T10:00:00Z");

    @Mock
    private CandidateSourcePort source;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private AuditTrail audit;

    @BeforeEach
    void setUp() {
        audit = new AuditTrail(clock);
    }

    private TimeWindowResolver resolver(ResolutionMode mode, int lookback, int maxTotalAttempts, int retries) {
        DigestProperties.Search search = DigestFixtures.search(mode, lookback, maxTotalAttempts,
                DigestFixtures.retries(retries), List.of("agent"), List.of());
        DigestProperties props = DigestFixtures.properties(search,
                DigestFixtures.filter(ReviewMode.FAST_ONLY, 60, 10, 5),
                DigestFixtures.extraction(1),
                DigestFixtures.trend(DigestProperties.WindowMode.ROLLING),
                DigestFixtures.spotlight(List.of(), List.of()));
        return new TimeWindowResolver(source, props, clock);
    }

    @Test
    void sevenEmptyDaysGiveNoUpdateAfterExactlySevenProbes() {
        when(source.search(any())).thenReturn(List.of());

        Resolution r = resolver(ResolutionMode.LATEST_UPDATE, 7, 0, 1).resolve(RunRequest.auto(), audit);

        assertThat(r.resolved()).isFalse();
        assertThat(r.probes()).isEqualTo(7);
        verify(source, times(7)).search(any());
    }

    @Test
    void probesWalkBackOneCalendarDayAtATime() {
        when(source.search(any())).thenReturn(List.of());
        ArgumentCaptor<CandidateQuery> captor = ArgumentCaptor.forClass(CandidateQuery.class);

        resolver(ResolutionMode.LATEST_UPDATE, 3, 0, 1).resolve(RunRequest.auto(), audit);

        verify(source, times(3)).search(captor.capture());
        List<CandidateQuery> queries = captor.getAllValues();
        assertThat(queries.get(0).start()).isEqualTo(Instant.parse("2025-02-05T00:00:00Z"));
        assertThat(queries.get(0).end()).isEqualTo(Instant.parse("2025-02-06T00:00:00Z"));
        assertThat(queries.get(2).start()).isEqualTo(Instant.parse("2025-02-03T00:00:00Z"));
        assertThat(queries).allSatisfy(q -> assertThat(Duration.between(q.start(), q.end())).isEqualTo(Duration.ofDays(1)));
    }

    @Test
    void firstNonEmptyDayIsResolvedWithItsCandidates() {
        Candidate c = candidate("2502.00001v1", "Agents", Instant.parse("2025-02-03T15:00:00Z"));
        when(source.search(any())).thenAnswer(inv -> {
            CandidateQuery q = inv.getArgument(0);
            return q.start().equals(Instant.parse("2025-02-03T00:00:00Z")) ? List.of(c) : List.of();
        });

        Resolution r = resolver(ResolutionMode.LATEST_UPDATE, 7, 0, 1).resolve(RunRequest.auto(), audit);

        assertThat(r.resolved()).isTrue();
        assertThat(r.dateLabel()).isEqualTo("2025-02-03");
        assertThat(r.probes()).isEqualTo(3);
        assertThat(r.candidates()).containsExactly(c);
        verify(source, times(3)).search(any());
    }

    @Test
    void transientFailureMovesOnToTheNextOlderDay() {
        Candidate c = candidate("2502.00002v1", "Reasoning", Instant.parse("2025-02-04T08:00:00Z"));
        when(source.search(any()))
                .thenThrow(new CandidateSourceException("503 Service Unavailable"))
                .thenReturn(List.of(c));

        Resolution r = resolver(ResolutionMode.LATEST_UPDATE, 7, 0, 1).resolve(RunRequest.auto(), audit);

        assertThat(r.dateLabel()).isEqualTo("2025-02-04");
        assertThat(audit.count(AuditOutcome.PROBE_FAILED)).isEqualTo(1);
    }

    @Test
    void probeIsRetriedBeforeMovingOn() {
        Candidate c = candidate("2502.00003v1", "Retrieval", NOW.minusSeconds(3600));
        when(source.search(any()))
                .thenThrow(new CandidateSourceException("timeout"))
                .thenReturn(List.of(c));

        Resolution r = resolver(ResolutionMode.LATEST_UPDATE, 7, 0, 2).resolve(RunRequest.auto(), audit);

        assertThat(r.dateLabel()).isEqualTo("2025-02-05");
        assertThat(r.probes()).isEqualTo(1);
        assertThat(audit.entries()).isEmpty();
    }

    @Test
    void failingSourceWithNoSuccessfulProbeIsAnError() {
        when(source.search(any())).thenThrow(new CandidateSourceException("connection refused"));

        assertThatThrownBy(() -> resolver(ResolutionMode.LATEST_UPDATE, 3, 0, 1).resolve(RunRequest.auto(), audit))
                .isInstanceOf(CandidateSourceException.class);
        assertThat(audit.count(AuditOutcome.PROBE_FAILED)).isEqualTo(3);
    }

    @Test
    void attemptCeilingStopsTheLookback() {
        when(source.search(any())).thenReturn(List.of());

        Resolution r = resolver(ResolutionMode.LATEST_UPDATE, 7, 3, 1).resolve(RunRequest.auto(), audit);

        assertThat(r.resolved()).isFalse();
        verify(source, times(3)).search(any());
    }

    @Test
    void pinnedDateIssuesExactlyOneProbeAndResolvesEvenWhenEmpty() {
        when(source.search(any())).thenReturn(List.of());
        ArgumentCaptor<CandidateQuery> captor = ArgumentCaptor.forClass(CandidateQuery.class);

        Resolution r = resolver(ResolutionMode.LATEST_UPDATE, 7, 0, 1)
                .resolve(new RunRequest("2025-01-20", null, null, false), audit);

        assertThat(r.resolved()).isTrue();
        assertThat(r.dateLabel()).isEqualTo("2025-01-20");
        assertThat(r.candidates()).isEmpty();
        assertThat(r.mode()).isEqualTo(ResolutionMode.PINNED_DATE);
        verify(source).search(captor.capture());
        assertThat(captor.getValue().start()).isEqualTo(Instant.parse("2025-01-20T00:00:00Z"));
    }

    @Test
    void invalidPinnedDateIsRejected() {
        assertThatThrownBy(() -> resolver(ResolutionMode.LATEST_UPDATE, 7, 0, 1)
                .resolve(new RunRequest("20-01-2025", null, null, false), audit))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(source);
    }

    @Test
    void fixedWindowEndsNowAndUsesTheResultCapOverride() {
        Candidate c = candidate("2502.00004v1", "Agents", NOW.minusSeconds(600));
        when(source.search(any())).thenReturn(List.of(c));
        ArgumentCaptor<CandidateQuery> captor = ArgumentCaptor.forClass(CandidateQuery.class);

        Resolution r = resolver(ResolutionMode.FIXED_WINDOW, 7, 0, 1)
                .resolve(new RunRequest(null, 25, null, false), audit);

        verify(source).search(captor.capture());
        assertThat(captor.getValue().end()).isEqualTo(NOW);
        assertThat(captor.getValue().start()).isEqualTo(NOW.minus(Duration.ofHours(24)));
        assertThat(captor.getValue().maxResults()).isEqualTo(25);
        assertThat(r.dateLabel()).isEqualTo("2025-02-05");
        assertThat(r.mode()).isEqualTo(ResolutionMode.FIXED_WINDOW);
    }

    @Test
    void emptyFixedWindowIsStillAResolvedPeriod() {
        when(source.search(any())).thenReturn(List.of());

        Resolution r = resolver(ResolutionMode.FIXED_WINDOW, 7, 0, 1).resolve(RunRequest.auto(), audit);

        assertThat(r.resolved()).isTrue();
        assertThat(r.candidates()).isEmpty();
        assertThat(r.dateLabel()).isEqualTo("2025-02-05");
        assertThat(r.start()).isEqualTo(NOW.minus(Duration.ofHours(24)));
        assertThat(r.end()).isEqualTo(NOW);
        verify(source, times(1)).search(any());
    }

    @Test
    void harvestedVersionsAreDeduplicated() {
        Instant t = NOW.minusSeconds(60);
        when(source.search(any())).thenReturn(List.of(
                candidate("2502.00005v1", "v1", t),
                candidate("2502.00005v2", "v2", t)));

        Resolution r = resolver(ResolutionMode.LATEST_UPDATE, 7, 0, 1).resolve(RunRequest.auto(), audit);

        assertThat(r.candidates()).extracting(Candidate::id).containsExactly("2502.00005v2");
    }
}
