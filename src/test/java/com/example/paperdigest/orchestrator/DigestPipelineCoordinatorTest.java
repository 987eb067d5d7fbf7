package com.example.paperdigest.orchestrator;

import com.example.paperdigest.DigestFixtures;
import com.example.paperdigest.agent.RelevanceFilterAgent;
import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.model.DailyReport;
import com.example.paperdigest.model.ExtractionBatch;
import com.example.paperdigest.model.FilterResult;
import com.example.paperdigest.model.JudgedCandidate;
import com.example.paperdigest.model.PaperRecord;
import com.example.paperdigest.model.PeriodTrend;
import com.example.paperdigest.model.Resolution;
import com.example.paperdigest.model.ResolutionMode;
import com.example.paperdigest.model.RunOutcome;
import com.example.paperdigest.model.RunRequest;
import com.example.paperdigest.model.RunStatus;
import com.example.paperdigest.model.TrendPeriod;
import com.example.paperdigest.port.ArchivePersistenceException;
import com.example.paperdigest.port.ArchivePort;
import com.example.paperdigest.service.CallBudget;
import com.example.paperdigest.service.SpotlightScorer;
import com.example.paperdigest.service.TimeWindowResolver;
import com.example.paperdigest.service.TrendAggregator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.paperdigest.DigestFixtures.candidate;
import static com.example.paperdigest.DigestFixtures.record;
import static com.example.paperdigest.DigestFixtures.verdict;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DigestPipelineCoordinatorTest {

    private static final Instant START = Instant.parse("2025-02-04T00:00:00Z");
    private static final Instant END = Instant.parse("2025-02-05T00:00:00Z");

    @Mock
    private TimeWindowResolver resolver;
    @Mock
    private RelevanceFilterAgent filterAgent;
    @Mock
    private ExtractionOrchestrator extractionOrchestrator;
    @Mock
    private TrendAggregator trendAggregator;
    @Mock
    private SpotlightScorer spotlightScorer;
    @Mock
    private ArchivePort archive;

    private final Clock clock = Clock.fixed(Instant.parse("2025-02-05T07:00:00Z"), ZoneOffset.UTC);
    private ExecutorService stageExecutor;
    private DigestPipelineCoordinator coordinator;

    private final Candidate candidate = candidate("2502.00001v1", "Agents", START.plusSeconds(60));
    private final PaperRecord paper = record("2502.00001v1", "agents", START.plusSeconds(60));

    @BeforeEach
    void setUp() {
        stageExecutor = Executors.newFixedThreadPool(2);
        coordinator = new DigestPipelineCoordinator(resolver, filterAgent, extractionOrchestrator, trendAggregator,
                spotlightScorer, archive, new CallBudget(), DigestFixtures.defaults(), stageExecutor, clock);
    }

    @AfterEach
    void tearDown() {
        stageExecutor.shutdownNow();
    }

    private void stubHappyPath() {
        when(resolver.resolve(any(), any())).thenReturn(new Resolution(true, "2025-02-04", START, END,
                ResolutionMode.LATEST_UPDATE, List.of(candidate), 2));
        when(filterAgent.filter(anyList(), any(), any(), any())).thenReturn(new FilterResult(
                List.of(new JudgedCandidate(candidate.id(), candidate.title(), verdict(80), true)),
                List.of(candidate)));
        when(extractionOrchestrator.extract(any(), any(), any()))
                .thenReturn(new ExtractionBatch(List.of(paper), List.of()));
        when(trendAggregator.dayTrend(any(), anyList(), any()))
                .thenReturn(new PeriodTrend(TrendPeriod.DAY, "2025-02-04", "2025-02-04", "s", List.of(), 1, false));
        when(trendAggregator.rollups(any(), anyList(), any()))
                .thenReturn(new TrendAggregator.Rollups(null, null));
        when(spotlightScorer.spotlight(anyList(), any(), any(), any())).thenReturn(List.of());
    }

    @Test
    void noUpdateNeverWritesToTheArchive() {
        when(resolver.resolve(any(), any())).thenReturn(Resolution.noUpdate(ResolutionMode.LATEST_UPDATE, 7));

        RunOutcome outcome = coordinator.run(RunRequest.auto());

        assertThat(outcome.status()).isEqualTo(RunStatus.NO_UPDATE);
        assertThat(outcome.probes()).isEqualTo(7);
        verify(archive, never()).write(any(), any());
        verifyNoInteractions(filterAgent, extractionOrchestrator, trendAggregator, spotlightScorer);
    }

    @Test
    void emptyFixedWindowStillWritesAReportWithNoPapers() {
        when(resolver.resolve(any(), any())).thenReturn(new Resolution(true, "2025-02-05", START, END,
                ResolutionMode.FIXED_WINDOW, List.of(), 1));
        when(filterAgent.filter(anyList(), any(), any(), any())).thenReturn(new FilterResult(List.of(), List.of()));
        when(extractionOrchestrator.extract(any(), any(), any()))
                .thenReturn(new ExtractionBatch(List.of(), List.of()));
        when(trendAggregator.dayTrend(any(), anyList(), any()))
                .thenReturn(new PeriodTrend(TrendPeriod.DAY, "2025-02-05", "2025-02-05", "s", List.of(), 0, false));
        when(trendAggregator.rollups(any(), anyList(), any()))
                .thenReturn(new TrendAggregator.Rollups(null, null));
        when(spotlightScorer.spotlight(anyList(), any(), any(), any())).thenReturn(List.of());

        RunOutcome outcome = coordinator.run(RunRequest.auto());

        ArgumentCaptor<DailyReport> captor = ArgumentCaptor.forClass(DailyReport.class);
        verify(archive, times(1)).write(eq(LocalDate.parse("2025-02-05")), captor.capture());
        assertThat(outcome.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(captor.getValue().papers()).isEmpty();
        assertThat(captor.getValue().candidateCount()).isZero();
        assertThat(captor.getValue().resolutionMode()).isEqualTo(ResolutionMode.FIXED_WINDOW);
    }

    @Test
    void completedRunWritesOneReportUnderTheResolvedDate() {
        stubHappyPath();

        RunOutcome outcome = coordinator.run(RunRequest.auto());

        ArgumentCaptor<DailyReport> captor = ArgumentCaptor.forClass(DailyReport.class);
        verify(archive, times(1)).write(eq(LocalDate.parse("2025-02-04")), captor.capture());
        DailyReport report = captor.getValue();
        assertThat(outcome.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.date()).isEqualTo("2025-02-04");
        assertThat(report.windowStart()).isEqualTo(START);
        assertThat(report.papers()).containsExactly(paper);
        assertThat(report.judgments()).hasSize(1);
        assertThat(report.candidateCount()).isEqualTo(1);
        assertThat(report.usage()).isNotNull();
        verify(spotlightScorer).spotlight(eq(List.of(paper)), eq(END), any(), any());
    }

    @Test
    void persistenceFailureFailsTheRun() {
        stubHappyPath();
        doThrow(new ArchivePersistenceException("write failed", new RuntimeException("mongo down")))
                .when(archive).write(any(), any());

        assertThatThrownBy(() -> coordinator.run(RunRequest.auto()))
                .isInstanceOf(ArchivePersistenceException.class);
        assertThat(coordinator.isRunning()).isFalse();
    }

    @Test
    void dryRunStopsAfterHarvest() {
        stubHappyPath();

        RunOutcome outcome = coordinator.run(new RunRequest(null, null, null, true));

        assertThat(outcome.status()).isEqualTo(RunStatus.DRY_RUN);
        assertThat(outcome.candidates()).containsExactly(candidate);
        verifyNoInteractions(filterAgent, extractionOrchestrator, archive);
    }

    @Test
    void maxSelectedOverrideReachesTheFilter() {
        stubHappyPath();

        coordinator.run(new RunRequest(null, null, 3, false));

        verify(filterAgent).filter(anyList(), eq(3), any(), any());
    }

    @Test
    void secondRunWhileOneIsInProgressIsRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(resolver.resolve(any(), any())).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Resolution.noUpdate(ResolutionMode.LATEST_UPDATE, 1);
        });
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<RunOutcome> first = caller.submit(() -> coordinator.run(RunRequest.auto()));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> coordinator.run(RunRequest.auto()))
                    .isInstanceOf(RunInProgressException.class);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(RunStatus.NO_UPDATE);
        } finally {
            caller.shutdownNow();
        }
    }
}
