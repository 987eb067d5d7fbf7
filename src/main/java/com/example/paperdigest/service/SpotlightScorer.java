package com.example.paperdigest.service;

import com.example.paperdigest.agent.SpotlightIntroAgent;
import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.AttentionSignal;
import com.example.paperdigest.model.AuditOutcome;
import com.example.paperdigest.model.PaperRecord;
import com.example.paperdigest.model.SpotlightItem;
import com.example.paperdigest.port.SignalFetch;
import com.example.paperdigest.port.SignalSourcePort;
import com.example.paperdigest.thread.BoundedFanOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutorService;

/**
 * Spotlight of recent papers with unusual external attention.
 * <ol>
 *   <li>Eligibility: published within the recency window of the resolved period</li>
 *   <li>Signal fetch per (paper, source) on a bounded pool, through {@link SignalCache}</li>
 *   <li>Scoring with {@link AttentionScoring}, threshold, ordering, cap</li>
 *   <li>One introduction per selected paper, falling back to the problem statement</li>
 * </ol>
 */
@Service
public class SpotlightScorer {

    private static final Logger log = LoggerFactory.getLogger(SpotlightScorer.class);

    private record FetchTask(int paperIndex, PaperRecord record, SignalSourcePort source) {}

    private record Scored(int paperIndex, PaperRecord record, int score, List<AttentionSignal> signals) {}

    private final List<SignalSourcePort> sources;
    private final SignalCache cache;
    private final SpotlightIntroAgent introAgent;
    private final CallBudget budget;
    private final DigestProperties.Spotlight config;
    private final ExecutorService signalExecutor;
    private final Clock clock;

    public SpotlightScorer(List<SignalSourcePort> sources,
                           SignalCache cache,
                           SpotlightIntroAgent introAgent,
                           CallBudget budget,
                           DigestProperties properties,
                           @Qualifier("signalExecutor") ExecutorService signalExecutor,
                           Clock clock) {
        this.sources = List.copyOf(sources);
        this.cache = cache;
        this.introAgent = introAgent;
        this.budget = budget;
        this.config = properties.spotlight();
        this.signalExecutor = signalExecutor;
        this.clock = clock;
    }

    public List<SpotlightItem> spotlight(List<PaperRecord> records, Instant periodEnd,
                                         Instant deadline, AuditTrail audit) {
        if (!config.enabled()) {
            return List.of();
        }
        List<SignalSourcePort> active = sources.stream()
                .filter(s -> config.sources().contains(s.sourceId()))
                .toList();
        if (active.isEmpty()) {
            log.info("Spotlight: no signal source enabled");
            return List.of();
        }

        Instant cutoff = periodEnd.minus(Duration.ofDays(Math.max(0, config.recentDays())));
        List<FetchTask> tasks = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            PaperRecord r = records.get(i);
            if (r.published() != null && !r.published().isBefore(cutoff)) {
                for (SignalSourcePort source : active) {
                    tasks.add(new FetchTask(i, r, source));
                }
            }
        }
        if (tasks.isEmpty()) {
            log.info("Spotlight: no record published after {}", cutoff);
            return List.of();
        }

        LocalDate day = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        List<BoundedFanOut.Outcome<SignalFetch>> fetched = BoundedFanOut.run(
                tasks, t -> fetchCached(t, day), signalExecutor, deadline, clock);

        // gather signals per paper, in paper order
        List<List<AttentionSignal>> perPaper = new ArrayList<>(records.size());
        records.forEach(r -> perPaper.add(new ArrayList<>()));
        int unavailable = 0;
        for (int k = 0; k < tasks.size(); k++) {
            FetchTask t = tasks.get(k);
            BoundedFanOut.Outcome<SignalFetch> outcome = fetched.get(k);
            String why = null;
            if (outcome.cancelled()) {
                why = "cancelled";
            } else if (outcome.error() != null) {
                why = Backoff.rootCauseMessage(outcome.error());
            } else if (outcome.value().isUnavailable()) {
                why = outcome.value().detail();
            } else {
                perPaper.get(t.paperIndex()).addAll(outcome.value().signals());
            }
            if (why != null) {
                unavailable++;
                audit.record(t.record().id(), "spotlight", AuditOutcome.SIGNAL_UNAVAILABLE, 0,
                        t.source().sourceId() + ": " + why);
            }
        }
        if (unavailable == tasks.size()) {
            log.warn("Spotlight: every signal fetch failed ({}), no spotlight today", unavailable);
            return List.of();
        }

        List<Scored> scored = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            OptionalInt score = AttentionScoring.score(perPaper.get(i), config.metrics());
            if (score.isPresent() && score.getAsInt() >= config.threshold()) {
                scored.add(new Scored(i, records.get(i), score.getAsInt(), perPaper.get(i)));
            }
        }
        scored.sort(Comparator.comparingInt(Scored::score).reversed().thenComparingInt(Scored::paperIndex));
        List<Scored> top = scored.subList(0, Math.min(Math.max(0, config.maxItems()), scored.size()));

        List<SpotlightItem> items = new ArrayList<>(top.size());
        for (Scored s : top) {
            SpotlightItem item = new SpotlightItem(s.record().id(), s.record().title(), s.score(), s.signals(), null);
            items.add(item.withIntroduction(introduction(s.record(), item, audit)));
        }
        log.info("Spotlight: {} eligible fetches, {} unavailable, {} papers spotlighted",
                tasks.size(), unavailable, items.size());
        return items;
    }

    private SignalFetch fetchCached(FetchTask t, LocalDate day) {
        String source = t.source().sourceId();
        Optional<SignalFetch> hit = cache.get(t.record().id(), source, day);
        if (hit.isPresent()) {
            return hit.get();
        }
        SignalFetch fresh = t.source().fetch(t.record().baseId());
        return cache.putIfAbsent(t.record().id(), source, day, fresh);
    }

    private String introduction(PaperRecord record, SpotlightItem item, AuditTrail audit) {
        if (budget.isExhausted()) {
            audit.record(record.id(), "spotlight", AuditOutcome.NARRATIVE_SKIPPED, 0, "budget exhausted");
            return record.problem();
        }
        try {
            Optional<String> intro = introAgent.introduce(record, item);
            if (intro.isPresent()) {
                return intro.get();
            }
            audit.record(record.id(), "spotlight", AuditOutcome.NARRATIVE_FAILED, 0, "invalid output");
        } catch (RuntimeException e) {
            log.warn("Spotlight: introduction for {} failed: {}", record.id(), Backoff.rootCauseMessage(e));
            audit.record(record.id(), "spotlight", AuditOutcome.NARRATIVE_FAILED, 0, Backoff.rootCauseMessage(e));
        }
        return record.problem();
    }
}
