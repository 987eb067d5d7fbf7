package com.example.paperdigest.agent;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.AuditOutcome;
import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.model.FilterResult;
import com.example.paperdigest.model.JudgedCandidate;
import com.example.paperdigest.model.RelevanceResponse;
import com.example.paperdigest.model.RelevanceVerdict;
import com.example.paperdigest.model.ReviewMode;
import com.example.paperdigest.model.VerdictStage;
import com.example.paperdigest.port.BudgetExhaustedException;
import com.example.paperdigest.port.InferencePort;
import com.example.paperdigest.port.InferenceRequest;
import com.example.paperdigest.port.InferenceResult;
import com.example.paperdigest.port.InferenceTransportException;
import com.example.paperdigest.port.ModelTier;
import com.example.paperdigest.service.AuditTrail;
import com.example.paperdigest.service.Backoff;
import com.example.paperdigest.service.CallBudget;
import com.example.paperdigest.thread.BoundedFanOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Two-stage relevance filter.
 * <ol>
 *   <li>Keyword heuristics: exclude terms, empty include list, optional include prefilter (no LLM)</li>
 *   <li>Stage 1: FAST-tier classification of every remaining candidate</li>
 *   <li>Stage 2: SMART-tier review of the candidates whose score sits near the threshold</li>
 *   <li>Selection: threshold, deterministic ordering, cap</li>
 * </ol>
 * Every candidate ends with exactly one verdict.
 */
@Service
public class RelevanceFilterAgent {

    private static final Logger log = LoggerFactory.getLogger(RelevanceFilterAgent.class);

    static final int HEURISTIC_SCORE = 50;

    private static final String SYSTEM_PROMPT = """
            You are a research librarian screening new arXiv submissions for a daily digest.
            You judge ONE paper at a time from its title, abstract and categories.

            TASK:
            Decide whether the paper is relevant to the reader's interests, described by the
            domain and the list of include terms given in the request.

            SCORING (relevanceScore, integer 0-100):
            - 90-100: the paper is centrally about one or more include terms
            - 70-89: an include term is a major component of the contribution
            - 40-69: related work, the include terms appear only as context or application
            - 0-39: unrelated or only superficially matching

            RULES:
            - Judge the CONTRIBUTION, not the vocabulary: a passing mention is not relevance.
            - matchedTerms lists ONLY include terms actually supported by the abstract.
            - reason: ONE sentence (max 30 words) explaining the score.
            - isRelevant is true only when relevanceScore >= 40.
            - Do NOT invent content that is not in the abstract.

            Write everything in ENGLISH.
            """;

    private static final String REVIEW_ADDENDUM = """

            You are the SECOND reviewer. A faster screener already scored this paper close to
            the selection threshold. Read the abstract carefully and give your own independent
            score; do not anchor on a middle value.
            """;

    private final InferencePort inference;
    private final CallBudget budget;
    private final DigestProperties.Filter config;
    private final DigestProperties.Search search;
    private final DigestProperties.Run run;
    private final ExecutorService filterExecutor;
    private final Clock clock;

    public RelevanceFilterAgent(InferencePort inference,
                                CallBudget budget,
                                DigestProperties properties,
                                @Qualifier("filterExecutor") ExecutorService filterExecutor,
                                Clock clock) {
        this.inference = inference;
        this.budget = budget;
        this.config = properties.filter();
        this.search = properties.search();
        this.run = properties.run();
        this.filterExecutor = filterExecutor;
        this.clock = clock;
    }

    /**
     * Judges every candidate and selects the digest subset.
     *
     * @param maxSelectedOverride per-run cap, or null for the configured one
     * @param deadline            run deadline, or null for none
     */
    public FilterResult filter(List<Candidate> candidates, Integer maxSelectedOverride,
                               Instant deadline, AuditTrail audit) {
        int n = candidates.size();
        RelevanceVerdict[] verdicts = new RelevanceVerdict[n];
        List<String> include = search.keywordsInclude();
        boolean heuristicMode = include.isEmpty();

        // ── Heuristics (no LLM) ──
        List<Integer> toClassify = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Candidate c = candidates.get(i);
            Optional<String> excludedBy = firstMatch(c, search.keywordsExclude());
            if (excludedBy.isPresent()) {
                verdicts[i] = new RelevanceVerdict(false, 0, List.of(),
                        "Excluded by term '" + excludedBy.get() + "'", VerdictStage.HEURISTIC);
            } else if (heuristicMode) {
                verdicts[i] = new RelevanceVerdict(true, HEURISTIC_SCORE, List.of(),
                        "No include terms configured, accepted by default", VerdictStage.HEURISTIC);
            } else if (config.includePrefilter() && firstMatch(c, include).isEmpty()) {
                verdicts[i] = new RelevanceVerdict(false, 0, List.of(),
                        "No include term in title or abstract", VerdictStage.HEURISTIC);
            } else {
                toClassify.add(i);
            }
        }
        log.info("RelevanceFilter: {} candidates, {} decided by heuristics, {} to classify",
                n, n - toClassify.size(), toClassify.size());

        // ── Stage 1: FAST ──
        if (!toClassify.isEmpty()) {
            List<BoundedFanOut.Outcome<RelevanceVerdict>> fast = BoundedFanOut.run(
                    toClassify,
                    i -> classify(candidates.get(i), ModelTier.FAST),
                    filterExecutor, deadline, clock);
            for (int k = 0; k < toClassify.size(); k++) {
                int i = toClassify.get(k);
                verdicts[i] = settle(fast.get(k), candidates.get(i), "classify", audit);
            }
        }

        // ── Stage 2: REVIEW ──
        if (config.reviewMode() == ReviewMode.FAST_THEN_REVIEW) {
            review(candidates, verdicts, deadline, audit);
        }

        // ── Selection ──
        int maxSelected = maxSelectedOverride != null && maxSelectedOverride > 0
                ? maxSelectedOverride
                : config.maxSelected();
        List<Integer> ranked = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            RelevanceVerdict v = verdicts[i];
            if (v.relevant() && (heuristicMode || v.score() >= config.threshold())) {
                ranked.add(i);
            }
        }
        ranked.sort(selectionOrder(candidates, verdicts, heuristicMode));
        List<Integer> chosen = ranked.subList(0, Math.min(maxSelected, ranked.size()));

        boolean[] isSelected = new boolean[n];
        List<Candidate> selected = new ArrayList<>(chosen.size());
        for (int i : chosen) {
            isSelected[i] = true;
            selected.add(candidates.get(i));
        }
        List<JudgedCandidate> judgments = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Candidate c = candidates.get(i);
            judgments.add(new JudgedCandidate(c.id(), c.title(), verdicts[i], isSelected[i]));
        }

        log.info("RelevanceFilter: {} relevant above threshold, {} selected (cap {})",
                ranked.size(), selected.size(), maxSelected);
        return new FilterResult(judgments, selected);
    }

    private void review(List<Candidate> candidates, RelevanceVerdict[] verdicts, Instant deadline, AuditTrail audit) {
        List<Integer> band = new ArrayList<>();
        for (int i = 0; i < verdicts.length; i++) {
            RelevanceVerdict v = verdicts[i];
            if (v.stage() == VerdictStage.FAST && Math.abs(v.score() - config.threshold()) <= config.reviewBand()) {
                band.add(i);
            }
        }
        if (band.isEmpty()) {
            return;
        }
        if (budget.isExhausted()) {
            log.warn("RelevanceFilter: budget exhausted, skipping review of {} borderline candidates", band.size());
            audit.record("review", "filter", AuditOutcome.REVIEW_SKIPPED, 0,
                    "budget exhausted, " + band.size() + " borderline fast verdicts kept");
            return;
        }

        log.info("RelevanceFilter: reviewing {} borderline candidates (threshold {} +/- {})",
                band.size(), config.threshold(), config.reviewBand());
        List<BoundedFanOut.Outcome<RelevanceVerdict>> reviewed = BoundedFanOut.run(
                band,
                i -> classify(candidates.get(i), ModelTier.SMART),
                filterExecutor, deadline, clock);
        for (int k = 0; k < band.size(); k++) {
            int i = band.get(k);
            BoundedFanOut.Outcome<RelevanceVerdict> outcome = reviewed.get(k);
            if (outcome.isSuccess() && outcome.value().stage() == VerdictStage.REVIEW) {
                verdicts[i] = outcome.value();
            } else {
                String why = outcome.cancelled() ? "cancelled"
                        : outcome.error() != null ? Backoff.rootCauseMessage(outcome.error())
                        : outcome.value().rationale();
                audit.record(candidates.get(i).id(), "review", AuditOutcome.REVIEW_SKIPPED, 0,
                        "fast verdict kept: " + why);
            }
        }
    }

    /**
     * One classification with schema re-prompts. Transport and budget failures end it with a
     * FAILED verdict; they never escape the item.
     */
    RelevanceVerdict classify(Candidate candidate, ModelTier tier) {
        VerdictStage stage = tier == ModelTier.FAST ? VerdictStage.FAST : VerdictStage.REVIEW;
        String task = "RelevanceFilter[" + stage + "] " + candidate.id();
        InferenceRequest<RelevanceResponse> base = new InferenceRequest<>(
                tier, task,
                tier == ModelTier.FAST ? SYSTEM_PROMPT : SYSTEM_PROMPT + REVIEW_ADDENDUM,
                payload(candidate),
                RelevanceResponse.class,
                run.deterministic());

        int maxAttempts = Math.max(1, config.maxAttempts());
        InferenceRequest<RelevanceResponse> request = base;
        String lastProblem = "no attempt";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                InferenceResult<RelevanceResponse> result = inference.infer(request);
                if (result.isSuccess()) {
                    return result.payload().toVerdict(stage);
                }
                lastProblem = result.describeViolations();
                log.debug("{}: attempt {}/{} rejected: {}", task, attempt, maxAttempts, lastProblem);
                request = base.withRepairHint(lastProblem);
            } catch (BudgetExhaustedException | InferenceTransportException e) {
                lastProblem = Backoff.rootCauseMessage(e);
                break;
            }
        }
        return RelevanceVerdict.failed(stage + " classification failed: " + lastProblem);
    }

    private static RelevanceVerdict settle(BoundedFanOut.Outcome<RelevanceVerdict> outcome, Candidate c,
                                           String stage, AuditTrail audit) {
        RelevanceVerdict verdict;
        if (outcome.isSuccess()) {
            verdict = outcome.value();
        } else if (outcome.cancelled()) {
            verdict = RelevanceVerdict.failed("cancelled");
        } else {
            verdict = RelevanceVerdict.failed(Backoff.rootCauseMessage(outcome.error()));
        }
        if (verdict.stage() == VerdictStage.FAILED) {
            log.warn("RelevanceFilter: {} failed for {}: {}", stage, c.id(), verdict.rationale());
            audit.record(c.id(), stage, AuditOutcome.CLASSIFICATION_FAILED, 0, verdict.rationale());
        }
        return verdict;
    }

    private String payload(Candidate c) {
        return """
                DOMAIN: %s
                INCLUDE TERMS: %s

                TITLE: %s
                CATEGORIES: %s
                ABSTRACT:
                ---
                %s
                ---
                """.formatted(
                run.domain() != null ? run.domain() : "",
                String.join(", ", search.keywordsInclude()),
                c.title(),
                String.join(", ", c.categories()),
                c.abstractText());
    }

    private static Optional<String> firstMatch(Candidate c, List<String> terms) {
        String haystack = (c.title() + "\n" + c.abstractText()).toLowerCase(Locale.ROOT);
        return terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .filter(t -> haystack.contains(t.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    /** Score desc, then timestamp desc, then id asc; recency only in heuristic mode. */
    private static Comparator<Integer> selectionOrder(List<Candidate> candidates, RelevanceVerdict[] verdicts,
                                                      boolean heuristicMode) {
        Comparator<Integer> byRecency = Comparator.comparing(
                (Integer i) -> candidates.get(i).timestamp(),
                Comparator.nullsLast(Comparator.reverseOrder()));
        Comparator<Integer> byId = Comparator.comparing(i -> candidates.get(i).id());
        if (heuristicMode) {
            return byRecency.thenComparing(byId);
        }
        return Comparator.comparingInt((Integer i) -> verdicts[i].score()).reversed()
                .thenComparing(byRecency)
                .thenComparing(byId);
    }
}
