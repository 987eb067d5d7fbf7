package com.example.paperdigest.agent;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.KeywordWeight;
import com.example.paperdigest.model.NarrativeResponse;
import com.example.paperdigest.model.PaperRecord;
import com.example.paperdigest.model.TrendPeriod;
import com.example.paperdigest.port.InferencePort;
import com.example.paperdigest.port.InferenceRequest;
import com.example.paperdigest.port.InferenceResult;
import com.example.paperdigest.port.ModelTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes the narrative summary of one trend window.
 */
@Service
public class TrendNarrativeAgent {

    private static final Logger log = LoggerFactory.getLogger(TrendNarrativeAgent.class);

    /** Papers sent to the model; the keyword list already covers the whole window. */
    private static final int MAX_PAPERS_IN_PROMPT = 40;

    private static final String SYSTEM_PROMPT = """
            You are a research analyst writing the trend section of a research digest.
            You receive the selected papers of ONE period (title, problem, method) and the
            period's top keywords with their weights.

            TASK:
            Write ONE paragraph (80-150 words) describing the dominant research directions of the
            period: which problems recur, which methods are gaining ground, and any notable shift.

            RULES:
            - Ground every statement in the listed papers; do NOT cite papers that are not listed.
            - No bullet points, no headings, no markdown.
            - Return a JSON object with a single field "text".
            """;

    private final InferencePort inference;
    private final DigestProperties.Run run;

    public TrendNarrativeAgent(InferencePort inference, DigestProperties properties) {
        this.inference = inference;
        this.run = properties.run();
    }

    /**
     * @return the narrative, or empty when the model output stayed invalid after one re-prompt.
     *         Transport and budget exceptions propagate to the caller.
     */
    public Optional<String> narrate(TrendPeriod period, String startDate, String endDate,
                                    List<PaperRecord> records, List<KeywordWeight> keywords) {
        String task = "TrendNarrative " + period;
        InferenceRequest<NarrativeResponse> request = new InferenceRequest<>(
                ModelTier.SMART, task, SYSTEM_PROMPT,
                payload(period, startDate, endDate, records, keywords),
                NarrativeResponse.class, true);

        InferenceResult<NarrativeResponse> result = inference.infer(request);
        if (!result.isSuccess()) {
            result = inference.infer(request.withRepairHint(result.describeViolations()));
        }
        if (!result.isSuccess()) {
            log.warn("{}: invalid narrative output: {}", task, result.describeViolations());
            return Optional.empty();
        }
        return Optional.of(result.payload().text().trim());
    }

    private String payload(TrendPeriod period, String startDate, String endDate,
                           List<PaperRecord> records, List<KeywordWeight> keywords) {
        String papers = records.stream()
                .limit(MAX_PAPERS_IN_PROMPT)
                .map(r -> "- %s | problem: %s | method: %s".formatted(r.title(), r.problem(), r.method()))
                .collect(Collectors.joining("\n"));
        String kw = keywords.stream()
                .map(k -> "%s (%.2f)".formatted(k.term(), k.weight()))
                .collect(Collectors.joining(", "));
        return """
                PERIOD: %s from %s to %s (%d papers)
                DOMAIN: %s
                LANGUAGE: %s

                TOP KEYWORDS: %s

                PAPERS:
                %s
                """.formatted(period, startDate, endDate, records.size(),
                run.domain() != null ? run.domain() : "",
                run.language() != null ? run.language() : "English",
                kw, papers);
    }
}
