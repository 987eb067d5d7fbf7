package com.example.paperdigest.agent;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.model.ExtractionFailure;
import com.example.paperdigest.model.ExtractionResponse;
import com.example.paperdigest.model.PaperRecord;
import com.example.paperdigest.model.RelevanceVerdict;
import com.example.paperdigest.model.RetryPolicy;
import com.example.paperdigest.port.BudgetExhaustedException;
import com.example.paperdigest.port.InferencePort;
import com.example.paperdigest.port.InferenceRequest;
import com.example.paperdigest.port.InferenceResult;
import com.example.paperdigest.port.InferenceTransportException;
import com.example.paperdigest.port.ModelTier;
import com.example.paperdigest.service.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Random;

/**
 * Structured extraction agent.
 * Reads the abstract of one selected paper and produces its problem statement, method,
 * relation to the prevailing paradigm, a 1-5 quality estimate and a localized title.
 */
@Service
public class PaperExtractionAgent {

    private static final Logger log = LoggerFactory.getLogger(PaperExtractionAgent.class);

    private static final String SYSTEM_PROMPT = """
            You are a senior researcher writing the entry of ONE paper in a daily research digest.
            You only have the title, the categories and the abstract.

            FIELDS:
            - localizedTitle: the title translated into the target language given in the request
              (copy it unchanged if the target language is English).
            - problem: the problem the paper addresses, 1-2 sentences.
            - method: the core technical approach, 1-2 sentences, concrete (models, data, algorithms).
            - paradigmRelation: how the work relates to the dominant approach of its field
              (extends, challenges, replaces, applies), 1 sentence.
            - qualityScore: integer 1-5 estimating novelty and rigor AS STATED IN THE ABSTRACT.
                1 = incremental or unclear, 3 = solid contribution, 5 = likely field-changing.

            ANTI-HALLUCINATION RULES:
            - Use ONLY information present in the abstract.
            - If the abstract does not state something, say so briefly instead of guessing.

            Write problem, method and paradigmRelation in the target language.
            """;

    /** Final state of one item: exactly one of record or failure is set. */
    public record Result(PaperRecord record, ExtractionFailure failure, int retries) {

        public boolean isSuccess() {
            return record != null;
        }
    }

    private final InferencePort inference;
    private final RetryPolicy retryPolicy;
    private final DigestProperties.Run run;
    private final Random jitter = new Random();

    public PaperExtractionAgent(InferencePort inference, DigestProperties properties) {
        this.inference = inference;
        this.retryPolicy = properties.extraction().retry().toPolicy();
        this.run = properties.run();
    }

    /**
     * Extracts one record. Never throws for model trouble: schema violations and transport
     * failures are retried with backoff, then reported as a failure. An exhausted budget fails
     * the item immediately.
     */
    public Result extract(Candidate candidate, RelevanceVerdict verdict) {
        String task = "PaperExtraction " + candidate.id();
        InferenceRequest<ExtractionResponse> base = new InferenceRequest<>(
                ModelTier.SMART, task, SYSTEM_PROMPT, payload(candidate),
                ExtractionResponse.class, run.deterministic())
                .withSingleTransportAttempt();

        InferenceRequest<ExtractionResponse> request = base;
        String lastProblem = "no attempt";
        int attempt = 0;
        while (attempt < retryPolicy.maxAttempts()) {
            attempt++;
            try {
                InferenceResult<ExtractionResponse> result = inference.infer(request);
                if (result.isSuccess()) {
                    PaperRecord record = PaperRecord.from(candidate, result.payload(), verdict);
                    log.debug("{}: extracted on attempt {}", task, attempt);
                    return new Result(record, null, attempt - 1);
                }
                lastProblem = "invalid output: " + result.describeViolations();
                request = base.withRepairHint(result.describeViolations());
            } catch (BudgetExhaustedException e) {
                lastProblem = "budget exhausted";
                break;
            } catch (InferenceTransportException e) {
                lastProblem = "transport: " + Backoff.rootCauseMessage(e);
                request = base;
            }

            if (retryPolicy.hasAttemptAfter(attempt)) {
                Duration delay = retryPolicy.delayAfter(attempt, jitter);
                log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                        task, attempt, retryPolicy.maxAttempts(), lastProblem, delay.toMillis());
                if (!Backoff.pause(delay)) {
                    lastProblem = "cancelled";
                    break;
                }
            }
        }

        log.warn("{}: giving up after {} attempts: {}", task, attempt, lastProblem);
        return new Result(null, new ExtractionFailure(candidate.id(), lastProblem, attempt), Math.max(0, attempt - 1));
    }

    private String payload(Candidate c) {
        return """
                TARGET LANGUAGE: %s
                DOMAIN: %s

                TITLE: %s
                CATEGORIES: %s
                ABSTRACT:
                ---
                %s
                ---
                """.formatted(
                run.language() != null ? run.language() : "English",
                run.domain() != null ? run.domain() : "",
                c.title(),
                String.join(", ", c.categories()),
                c.abstractText());
    }
}
