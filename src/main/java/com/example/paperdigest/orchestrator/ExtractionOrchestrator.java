package com.example.paperdigest.orchestrator;

import com.example.paperdigest.agent.PaperExtractionAgent;
import com.example.paperdigest.model.AuditOutcome;
import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.model.ExtractionBatch;
import com.example.paperdigest.model.ExtractionFailure;
import com.example.paperdigest.model.FilterResult;
import com.example.paperdigest.model.PaperRecord;
import com.example.paperdigest.service.AuditTrail;
import com.example.paperdigest.service.Backoff;
import com.example.paperdigest.thread.BoundedFanOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Runs {@link PaperExtractionAgent} over the selected candidates on a bounded pool.
 * A failing item becomes an {@link ExtractionFailure} and never affects the others;
 * records keep the order of the selection.
 */
@Service
public class ExtractionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    private final PaperExtractionAgent extractionAgent;
    private final ExecutorService extractionExecutor;
    private final Clock clock;

    public ExtractionOrchestrator(PaperExtractionAgent extractionAgent,
                                  @Qualifier("extractionExecutor") ExecutorService extractionExecutor,
                                  Clock clock) {
        this.extractionAgent = extractionAgent;
        this.extractionExecutor = extractionExecutor;
        this.clock = clock;
    }

    public ExtractionBatch extract(FilterResult filtered, Instant deadline, AuditTrail audit) {
        List<Candidate> selected = filtered.selected();
        if (selected.isEmpty()) {
            return new ExtractionBatch(List.of(), List.of());
        }

        List<BoundedFanOut.Outcome<PaperExtractionAgent.Result>> outcomes = BoundedFanOut.run(
                selected,
                c -> extractionAgent.extract(c, filtered.verdictFor(c.id())),
                extractionExecutor, deadline, clock);

        List<PaperRecord> records = new ArrayList<>();
        List<ExtractionFailure> failures = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            Candidate c = selected.get(i);
            BoundedFanOut.Outcome<PaperExtractionAgent.Result> outcome = outcomes.get(i);

            if (outcome.cancelled()) {
                failures.add(new ExtractionFailure(c.id(), "cancelled", 0));
                audit.record(c.id(), "extract", AuditOutcome.EXTRACTION_FAILED, 0, "cancelled");
                continue;
            }
            if (outcome.error() != null) {
                String reason = Backoff.rootCauseMessage(outcome.error());
                log.error("ExtractionOrchestrator: unexpected error for {}", c.id(), outcome.error());
                failures.add(new ExtractionFailure(c.id(), reason, 0));
                audit.record(c.id(), "extract", AuditOutcome.EXTRACTION_FAILED, 0, reason);
                continue;
            }

            PaperExtractionAgent.Result result = outcome.value();
            if (result.isSuccess()) {
                records.add(result.record());
                audit.record(c.id(), "extract",
                        result.retries() == 0 ? AuditOutcome.EXTRACTED : AuditOutcome.EXTRACTED_AFTER_RETRY,
                        result.retries(), null);
            } else {
                failures.add(result.failure());
                audit.record(c.id(), "extract", AuditOutcome.EXTRACTION_FAILED,
                        result.retries(), result.failure().reason());
            }
        }

        log.info("ExtractionOrchestrator: {}/{} extracted, {} failed",
                records.size(), selected.size(), failures.size());
        return new ExtractionBatch(records, failures);
    }
}
