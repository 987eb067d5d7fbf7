package com.example.paperdigest.orchestrator;

import com.example.paperdigest.model.RunOutcome;
import com.example.paperdigest.model.RunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily trigger. The cron expression is {@code digest.schedule.cron}; "-" disables it.
 */
@Component
public class DailyDigestScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyDigestScheduler.class);

    private final DigestPipelineCoordinator coordinator;

    public DailyDigestScheduler(DigestPipelineCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(cron = "${digest.schedule.cron:-}", zone = "${digest.search.timezone:UTC}")
    public void runDaily() {
        log.info("Scheduled digest run triggered");
        try {
            RunOutcome outcome = coordinator.run(RunRequest.auto());
            log.info("Scheduled digest run finished: {} ({})", outcome.status(),
                    outcome.dateLabel() != null ? outcome.dateLabel() : "no date");
        } catch (RunInProgressException e) {
            log.warn("Scheduled digest run skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled digest run failed", e);
        }
    }
}
