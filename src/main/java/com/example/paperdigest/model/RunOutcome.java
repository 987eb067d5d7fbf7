package com.example.paperdigest.model;

import java.util.List;

/**
 * Result of one pipeline invocation.
 *
 * @param status     Terminal state
 * @param dateLabel  Resolved date, null for no-update
 * @param report     The persisted report, only for {@link RunStatus#COMPLETED}
 * @param candidates Harvested candidates, only for {@link RunStatus#DRY_RUN}
 * @param probes     Resolver probes issued
 */
public record RunOutcome(
        RunStatus status,
        String dateLabel,
        DailyReport report,
        List<Candidate> candidates,
        int probes
) {
    public static RunOutcome completed(DailyReport report, int probes) {
        return new RunOutcome(RunStatus.COMPLETED, report.date(), report, List.of(), probes);
    }

    public static RunOutcome noUpdate(int probes) {
        return new RunOutcome(RunStatus.NO_UPDATE, null, null, List.of(), probes);
    }

    public static RunOutcome dryRun(String dateLabel, List<Candidate> candidates, int probes) {
        return new RunOutcome(RunStatus.DRY_RUN, dateLabel, null, List.copyOf(candidates), probes);
    }
}
