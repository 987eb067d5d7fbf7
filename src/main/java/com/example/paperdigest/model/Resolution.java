package com.example.paperdigest.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of period resolution.
 *
 * @param resolved   False for the no-update outcome; an empty resolved period is still reported
 * @param dateLabel  ISO date of the resolved period (null when not resolved)
 * @param start      Period start, inclusive
 * @param end        Period end, exclusive
 * @param mode       How the period was chosen
 * @param candidates Candidates already fetched while probing, or null when none were fetched
 * @param probes     Number of day probes issued
 */
public record Resolution(
        boolean resolved,
        String dateLabel,
        Instant start,
        Instant end,
        ResolutionMode mode,
        List<Candidate> candidates,
        int probes
) {
    public static Resolution noUpdate(ResolutionMode mode, int probes) {
        return new Resolution(false, null, null, null, mode, null, probes);
    }
}
