package com.example.paperdigest.model;

/**
 * Per-run overrides. Null fields fall back to configuration.
 *
 * @param date        ISO date to pin the period to, or null/"auto" to resolve
 * @param maxResults  Upstream result cap
 * @param maxSelected Selection cap
 * @param dryRun      Resolve and harvest only
 */
public record RunRequest(
        String date,
        Integer maxResults,
        Integer maxSelected,
        boolean dryRun
) {
    public static RunRequest auto() {
        return new RunRequest(null, null, null, false);
    }

    public boolean hasPinnedDate() {
        return date != null && !date.isBlank() && !"auto".equalsIgnoreCase(date);
    }
}
