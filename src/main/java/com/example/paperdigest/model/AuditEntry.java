package com.example.paperdigest.model;

import java.time.Instant;

/**
 * One line of the run audit trail.
 *
 * @param subject    What the entry is about (candidate id, source name, trend period)
 * @param stage      Pipeline stage that recorded it
 * @param outcome    What happened
 * @param retries    Retries spent before the outcome
 * @param detail     Free-form detail, typically the last error
 * @param recordedAt When it was recorded
 */
public record AuditEntry(
        String subject,
        String stage,
        AuditOutcome outcome,
        int retries,
        String detail,
        Instant recordedAt
) {}
