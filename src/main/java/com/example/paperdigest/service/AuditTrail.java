package com.example.paperdigest.service;

import com.example.paperdigest.model.AuditEntry;
import com.example.paperdigest.model.AuditOutcome;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run collector of degraded, retried and failed items. Shared by all worker threads of
 * the run; entries are only appended.
 */
public final class AuditTrail {

    private final Clock clock;
    private final List<AuditEntry> entries = Collections.synchronizedList(new ArrayList<>());

    public AuditTrail(Clock clock) {
        this.clock = clock;
    }

    public void record(String subject, String stage, AuditOutcome outcome, int retries, String detail) {
        entries.add(new AuditEntry(safe(subject), stage, outcome, retries, safe(detail), clock.instant()));
    }

    public List<AuditEntry> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public long count(AuditOutcome outcome) {
        synchronized (entries) {
            return entries.stream().filter(e -> e.outcome() == outcome).count();
        }
    }

    private static String safe(String s) {
        if (s == null) return "";
        String flat = s.replaceAll("[\\r\\n]+", " ").trim();
        return flat.length() > 300 ? flat.substring(0, 297) + "..." : flat;
    }
}
