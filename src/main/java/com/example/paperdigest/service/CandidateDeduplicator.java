package com.example.paperdigest.service;

import com.example.paperdigest.model.Candidate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one candidate per upstream identifier: the highest version wins and replaces earlier
 * versions entirely. The survivor takes the position where its identifier first appeared.
 */
public final class CandidateDeduplicator {

    private CandidateDeduplicator() {
    }

    public static List<Candidate> dedupe(List<Candidate> candidates) {
        Map<String, Candidate> byBaseId = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            byBaseId.merge(c.baseId(), c, (kept, next) -> next.version() > kept.version() ? next : kept);
        }
        return new ArrayList<>(byBaseId.values());
    }
}
