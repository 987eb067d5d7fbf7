package com.example.paperdigest.port;

import com.example.paperdigest.model.Candidate;

import java.util.List;

/**
 * Search over the upstream paper catalog.
 */
public interface CandidateSourcePort {

    /**
     * @return candidates updated within the query window, newest first
     * @throws CandidateSourceException on transport or protocol failure
     */
    List<Candidate> search(CandidateQuery query);
}
