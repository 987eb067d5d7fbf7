package com.example.paperdigest.model;

import java.time.Instant;
import java.util.List;

/**
 * A selected paper with its structured analysis.
 *
 * @param id               Versioned upstream identifier
 * @param title            Original title
 * @param localizedTitle   Title in the digest language
 * @param authors          Author names
 * @param url              Abstract page URL
 * @param published        First publication timestamp
 * @param updated          Last update timestamp
 * @param primaryCategory  Primary category
 * @param abstractText     Abstract
 * @param problem          Short problem statement
 * @param method           Short method statement
 * @param paradigmRelation Relation to the current state of the art
 * @param qualityScore     Novelty/relevance score in [1,5]
 * @param relevance        The verdict that selected the paper
 */
public record PaperRecord(
        String id,
        String title,
        String localizedTitle,
        List<String> authors,
        String url,
        Instant published,
        Instant updated,
        String primaryCategory,
        String abstractText,
        String problem,
        String method,
        String paradigmRelation,
        int qualityScore,
        RelevanceVerdict relevance
) {
    public PaperRecord {
        authors = authors != null ? List.copyOf(authors) : List.of();
    }

    public static PaperRecord from(Candidate c, ExtractionResponse analysis, RelevanceVerdict verdict) {
        String localized = analysis.localizedTitle() != null && !analysis.localizedTitle().isBlank()
                ? analysis.localizedTitle().trim()
                : c.title();
        return new PaperRecord(
                c.id(),
                c.title(),
                localized,
                c.authors(),
                c.url(),
                c.published(),
                c.updated(),
                c.primaryCategory(),
                c.abstractText(),
                analysis.problem().trim(),
                analysis.method().trim(),
                analysis.paradigmRelation().trim(),
                analysis.qualityScore(),
                verdict
        );
    }

    /** Identifier without version suffix, used to count a paper once across days. */
    public String baseId() {
        return Candidate.baseIdOf(id);
    }
}
