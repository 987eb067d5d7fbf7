package com.example.paperdigest.model;

import java.time.Instant;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A paper returned by the upstream search, before any relevance judgment.
 *
 * @param id              Versioned upstream identifier (e.g. 2502.01234v2)
 * @param title           Title, whitespace-collapsed
 * @param authors         Author names in upstream order
 * @param published       First publication timestamp
 * @param updated         Last update timestamp (may equal {@code published})
 * @param categories      All categories the paper is listed under
 * @param primaryCategory Primary category
 * @param abstractText    Abstract, whitespace-collapsed
 * @param url             Abstract page URL
 */
public record Candidate(
        String id,
        String title,
        List<String> authors,
        Instant published,
        Instant updated,
        List<String> categories,
        String primaryCategory,
        String abstractText,
        String url
) {
    private static final Pattern VERSION_SUFFIX = Pattern.compile("^(.*?)v(\\d+)$");

    public Candidate {
        authors = authors != null ? List.copyOf(authors) : List.of();
        categories = categories != null ? List.copyOf(categories) : List.of();
        title = title != null ? title : "";
        abstractText = abstractText != null ? abstractText : "";
    }

    /** Identifier without the version suffix. */
    public String baseId() {
        return baseIdOf(id);
    }

    public static String baseIdOf(String versionedId) {
        Matcher m = VERSION_SUFFIX.matcher(versionedId);
        return m.matches() ? m.group(1) : versionedId;
    }

    /** Version number, 1 when the identifier carries no suffix. */
    public int version() {
        Matcher m = VERSION_SUFFIX.matcher(id);
        return m.matches() ? Integer.parseInt(m.group(2)) : 1;
    }

    /** Timestamp used for recency ranking: last update, falling back to publication. */
    public Instant timestamp() {
        return updated != null ? updated : published;
    }
}
