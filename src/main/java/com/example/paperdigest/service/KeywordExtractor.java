package com.example.paperdigest.service;

import com.example.paperdigest.model.KeywordWeight;
import com.example.paperdigest.model.PaperRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frequency-based keyword ranking over a set of paper records.
 * Weight = count / max count, so the top term always weighs 1.0; ties keep first-seen order.
 */
public final class KeywordExtractor {

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z][A-Za-z0-9+_/-]{2,}");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "are", "was", "were", "been", "have",
            "has", "had", "not", "but", "its", "our", "their", "they", "them", "these", "those", "such",
            "which", "while", "where", "when", "what", "who", "how", "than", "then", "into", "onto",
            "over", "under", "between", "through", "across", "about", "also", "can", "could", "may",
            "might", "will", "would", "should", "must", "more", "most", "less", "each", "both", "all",
            "any", "other", "some", "only", "very", "well", "new", "use", "used", "using", "based",
            "show", "shows", "shown", "propose", "proposed", "proposes", "present", "presents",
            "paper", "work", "approach", "method", "methods", "results", "result", "study", "existing",
            "however", "further", "without", "within", "via", "one", "two", "three", "first", "does",
            "data", "task", "tasks", "model", "models", "performance", "achieve", "achieves",
            "significantly", "furthermore", "moreover", "thus", "here", "there", "abstract"
    );

    private KeywordExtractor() {
    }

    public static List<KeywordWeight> topKeywords(List<PaperRecord> records, int topK) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PaperRecord r : records) {
            count(counts, r.method());
            count(counts, r.paradigmRelation());
            count(counts, r.abstractText());
            if (r.relevance() != null) {
                for (String term : r.relevance().matchedTerms()) {
                    count(counts, term);
                }
            }
        }
        if (counts.isEmpty() || topK <= 0) {
            return List.of();
        }

        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(1);
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        // stable sort: equal counts keep insertion (first-seen) order
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<KeywordWeight> out = new ArrayList<>(Math.min(topK, entries.size()));
        for (Map.Entry<String, Integer> e : entries.subList(0, Math.min(topK, entries.size()))) {
            out.add(new KeywordWeight(e.getKey(), (double) e.getValue() / max));
        }
        return out;
    }

    static void count(Map<String, Integer> counts, String text) {
        if (text == null || text.isBlank()) return;
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            String token = m.group().toLowerCase(Locale.ROOT);
            if (!STOP_WORDS.contains(token)) {
                counts.merge(token, 1, Integer::sum);
            }
        }
    }
}
