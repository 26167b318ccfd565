package com.tierstore.retrieve;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.tierstore.context.ContextLayer;

/**
 * One ranked resource. {@code denseScore} and {@code sparseScore} are the per-kind scores before
 * fusion; {@code score} is the final score the list is ordered by.
 */
public record SearchResult(
        String uri,
        String resourceId,
        float score,
        float denseScore,
        float sparseScore,
        ContextLayer layer,
        long createdAt,
        Map<String, Object> fields) {

    /** Score descending, then most recent first, then URI ascending. */
    public static final Comparator<SearchResult> ORDER = Comparator
            .comparing(SearchResult::score, Comparator.reverseOrder())
            .thenComparing(SearchResult::createdAt, Comparator.reverseOrder())
            .thenComparing(SearchResult::uri);

    public SearchResult {
        if (fields == null) {
            fields = Map.of();
        } else {
            Map<String, Object> copy = new LinkedHashMap<>();
            fields.forEach((name, value) -> {
                if (value != null) {
                    copy.put(name, value);
                }
            });
            fields = Collections.unmodifiableMap(copy);
        }
    }

    public SearchResult withScore(float newScore) {
        return new SearchResult(uri, resourceId, newScore, denseScore, sparseScore, layer, createdAt, fields);
    }

    public String text() {
        Object value = fields.get("text");
        return value == null ? "" : value.toString();
    }

    public String abstractText() {
        Object value = fields.get("abstract");
        return value == null ? "" : value.toString();
    }
}
