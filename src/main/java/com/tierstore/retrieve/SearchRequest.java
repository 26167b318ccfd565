package com.tierstore.retrieve;

import java.util.List;

import com.tierstore.filter.FilterExpression;
import com.tierstore.model.ModelInput;
import com.tierstore.registry.TenantScope;
import com.tierstore.store.RecordFields;

/**
 * A query in text or image form within one tenant scope. {@code scoreThreshold} drops results
 * scoring below it; {@code null} keeps everything. A non-empty {@code targetDirectories} keeps only
 * resources whose URI lies beneath one of the listed directories.
 */
public record SearchRequest(
        String text,
        ModelInput image,
        TenantScope scope,
        FilterExpression filter,
        int topK,
        Float scoreThreshold,
        List<String> targetDirectories) {

    public SearchRequest {
        targetDirectories = targetDirectories == null ? List.of() : List.copyOf(targetDirectories);
        if (scope == null) {
            throw new IllegalArgumentException("search requires a tenant scope");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        if ((text == null || text.isBlank()) && image == null) {
            throw new IllegalArgumentException("search requires query text or an image");
        }
    }

    public static SearchRequest of(TenantScope scope, String text, int topK) {
        return new SearchRequest(text, null, scope, null, topK, null, List.of());
    }

    public static SearchRequest ofImage(TenantScope scope, byte[] image, String mimeType, int topK) {
        return new SearchRequest(null, ModelInput.image(image, mimeType), scope, null, topK, null, List.of());
    }

    public SearchRequest withFilter(FilterExpression newFilter) {
        return new SearchRequest(text, image, scope, newFilter, topK, scoreThreshold, targetDirectories);
    }

    public SearchRequest withScoreThreshold(Float threshold) {
        return new SearchRequest(text, image, scope, filter, topK, threshold, targetDirectories);
    }

    public SearchRequest withTargetDirectories(List<String> directories) {
        return new SearchRequest(text, image, scope, filter, topK, scoreThreshold, directories);
    }

    /**
     * URI filter for {@code targetDirectories}, or {@code null} when the search is not scoped.
     */
    public FilterExpression directoryFilter() {
        if (targetDirectories.isEmpty()) {
            return null;
        }
        FilterExpression[] scopes = targetDirectories.stream()
                .map(directory -> FilterExpression.under(RecordFields.URI, directory))
                .toArray(FilterExpression[]::new);
        return scopes.length == 1 ? scopes[0] : FilterExpression.or(scopes);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public ModelInput queryInput() {
        return image != null ? image : ModelInput.text(text);
    }
}
