package com.tierstore.model;

public record SummaryRequest(
        String title,
        String text,
        byte[] image,
        String mimeType,
        int maxAbstractTokens,
        int maxOverviewTokens) {

    public static SummaryRequest text(String title, String text, int maxAbstractTokens, int maxOverviewTokens) {
        return new SummaryRequest(title, text, null, null, maxAbstractTokens, maxOverviewTokens);
    }

    public static SummaryRequest image(String title, byte[] image, String mimeType, int maxAbstractTokens,
            int maxOverviewTokens) {
        return new SummaryRequest(title, "", image, mimeType, maxAbstractTokens, maxOverviewTokens);
    }

    public boolean hasImage() {
        return image != null && image.length > 0;
    }
}
