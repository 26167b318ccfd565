package com.tierstore.model;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Deterministic summarizer used when no VLM is configured: leading sentences for the abstract,
 * heading outline with lead lines for the overview.
 */
public final class ExtractiveSummarizer {
    public static final String MODEL_ID = "extractive";

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+.*");

    public Summary summarize(SummaryRequest request) {
        if (request.hasImage() && (request.text() == null || request.text().isBlank())) {
            String description = "Image " + (request.title() == null ? "" : request.title() + " ")
                    + "(" + request.mimeType() + ", " + request.image().length + " bytes)";
            return new Summary(description.replaceAll("\\s+", " ").strip(), description, MODEL_ID);
        }
        String text = request.text() == null ? "" : request.text();
        return new Summary(
                abstractOf(text, request.maxAbstractTokens()),
                overviewOf(text, request.maxOverviewTokens()),
                MODEL_ID);
    }

    String abstractOf(String text, int maxTokens) {
        StringBuilder prose = new StringBuilder();
        for (String line : text.split("\\R")) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            if (HEADING.matcher(stripped).matches()) {
                stripped = stripped.replaceFirst("^#+\\s+", "");
                if (!stripped.endsWith(".")) {
                    stripped = stripped + ".";
                }
            }
            prose.append(stripped).append(' ');
        }
        StringBuilder out = new StringBuilder();
        int used = 0;
        for (String sentence : SENTENCE_END.split(prose.toString().strip())) {
            int cost = TokenEstimator.estimate(sentence);
            if (used + cost > maxTokens) {
                if (out.length() == 0) {
                    return TokenEstimator.truncate(sentence, maxTokens);
                }
                break;
            }
            out.append(sentence).append(' ');
            used += cost;
        }
        return out.toString().strip();
    }

    String overviewOf(String text, int maxTokens) {
        List<String> outline = new ArrayList<>();
        String[] lines = text.split("\\R");
        boolean sawHeading = false;
        boolean wantLead = true;
        for (String line : lines) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                if (!sawHeading) {
                    wantLead = true;
                }
                continue;
            }
            if (HEADING.matcher(stripped).matches()) {
                sawHeading = true;
                outline.add(stripped);
                wantLead = true;
            } else if (wantLead) {
                outline.add(stripped);
                wantLead = false;
            }
        }
        StringBuilder out = new StringBuilder();
        int used = 0;
        for (String entry : outline) {
            int cost = TokenEstimator.estimate(entry);
            if (used + cost > maxTokens) {
                if (out.length() == 0) {
                    return TokenEstimator.truncate(entry, maxTokens);
                }
                break;
            }
            out.append(entry).append('\n');
            used += cost;
        }
        return out.toString().strip();
    }
}
