package com.tierstore.context;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A contiguous line range of a resource. Lines are 1-based and inclusive. A line too long for one
 * chunk is spread over several chunks numbered by {@code part} from 1; whole-line chunks have
 * part 0.
 */
public record ContentChunk(int index, int startLine, int endLine, String text, int tokens, int part) {
    private static final Pattern ANCHOR_LINES = Pattern.compile("lines (\\d+)-(\\d+)");
    private static final Pattern ANCHOR_PART = Pattern.compile("\\| part (\\d+)");

    public ContentChunk(int index, int startLine, int endLine, String text, int tokens) {
        this(index, startLine, endLine, text, tokens, 0);
    }

    public String anchor() {
        String lines = "[section " + (index + 1) + " | lines " + startLine + "-" + endLine;
        return part > 0 ? lines + " | part " + part + "]" : lines + "]";
    }

    /**
     * Part number named by an {@link #anchor()}, or {@code 0} for a chunk of whole lines.
     */
    public static int partOf(String anchor) {
        if (anchor == null) {
            return 0;
        }
        Matcher matcher = ANCHOR_PART.matcher(anchor);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }

    /**
     * First line named by an {@link #anchor()}, or {@code -1} when the text carries no line range.
     */
    public static int startLineOf(String anchor) {
        if (anchor == null) {
            return -1;
        }
        Matcher matcher = ANCHOR_LINES.matcher(anchor);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : -1;
    }
}
