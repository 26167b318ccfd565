package com.tierstore.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractiveSummarizerTest {
    private static final String NOTES = """
            # Kickoff meeting
            The team met on Monday to plan the launch. Budget was approved. Risks were reviewed in detail.

            ## Actions
            Alice drafts the schedule.
            Bob books the venue.

            ## Open issues
            Hiring is still pending.
            """;

    private final ExtractiveSummarizer summarizer = new ExtractiveSummarizer();

    @Test
    void shouldBuildAbstractFromLeadingSentencesWithinBudget() {
        String abstractText = summarizer.abstractOf(NOTES, 16);

        assertTrue(abstractText.startsWith("Kickoff meeting. The team met on Monday"));
        assertTrue(TokenEstimator.estimate(abstractText) <= 16);
    }

    @Test
    void shouldOutlineHeadingsWithTheirLeadLine() {
        String overview = summarizer.overviewOf(NOTES, 200);

        assertEquals(String.join("\n",
                "# Kickoff meeting",
                "The team met on Monday to plan the launch. Budget was approved. Risks were reviewed in detail.",
                "## Actions",
                "Alice drafts the schedule.",
                "## Open issues",
                "Hiring is still pending."), overview);
    }

    @Test
    void shouldTruncateASingleOverlongSentence() {
        String abstractText = summarizer.abstractOf("one two three four five six seven eight", 3);

        assertEquals("one two three", abstractText);
    }

    @Test
    void shouldDescribeImagesWithoutText() {
        Summary summary = summarizer.summarize(SummaryRequest.image("diagram.png", new byte[] { 1, 2, 3, 4 }, "image/png", 100, 2000));

        assertEquals("Image diagram.png (image/png, 4 bytes)", summary.abstractText());
        assertEquals(ExtractiveSummarizer.MODEL_ID, summary.model());
    }
}
