package com.paperbot.output;

import com.paperbot.model.Candidate;
import com.paperbot.model.PaperItem;
import com.paperbot.model.TopicResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DigestRendererTest {
    private static final Instant NOW = Instant.parse("2024-03-04T23:30:00Z");
    private static final Instant CUTOFF = Instant.parse("2024-02-26T23:30:00Z");

    @Test
    void headerShouldCarryLocalDateAndCounts() {
        DigestRenderer renderer = new DigestRenderer("Digest {date} / {date_jst}", 120);
        List<TopicResult> results = List.of(
                new TopicResult("llm", List.of(candidate("1v1", "A", false)), List.of()),
                new TopicResult("robots", List.of(), List.of(candidate("2v1", "B", true)))
        );

        List<String> blocks = renderer.render(NOW, ZoneId.of("Asia/Tokyo"), CUTOFF, 7, results);

        assertEquals(3, blocks.size());
        String[] header = blocks.get(0).split("\n");
        assertEquals(4, header.length);
        assertEquals("Digest 2024-03-05 / 2024-03-05", header[0]);
        assertTrue(header[1].startsWith("Time: 2024-03-05 08:30 "));
        assertEquals("Cutoff (UTC): 2024-02-26T23:30:00Z", header[2]);
        assertEquals("Counts: llm (recent 1, educational 0), robots (recent 0, educational 1)", header[3]);
    }

    @Test
    void topicBlockShouldListEntriesAndPlaceholders() {
        DigestRenderer renderer = new DigestRenderer(null, 120);
        TopicResult llm = new TopicResult("llm",
                List.of(candidate("1v1", "Fast decoding", false)),
                List.of(candidate("2v1", "A tutorial", true)));
        TopicResult empty = new TopicResult("quiet", List.of(), List.of());

        List<String> blocks = renderer.render(NOW, ZoneOffset.UTC, CUTOFF, 7, List.of(llm, empty));

        assertTrue(blocks.get(0).startsWith("arXiv Daily Digest (2024-03-04)"));
        assertEquals(String.join("\n",
                "[llm] recent 1 / educational✔︎ 1",
                "Recent (within 7 days, submittedDate desc):",
                "- Fast decoding - Ada Lovelace et al. - cs.CL - https://arxiv.org/abs/1v1",
                "Educational / Beginner-friendly ✔︎:",
                "- ✔︎ A tutorial - Ada Lovelace et al. - cs.CL - https://arxiv.org/abs/2v1"), blocks.get(1));
        assertEquals(String.join("\n",
                "[quiet] recent 0 / educational✔︎ 0",
                "Recent (within 7 days, submittedDate desc):",
                "- (no recent papers)",
                "Educational / Beginner-friendly ✔︎:",
                "- (no educational papers)"), blocks.get(2));
    }

    @Test
    void longTitlesShouldBeTruncated() {
        DigestRenderer renderer = new DigestRenderer(null, 10);
        String line = renderer.entryLine(candidate("1v1", "Extremely long title", false));
        assertTrue(line.startsWith("- Extreme... - "));
    }

    @Test
    void authorShouldCollapseToFirstName() {
        assertEquals("Unknown", DigestRenderer.formatAuthor(List.of()));
        assertEquals("Solo", DigestRenderer.formatAuthor(List.of("Solo")));
        assertEquals("First et al.", DigestRenderer.formatAuthor(List.of("First", "Second", "Third")));
    }

    private static Candidate candidate(String id, String title, boolean educational) {
        PaperItem item = PaperItem.builder()
                .id(id)
                .title(title)
                .summary("")
                .authors(List.of("Ada Lovelace", "Charles Babbage"))
                .category("cs.CL")
                .publishedAt(NOW)
                .url("https://arxiv.org/abs/" + id)
                .build();
        return new Candidate(item, educational);
    }
}
