package com.paperbot.core;

import com.paperbot.model.Candidate;
import com.paperbot.model.PaperItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CandidateSelectorTest {

    @Test
    void selectShouldFilterAndOrderNewestFirst() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<PaperItem> items = List.of(
                item("c", 8, "Sparse attention"),
                item("a", 10, "Faster decoding"),
                item("old", 4, "Too old"),
                item("b", 9, "Better routing")
        );

        List<Candidate> candidates = selector.select(items, at(5), Set.of());

        assertEquals(List.of("a", "b", "c"), ids(candidates));
    }

    @Test
    void itemAtCutoffShouldBeKept() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<Candidate> candidates = selector.select(List.of(item("edge", 5, "x")), at(5), Set.of());
        assertEquals(List.of("edge"), ids(candidates));
    }

    @Test
    void selectShouldDropInvalidDeliveredAndRepeatedItems() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<PaperItem> items = new ArrayList<>();
        items.add(item("a", 10, "first copy"));
        items.add(item("", 10, "no id"));
        items.add(PaperItem.builder().id("no-time").title("t").summary("").authors(List.of()).build());
        items.add(item("sent", 9, "already delivered"));
        items.add(item("a", 7, "second copy"));
        items.add(null);

        List<Candidate> candidates = selector.select(items, at(0), Set.of("sent"));

        assertEquals(1, candidates.size());
        assertEquals("first copy", candidates.get(0).item.title);
    }

    @Test
    void equalTimestampsShouldKeepInputOrder() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<PaperItem> items = List.of(item("x", 5, "x"), item("y", 6, "y"), item("z", 5, "z"), item("w", 5, "w"));

        assertEquals(List.of("y", "x", "z", "w"), ids(selector.select(items, at(0), Set.of())));
    }

    @Test
    void reselectWithEverythingDeliveredShouldBeEmpty() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<PaperItem> items = List.of(item("a", 10, "A survey"), item("b", 9, "b"), item("c", 8, "c"));

        List<Candidate> first = selector.select(items, at(5), Set.of());
        Set<String> delivered = new HashSet<>(ids(first));

        assertTrue(selector.select(items, at(5), delivered).isEmpty());
    }

    @Test
    void selectShouldTagEducationalItems() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<Candidate> candidates = selector.select(
                List.of(item("s", 10, "A Survey of Agents"), item("n", 9, "Novel agent method")), at(0), Set.of());

        assertTrue(candidates.get(0).educational);
        assertFalse(candidates.get(1).educational);
    }

    @Test
    void partitionShouldTruncateRecentInOrder() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<Candidate> candidates = selector.select(
                List.of(item("a", 10, "a"), item("b", 9, "b"), item("c", 8, "c")), at(5), Set.of());

        CandidateSelector.TopicSelection selection = selector.partition(candidates, 2, 1);

        assertEquals(List.of("a", "b"), ids(selection.recent()));
        assertTrue(selection.educational().isEmpty());
    }

    @Test
    void partitionShouldReturnWholeEducationalPoolWhenWithinCap() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<Candidate> candidates = selector.select(List.of(
                item("e1", 10, "A tutorial"),
                item("r1", 9, "method"),
                item("e2", 8, "A survey")), at(0), Set.of());

        CandidateSelector.TopicSelection selection = selector.partition(candidates, 5, 2);

        assertEquals(List.of("r1"), ids(selection.recent()));
        assertEquals(List.of("e1", "e2"), ids(selection.educational()));
    }

    @Test
    void partitionWithZeroEducationalCapShouldEmitNone() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<Candidate> candidates = selector.select(List.of(item("e1", 10, "A tutorial")), at(0), Set.of());

        CandidateSelector.TopicSelection selection = selector.partition(candidates, 5, 0);

        assertTrue(selection.educational().isEmpty());
        assertTrue(selection.recent().isEmpty());
    }

    @Test
    void partitionShouldSampleExactlyCapWithoutDuplicates() {
        List<PaperItem> items = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            items.add(item("e" + i, 100 - i, "Survey number " + i));
        }
        CandidateSelector selector = new CandidateSelector(new Random(42));
        List<Candidate> candidates = selector.select(items, at(0), Set.of());

        List<String> sampled = ids(selector.partition(candidates, 5, 3).educational());

        assertEquals(3, sampled.size());
        assertEquals(3, new HashSet<>(sampled).size());
        assertTrue(ids(candidates).containsAll(sampled));
    }

    @Test
    void samplingShouldBeReproducibleWithFixedSeed() {
        List<PaperItem> items = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            items.add(item("e" + i, 100 - i, "Tutorial " + i));
        }
        CandidateSelector first = new CandidateSelector(new Random(1234));
        CandidateSelector second = new CandidateSelector(new Random(1234));

        List<String> a = ids(first.partition(first.select(items, at(0), Set.of()), 0, 4).educational());
        List<String> b = ids(second.partition(second.select(items, at(0), Set.of()), 0, 4).educational());

        assertEquals(a, b);
    }

    @Test
    void negativeCapsShouldBehaveLikeZero() {
        CandidateSelector selector = new CandidateSelector(new Random(7));
        List<Candidate> candidates = selector.select(
                List.of(item("a", 10, "a"), item("e", 9, "A primer")), at(0), Set.of());

        CandidateSelector.TopicSelection selection = selector.partition(candidates, -1, -1);

        assertTrue(selection.recent().isEmpty());
        assertTrue(selection.educational().isEmpty());
    }

    static PaperItem item(String id, long epochHour, String title) {
        return PaperItem.builder()
                .id(id)
                .title(title)
                .summary("")
                .authors(List.of("Ada Lovelace"))
                .category("cs.LG")
                .publishedAt(at(epochHour))
                .url("https://arxiv.org/abs/" + id)
                .build();
    }

    static Instant at(long epochHour) {
        return Instant.parse("2026-01-01T00:00:00Z").plusSeconds(epochHour * 3600L);
    }

    private static List<String> ids(List<Candidate> candidates) {
        return candidates.stream().map(Candidate::id).collect(Collectors.toList());
    }
}
