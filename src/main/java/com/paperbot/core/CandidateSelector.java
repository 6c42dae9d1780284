package com.paperbot.core;

import com.paperbot.model.Candidate;
import com.paperbot.model.PaperItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Filters, tags and orders feed items, then bounds how many are announced per topic.
 */
public final class CandidateSelector {
    private static final Comparator<Candidate> NEWEST_FIRST = Comparator.comparing(
            Candidate::publishedAt,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder())
    );

    private final EducationalClassifier classifier;
    private final Random random;
    private final Logger logger;

    public CandidateSelector(Random random) {
        this(new EducationalClassifier(), random, LogManager.getLogger(CandidateSelector.class));
    }

    public CandidateSelector(EducationalClassifier classifier, Random random, Logger logger) {
        this.classifier = classifier;
        this.random = random;
        this.logger = logger;
    }

    /**
     * Drops invalid, too old, already delivered and repeated items; tags the rest and sorts
     * them newest first. The sort is stable, so equal timestamps keep their input order.
     */
    public List<Candidate> select(Collection<PaperItem> items, Instant cutoff, Set<String> alreadyDelivered) {
        List<Candidate> out = new ArrayList<>();
        if (items == null || items.isEmpty()) {
            return out;
        }
        Set<String> seen = new HashSet<>();
        int invalid = 0;
        int stale = 0;
        int delivered = 0;
        for (PaperItem item : items) {
            if (item == null || !item.isValid()) {
                invalid++;
                continue;
            }
            if (cutoff != null && item.publishedAt.isBefore(cutoff)) {
                stale++;
                continue;
            }
            if (alreadyDelivered != null && alreadyDelivered.contains(item.id)) {
                delivered++;
                continue;
            }
            if (!seen.add(item.id)) {
                continue;
            }
            out.add(new Candidate(item, classifier.isEducational(item.title, item.summary)));
        }
        out.sort(NEWEST_FIRST);
        if (invalid > 0) {
            logger.debug("dropped {} invalid items (missing id or published time)", invalid);
        }
        logger.debug("select: in={} candidates={} stale={} delivered={}", items.size(), out.size(), stale, delivered);
        return out;
    }

    /**
     * Splits candidates into the truncated recent group and the sampled educational group.
     */
    public TopicSelection partition(List<Candidate> candidates, int recentCap, int educationalCap) {
        List<Candidate> recentPool = new ArrayList<>();
        List<Candidate> educationalPool = new ArrayList<>();
        if (candidates != null) {
            for (Candidate c : candidates) {
                if (c.educational) {
                    educationalPool.add(c);
                } else {
                    recentPool.add(c);
                }
            }
        }

        int recentLimit = Math.max(recentCap, 0);
        List<Candidate> recent = new ArrayList<>(recentPool.subList(0, Math.min(recentLimit, recentPool.size())));

        int educationalLimit = Math.max(educationalCap, 0);
        if (educationalLimit == 0 || educationalPool.isEmpty()) {
            return new TopicSelection(recent, List.of());
        }
        if (educationalPool.size() <= educationalLimit) {
            return new TopicSelection(recent, educationalPool);
        }
        return new TopicSelection(recent, sample(educationalPool, educationalLimit));
    }

    // partial Fisher-Yates over a copy; the first k slots are the sample
    private List<Candidate> sample(List<Candidate> pool, int k) {
        List<Candidate> work = new ArrayList<>(pool);
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(work.size() - i);
            Candidate tmp = work.get(i);
            work.set(i, work.get(j));
            work.set(j, tmp);
        }
        return new ArrayList<>(work.subList(0, k));
    }

    public record TopicSelection(List<Candidate> recent, List<Candidate> educational) {
        public TopicSelection {
            recent = recent == null ? List.of() : List.copyOf(recent);
            educational = educational == null ? List.of() : List.copyOf(educational);
        }
    }
}
