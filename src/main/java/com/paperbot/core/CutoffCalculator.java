package com.paperbot.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes the earliest publication time a run has to look at.
 * The window never shrinks below the lookback and grows to cover the whole gap since the last
 * successful run, so an outage does not skip anything.
 */
public final class CutoffCalculator {

    public Instant computeCutoff(Instant now, Instant lastSuccessAt, int lookbackHours) {
        Duration lookback = Duration.ofHours(Math.max(lookbackHours, 1));
        if (lastSuccessAt == null) {
            return now.minus(lookback);
        }
        Duration elapsed = Duration.between(lastSuccessAt, now);
        // last success in the future (clock skew) counts as "just now"
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        Duration window = elapsed.compareTo(lookback) > 0 ? elapsed : lookback;
        return now.minus(window);
    }

    public Cutoffs resolve(Instant now, Instant lastSuccessAt, int lookbackHours, int recentWindowDays) {
        Instant stateCutoff = computeCutoff(now, lastSuccessAt, lookbackHours);
        Instant recentCutoff = now.minus(Duration.ofDays(Math.max(recentWindowDays, 1)));
        Instant candidateCutoff = stateCutoff.isBefore(recentCutoff) ? stateCutoff : recentCutoff;
        return new Cutoffs(stateCutoff, recentCutoff, candidateCutoff);
    }

    /**
     * @param stateCutoff     cutoff derived from the ledger's last success and the lookback
     * @param recentCutoff    start of the "recent" display window
     * @param candidateCutoff the earlier of the two; what the selector filters on
     */
    public record Cutoffs(Instant stateCutoff, Instant recentCutoff, Instant candidateCutoff) {
    }
}
