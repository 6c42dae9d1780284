package com.paperbot.runner;

import com.paperbot.core.CutoffCalculator;
import com.paperbot.core.RunTelemetry;
import com.paperbot.model.TopicResult;

import java.util.List;

/**
 * What a completed run produced.
 *
 * @param committed false for dry runs, where the ledger is left as it was
 * @param steps     per-step counters of the run up to the point the outcome was built
 */
public record DigestOutcome(
        CutoffCalculator.Cutoffs cutoffs,
        List<TopicResult> topics,
        List<String> units,
        int sentUnits,
        boolean committed,
        List<RunTelemetry.StepRecord> steps
) {
    public DigestOutcome {
        topics = topics == null ? List.of() : List.copyOf(topics);
        units = units == null ? List.of() : List.copyOf(units);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public int selectedCount() {
        int total = 0;
        for (TopicResult t : topics) {
            total += t.selectedCount();
        }
        return total;
    }
}
