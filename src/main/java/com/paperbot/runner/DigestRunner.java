package com.paperbot.runner;

import com.paperbot.config.DigestSettings;
import com.paperbot.config.TopicSpec;
import com.paperbot.core.CandidateSelector;
import com.paperbot.core.CutoffCalculator;
import com.paperbot.core.MessagePacker;
import com.paperbot.core.RunTelemetry;
import com.paperbot.data.FeedSource;
import com.paperbot.model.Candidate;
import com.paperbot.model.PaperItem;
import com.paperbot.model.TopicResult;
import com.paperbot.output.DigestRenderer;
import com.paperbot.output.TransportSink;
import com.paperbot.state.DeliveryLedger;
import com.paperbot.state.Ledger;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One digest run: fetch and select per topic, render, pack, send, then commit the ledger.
 *
 * <p>The run is the unit of atomicity. The ledger file is written once, after every unit was
 * accepted by the transport; any earlier failure propagates and leaves it untouched, so the
 * next run recomputes the same (or a wider) window. Items sent by a failed run may therefore
 * be sent again.
 */
public final class DigestRunner {
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final DigestSettings settings;
    private final FeedSource feedSource;
    private final TransportSink sink;
    private final DeliveryLedger deliveryLedger;
    private final CutoffCalculator cutoffCalculator;
    private final CandidateSelector selector;
    private final DigestRenderer renderer;
    private final MessagePacker packer;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Logger logger;

    public DigestRunner(
            DigestSettings settings,
            FeedSource feedSource,
            TransportSink sink,
            DeliveryLedger deliveryLedger,
            CandidateSelector selector,
            Clock clock,
            Sleeper sleeper,
            Logger logger
    ) {
        this.settings = settings;
        this.feedSource = feedSource;
        this.sink = sink;
        this.deliveryLedger = deliveryLedger;
        this.cutoffCalculator = new CutoffCalculator();
        this.selector = selector;
        this.renderer = new DigestRenderer(settings.headerTemplate, settings.titleMaxLength);
        this.packer = new MessagePacker();
        this.clock = clock;
        this.sleeper = sleeper;
        this.logger = logger;
    }

    public DigestOutcome run(String trigger) throws IOException, InterruptedException {
        RunTelemetry telemetry = new RunTelemetry(clock, trigger);
        try {
            DigestOutcome outcome = execute(telemetry);
            telemetry.finish(outcome.committed() ? "SUCCESS" : "DRY_RUN");
            return outcome;
        } catch (Exception e) {
            telemetry.finish("FAILED");
            throw e;
        } finally {
            logger.info("run summary\n{}", telemetry.getSummary());
        }
    }

    private DigestOutcome execute(RunTelemetry telemetry) throws IOException, InterruptedException {
        telemetry.startStep(RunTelemetry.STEP_LEDGER_LOAD);
        Ledger ledger = deliveryLedger.load();
        telemetry.endStep(RunTelemetry.STEP_LEDGER_LOAD, 0, ledger.size(), 0);

        Instant now = clock.instant();
        CutoffCalculator.Cutoffs cutoffs = cutoffCalculator.resolve(
                now, ledger.lastSuccessAt(), settings.lookbackHours, settings.recentWindowDays);
        logger.info("last_success_at={}", ledger.lastSuccessAt() == null ? "None" : ISO.format(ledger.lastSuccessAt()));
        logger.info("lookback_hours={} state_cutoff={} recent_window_days={} recent_cutoff={} candidate_cutoff={}",
                settings.lookbackHours,
                ISO.format(cutoffs.stateCutoff()),
                settings.recentWindowDays,
                ISO.format(cutoffs.recentCutoff()),
                ISO.format(cutoffs.candidateCutoff()));

        // grows with each topic so one item is never announced under two topics
        Set<String> workingDelivered = new HashSet<>(ledger.deliveredIds());
        Map<String, Instant> lastSeenByTopic = new LinkedHashMap<>();
        List<TopicResult> results = new ArrayList<>();

        List<TopicSpec> topics = settings.topics;
        for (int i = 0; i < topics.size(); i++) {
            TopicSpec topic = topics.get(i);

            telemetry.startStep(RunTelemetry.STEP_FETCH);
            List<PaperItem> items = feedSource.fetch(topic);
            telemetry.endStep(RunTelemetry.STEP_FETCH, 1, items.size(), 0, topic.name + "=" + items.size());

            Instant maxPublished = maxPublished(items);
            if (maxPublished != null) {
                lastSeenByTopic.put(topic.name, maxPublished);
            }

            telemetry.startStep(RunTelemetry.STEP_SELECT);
            List<Candidate> candidates = selector.select(items, cutoffs.candidateCutoff(), workingDelivered);
            CandidateSelector.TopicSelection selection = selector.partition(
                    candidates, settings.maxRecentItemsPerTopic, settings.maxEducationalItemsPerTopic);
            TopicResult result = new TopicResult(topic.name, selection.recent(), selection.educational());
            telemetry.endStep(RunTelemetry.STEP_SELECT, items.size(), result.selectedCount(), 0);
            logger.info("topic={} candidates={} recent={} educational={}",
                    topic.name, candidates.size(), result.recent.size(), result.educational.size());

            results.add(result);
            workingDelivered.addAll(result.selectedIds());

            if (i < topics.size() - 1 && settings.interQuerySleepMillis > 0) {
                logger.info("sleep {} ms between arXiv queries", settings.interQuerySleepMillis);
                sleeper.sleep(settings.interQuerySleepMillis);
            }
        }

        telemetry.startStep(RunTelemetry.STEP_RENDER);
        List<String> blocks = renderer.render(
                now, settings.reportZone, cutoffs.candidateCutoff(), settings.recentWindowDays, results);
        telemetry.endStep(RunTelemetry.STEP_RENDER, results.size(), blocks.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_PACK);
        List<String> units = packer.pack(blocks, settings.maxContentLength);
        telemetry.endStep(RunTelemetry.STEP_PACK, blocks.size(), units.size(), 0);

        List<String> selectedIds = new ArrayList<>();
        for (TopicResult r : results) {
            selectedIds.addAll(r.selectedIds());
        }
        logger.info("digest totals: topics={} selected_entries={} messages={}",
                results.size(), selectedIds.size(), units.size());

        telemetry.startStep(RunTelemetry.STEP_SEND);
        int sent = 0;
        try {
            for (String unit : units) {
                sink.send(unit);
                sent++;
                logger.info("message sent ({}/{})", sent, units.size());
            }
        } finally {
            String note = sent < units.size() ? "stopped at unit " + (sent + 1) + "/" + units.size() : "";
            telemetry.endStep(RunTelemetry.STEP_SEND, units.size(), sent, units.size() - sent, note);
        }

        if (settings.dryRun) {
            logger.info("dry run: ledger not committed path={}", deliveryLedger.path().toAbsolutePath());
            return new DigestOutcome(cutoffs, results, units, sent, false, telemetry.stepRecords());
        }

        telemetry.startStep(RunTelemetry.STEP_COMMIT);
        deliveryLedger.record(ledger, selectedIds, now, lastSeenByTopic);
        deliveryLedger.commit(ledger);
        telemetry.endStep(RunTelemetry.STEP_COMMIT, selectedIds.size(), ledger.size(), 0);
        logger.info("ledger updated: delivered_ids={} last_success_at={}", ledger.size(), ISO.format(now));

        return new DigestOutcome(cutoffs, results, units, sent, true, telemetry.stepRecords());
    }

    private static Instant maxPublished(List<PaperItem> items) {
        Instant max = null;
        for (PaperItem item : items) {
            if (item.publishedAt != null && (max == null || item.publishedAt.isAfter(max))) {
                max = item.publishedAt;
            }
        }
        return max;
    }
}
