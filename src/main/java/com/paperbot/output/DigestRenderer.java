package com.paperbot.output;

import com.paperbot.model.Candidate;
import com.paperbot.model.PaperItem;
import com.paperbot.model.TopicResult;
import com.paperbot.utils.TextFormatter;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a run's topic results as plain-text blocks: one header block, then one per topic.
 */
public final class DigestRenderer {
    static final String EDU_MARK = "✔︎";
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);
    private static final DateTimeFormatter DATETIME_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ROOT);

    private final String headerTemplate;
    private final int titleMaxLength;

    public DigestRenderer(String headerTemplate, int titleMaxLength) {
        this.headerTemplate = headerTemplate == null || headerTemplate.isBlank()
                ? "arXiv Daily Digest ({date})"
                : headerTemplate;
        this.titleMaxLength = titleMaxLength;
    }

    public List<String> render(
            Instant now,
            ZoneId zone,
            Instant candidateCutoff,
            int recentWindowDays,
            List<TopicResult> results
    ) {
        ZonedDateTime local = now.atZone(zone);
        String date = DATE_FMT.format(local);
        String datetime = DATETIME_FMT.format(local);
        // {date_jst}/{datetime_jst} are the placeholder names of older configs
        String header = headerTemplate
                .replace("{date}", date)
                .replace("{datetime}", datetime)
                .replace("{date_jst}", date)
                .replace("{datetime_jst}", datetime);

        String counts = results.stream()
                .map(r -> r.name + " (recent " + r.recent.size() + ", educational " + r.educational.size() + ")")
                .collect(Collectors.joining(", "));

        List<String> blocks = new ArrayList<>();
        blocks.add(String.join("\n",
                header,
                "Time: " + datetime,
                "Cutoff (UTC): " + DateTimeFormatter.ISO_INSTANT.format(candidateCutoff),
                "Counts: " + counts));

        for (TopicResult result : results) {
            List<String> lines = new ArrayList<>();
            lines.add("[" + result.name + "] recent " + result.recent.size()
                    + " / educational" + EDU_MARK + " " + result.educational.size());
            lines.add("Recent (within " + recentWindowDays + " days, submittedDate desc):");
            if (result.recent.isEmpty()) {
                lines.add("- (no recent papers)");
            } else {
                for (Candidate c : result.recent) {
                    lines.add(entryLine(c));
                }
            }
            lines.add("Educational / Beginner-friendly " + EDU_MARK + ":");
            if (result.educational.isEmpty()) {
                lines.add("- (no educational papers)");
            } else {
                for (Candidate c : result.educational) {
                    lines.add(entryLine(c));
                }
            }
            blocks.add(String.join("\n", lines));
        }
        return blocks;
    }

    String entryLine(Candidate candidate) {
        PaperItem item = candidate.item;
        String star = candidate.educational ? EDU_MARK + " " : "";
        String title = TextFormatter.truncate(blankTo(item.title, "(untitled)"), titleMaxLength);
        String category = blankTo(item.category, "unknown");
        String url = item.url == null ? "" : item.url;
        return "- " + star + title + " - " + formatAuthor(item.authors) + " - " + category + " - " + url;
    }

    static String formatAuthor(List<String> authors) {
        if (authors == null || authors.isEmpty()) {
            return "Unknown";
        }
        String first = authors.get(0);
        return authors.size() > 1 ? first + " et al." : first;
    }

    private static String blankTo(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
