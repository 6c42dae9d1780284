package com.paperbot.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed view of {@link Config}, read and validated once at startup.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DigestSettings {
    public static final String WEBHOOK_ENV = "DISCORD_WEBHOOK_URL";
    static final double MIN_INTER_QUERY_SLEEP_SEC = 3.0;
    static final double SAFE_INTER_QUERY_SLEEP_SEC = 3.1;
    static final int DEFAULT_RECENT_WINDOW_DAYS = 7;

    public final List<TopicSpec> topics;

    public final int lookbackHours;
    public final int recentWindowDays;
    public final int maxRecentItemsPerTopic;
    public final int maxEducationalItemsPerTopic;
    public final ZoneId reportZone;

    public final Path ledgerPath;
    public final int maxDeliveredIds;

    public final String arxivEndpoint;
    public final String arxivUserAgent;
    public final int arxivTimeoutSec;
    public final int maxResultsPerTopic;
    public final long interQuerySleepMillis;

    public final String webhookUrl;
    public final int discordTimeoutSec;
    public final int maxContentLength;
    public final int titleMaxLength;
    public final String headerTemplate;
    public final boolean dryRun;
    public final Path dryRunDir;

    public static DigestSettings from(Config config, Map<String, String> env, boolean forceDryRun) {
        return from(config, env, forceDryRun, LogManager.getLogger(DigestSettings.class));
    }

    /**
     * @throws ConfigurationException when a topic is missing or malformed, a numeric key does not
     *                                parse, a bound is not positive, or no webhook is configured
     *                                outside dry-run
     */
    public static DigestSettings from(Config config, Map<String, String> env, boolean forceDryRun, Logger logger) {
        List<TopicSpec> topics = readTopics(config);

        int recentWindowDays = config.getInt("digest.recent_window_days", DEFAULT_RECENT_WINDOW_DAYS);
        if (recentWindowDays < 1) {
            logger.warn("digest.recent_window_days={} is invalid. Overriding to {}.", recentWindowDays, DEFAULT_RECENT_WINDOW_DAYS);
            recentWindowDays = DEFAULT_RECENT_WINDOW_DAYS;
        }

        // older configs name this max_latest_items_per_topic or max_items_per_topic
        int maxRecent = config.getInt(
                "digest.max_recent_items_per_topic",
                config.getInt(
                        "digest.max_latest_items_per_topic",
                        config.getInt("digest.max_items_per_topic", 5)
                )
        );

        String zoneRaw = config.getString("digest.report_timezone", "Asia/Tokyo");
        ZoneId zone;
        try {
            zone = ZoneId.of(zoneRaw);
        } catch (DateTimeException e) {
            logger.warn("Invalid report timezone '{}'. Falling back to UTC.", zoneRaw);
            zone = ZoneOffset.UTC;
        }

        double sleepSec = config.getDouble("arxiv.inter_query_sleep_sec", SAFE_INTER_QUERY_SLEEP_SEC);
        if (sleepSec < MIN_INTER_QUERY_SLEEP_SEC) {
            logger.warn("arxiv.inter_query_sleep_sec is {} (<{}). Overriding to {} to comply with arXiv policy.",
                    sleepSec, MIN_INTER_QUERY_SLEEP_SEC, SAFE_INTER_QUERY_SLEEP_SEC);
            sleepSec = SAFE_INTER_QUERY_SLEEP_SEC;
        }

        boolean dryRun = forceDryRun || config.getBoolean("discord.dry_run", false);
        String webhook = env == null ? null : env.get(WEBHOOK_ENV);
        if (webhook == null || webhook.isBlank()) {
            webhook = config.getString("discord.webhook_url");
        }
        if (!dryRun && webhook.isBlank()) {
            throw new ConfigurationException("Discord webhook is required: set " + WEBHOOK_ENV + " or discord.webhook_url");
        }

        return DigestSettings.builder()
                .topics(topics)
                .lookbackHours(config.getInt("digest.lookback_hours", 36))
                .recentWindowDays(recentWindowDays)
                .maxRecentItemsPerTopic(Math.max(0, maxRecent))
                .maxEducationalItemsPerTopic(Math.max(0, config.getInt("digest.max_educational_items_per_topic", 1)))
                .reportZone(zone)
                .ledgerPath(config.getPath("ledger.path"))
                .maxDeliveredIds(positive(config, "ledger.max_delivered_ids", 20000))
                .arxivEndpoint(config.getString("arxiv.endpoint"))
                .arxivUserAgent(config.getString("arxiv.user_agent"))
                .arxivTimeoutSec(positive(config, "arxiv.request_timeout_sec", 30))
                .maxResultsPerTopic(positive(config, "arxiv.max_results_per_topic", 200))
                .interQuerySleepMillis(Math.round(sleepSec * 1000.0))
                .webhookUrl(webhook.trim())
                .discordTimeoutSec(positive(config, "discord.request_timeout_sec", 30))
                .maxContentLength(positive(config, "discord.max_content_length", 2000))
                .titleMaxLength(positive(config, "discord.title_max_length", 120))
                .headerTemplate(config.getString("discord.header_template"))
                .dryRun(dryRun)
                .dryRunDir(config.getPath("discord.dry_run.dir"))
                .build();
    }

    static List<TopicSpec> readTopics(Config config) {
        List<String> names = config.getList("topics");
        if (names.isEmpty()) {
            throw new ConfigurationException("No topics configured (config key 'topics')");
        }
        List<TopicSpec> topics = new ArrayList<>(names.size());
        for (String name : names) {
            TopicSpec topic = new TopicSpec(
                    name,
                    config.getList("topic." + name + ".query_terms"),
                    config.getList("topic." + name + ".categories")
            );
            // fail on a malformed topic before anything is fetched
            SearchQueryBuilder.build(topic);
            topics.add(topic);
        }
        return topics;
    }

    private static int positive(Config config, String key, int fallback) {
        int value = config.getInt(key, fallback);
        if (value < 1) {
            throw new ConfigurationException(key + " must be >= 1, got " + value);
        }
        return value;
    }
}
