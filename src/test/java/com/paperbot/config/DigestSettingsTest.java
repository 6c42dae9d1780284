package com.paperbot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DigestSettingsTest {
    private static final Path WORKING_DIR = Path.of("/srv/paperbot");
    private static final Map<String, String> ENV = Map.of(DigestSettings.WEBHOOK_ENV, "https://discord.example/api/webhooks/1/t");

    @Test
    void defaultsShouldMatchDocumentedValues() {
        DigestSettings settings = DigestSettings.from(config(Map.of()), ENV, false);

        assertEquals(36, settings.lookbackHours);
        assertEquals(7, settings.recentWindowDays);
        assertEquals(5, settings.maxRecentItemsPerTopic);
        assertEquals(1, settings.maxEducationalItemsPerTopic);
        assertEquals(20000, settings.maxDeliveredIds);
        assertEquals(2000, settings.maxContentLength);
        assertEquals(200, settings.maxResultsPerTopic);
        assertEquals(3100L, settings.interQuerySleepMillis);
        assertEquals(ZoneId.of("Asia/Tokyo"), settings.reportZone);
        assertEquals(WORKING_DIR.resolve("state/ledger.json"), settings.ledgerPath);
        assertEquals("https://discord.example/api/webhooks/1/t", settings.webhookUrl);
        assertFalse(settings.dryRun);
        assertEquals(1, settings.topics.size());
        assertEquals("llm", settings.topics.get(0).name);
        assertEquals(List.of("large language model", "LLM"), settings.topics.get(0).queryTerms);
    }

    @Test
    void invalidValuesShouldBeRepairedWithWarnings() {
        DigestSettings settings = DigestSettings.from(config(Map.of(
                "digest", Map.of("recent_window_days", 0, "report_timezone", "Mars/Olympus"),
                "arxiv", Map.of("inter_query_sleep_sec", 0.5)
        )), ENV, false);

        assertEquals(7, settings.recentWindowDays);
        assertEquals(ZoneOffset.UTC, settings.reportZone);
        assertEquals(3100L, settings.interQuerySleepMillis);
    }

    @Test
    void legacyItemsPerTopicKeyShouldBeHonoured() {
        DigestSettings legacy = DigestSettings.from(config(Map.of("digest", Map.of("max_items_per_topic", 8))), ENV, false);
        assertEquals(8, legacy.maxRecentItemsPerTopic);

        DigestSettings both = DigestSettings.from(config(Map.of("digest", Map.of(
                "max_items_per_topic", 8,
                "max_recent_items_per_topic", 3))), ENV, false);
        assertEquals(3, both.maxRecentItemsPerTopic);
    }

    @Test
    void missingTopicsShouldFail() {
        Config config = Config.fromConfigurationProperties(WORKING_DIR, Map.of("digest", Map.of("lookback_hours", 12)));
        assertThrows(ConfigurationException.class, () -> DigestSettings.from(config, ENV, false));
    }

    @Test
    void topicWithoutTermsOrCategoriesShouldFail() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("topics", List.of("llm", "empty"));
        raw.put("topic", Map.of("llm", Map.of("categories", List.of("cs.CL"))));
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> DigestSettings.from(Config.fromConfigurationProperties(WORKING_DIR, raw), ENV, false));
        assertTrue(e.getMessage().contains("empty"));
    }

    @Test
    void nonPositiveBoundsShouldFail() {
        assertThrows(ConfigurationException.class,
                () -> DigestSettings.from(config(Map.of("ledger", Map.of("max_delivered_ids", 0))), ENV, false));
        assertThrows(ConfigurationException.class,
                () -> DigestSettings.from(config(Map.of("discord", Map.of("max_content_length", -1))), ENV, false));
    }

    @Test
    void webhookShouldBeRequiredUnlessDryRun() {
        assertThrows(ConfigurationException.class, () -> DigestSettings.from(config(Map.of()), Map.of(), false));

        DigestSettings dry = DigestSettings.from(config(Map.of()), Map.of(), true);
        assertTrue(dry.dryRun);

        DigestSettings fromConfig = DigestSettings.from(
                config(Map.of("discord", Map.of("webhook_url", "https://discord.example/hook"))), Map.of(), false);
        assertEquals("https://discord.example/hook", fromConfig.webhookUrl);
    }

    @Test
    void deploymentWithoutTopicsShouldFail(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "digest.lookback_hours=12\n", StandardCharsets.UTF_8);

        Config config = Config.load(dir);

        assertTrue(config.getList("topics").isEmpty());
        assertThrows(ConfigurationException.class, () -> DigestSettings.from(config, Map.of(), true));
    }

    @Test
    void legacyKeysShouldApplyWhenLoadedFromDisk(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), String.join("\n",
                "topics=llm",
                "topic.llm.categories=cs.CL",
                "digest.max_items_per_topic=2",
                ""), StandardCharsets.UTF_8);
        assertEquals(2, DigestSettings.from(Config.load(dir), ENV, false).maxRecentItemsPerTopic);

        Files.writeString(dir.resolve("config.properties"), String.join("\n",
                "topics=llm",
                "topic.llm.categories=cs.CL",
                "digest.max_items_per_topic=2",
                "digest.max_latest_items_per_topic=4",
                ""), StandardCharsets.UTF_8);
        DigestSettings settings = DigestSettings.from(Config.load(dir), ENV, false);
        assertEquals(4, settings.maxRecentItemsPerTopic);
        assertEquals(36, settings.lookbackHours);
        assertEquals(dir.resolve("state/ledger.json"), settings.ledgerPath);
    }

    @Test
    void unparsableNumbersShouldFail() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> DigestSettings.from(config(Map.of("ledger", Map.of("max_delivered_ids", "20k"))), ENV, false));
        assertTrue(e.getMessage().contains("ledger.max_delivered_ids"));

        assertThrows(ConfigurationException.class,
                () -> DigestSettings.from(config(Map.of("digest", Map.of("lookback_hours", "a day"))), ENV, false));
        assertThrows(ConfigurationException.class,
                () -> DigestSettings.from(config(Map.of("arxiv", Map.of("inter_query_sleep_sec", "3s"))), ENV, false));
    }

    private static Config config(Map<String, Object> overrides) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("topics", "llm");
        raw.put("topic", Map.of("llm", Map.of(
                "query_terms", List.of("large language model", "LLM"),
                "categories", List.of("cs.CL", "cs.LG"))));
        raw.putAll(overrides);
        return Config.fromConfigurationProperties(WORKING_DIR, raw);
    }
}
