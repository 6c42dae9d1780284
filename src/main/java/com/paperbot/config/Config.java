package com.paperbot.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration: built-in defaults, then classpath {@code config.properties},
 * then {@code config.properties} in the working directory.
 * Only raw lookups live here; typed and validated values come from {@link DigestSettings}.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            Properties overrides = new Properties();
            try (InputStream in = Files.newInputStream(local)) {
                overrides.load(in);
            } catch (IOException e) {
                throw new ConfigurationException("failed to read " + local + ": " + e.getMessage());
            }
            config.props.putAll(overrides);
        }

        return config;
    }

    /**
     * Builds a Config from a nested map, e.g. {@code Map.of("digest", Map.of("lookback_hours", 12))}.
     * Lists become comma separated values.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    /**
     * @throws ConfigurationException when the key holds something other than an integer
     */
    public int getInt(String key, int fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'");
        }
    }

    /**
     * @throws ConfigurationException when the key holds something other than a number
     */
    public double getDouble(String key, double fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number, got '" + value + "'");
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }


    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("digest.lookback_hours", "36");
        defaults.put("digest.recent_window_days", "7");
        defaults.put("digest.max_educational_items_per_topic", "1");
        defaults.put("digest.report_timezone", "Asia/Tokyo");

        defaults.put("ledger.path", "state/ledger.json");
        defaults.put("ledger.max_delivered_ids", "20000");

        defaults.put("arxiv.endpoint", "http://export.arxiv.org/api/query");
        defaults.put("arxiv.user_agent", "paperbot/1.0 (contact: your-email@example.com)");
        defaults.put("arxiv.request_timeout_sec", "30");
        defaults.put("arxiv.max_results_per_topic", "200");
        defaults.put("arxiv.inter_query_sleep_sec", "3.1");

        defaults.put("discord.webhook_url", "");
        defaults.put("discord.request_timeout_sec", "30");
        defaults.put("discord.max_content_length", "2000");
        defaults.put("discord.title_max_length", "120");
        defaults.put("discord.header_template", "arXiv Daily Digest ({date})");
        defaults.put("discord.dry_run", "false");
        defaults.put("discord.dry_run.dir", "outputs/discord_dry_run");

        return Collections.unmodifiableMap(defaults);
    }
}
