package com.paperbot.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a topic into an arXiv API {@code search_query}:
 * {@code (all:"term a" OR ti:b) AND (cat:cs.CL OR cat:cs.LG)}.
 */
public final class SearchQueryBuilder {
    private static final List<String> FIELD_PREFIXES = List.of(
            "all:", "ti:", "abs:", "cat:", "au:", "jr:", "rn:", "id:"
    );

    private SearchQueryBuilder() {
    }

    public static String build(TopicSpec topic) {
        List<String> termParts = new ArrayList<>();
        for (String term : topic.queryTerms) {
            String quoted = quoteTerm(term);
            if (!quoted.isEmpty()) {
                termParts.add(quoted);
            }
        }
        List<String> catParts = new ArrayList<>();
        for (String category : topic.categories) {
            if (category != null && !category.isBlank()) {
                catParts.add("cat:" + category.trim());
            }
        }

        List<String> groups = new ArrayList<>();
        if (!termParts.isEmpty()) {
            groups.add("(" + String.join(" OR ", termParts) + ")");
        }
        if (!catParts.isEmpty()) {
            groups.add("(" + String.join(" OR ", catParts) + ")");
        }
        if (groups.isEmpty()) {
            throw new ConfigurationException("topic '" + topic.name + "' has no query_terms/categories");
        }
        return String.join(" AND ", groups);
    }

    static String quoteTerm(String raw) {
        String term = raw == null ? "" : raw.trim();
        if (term.isEmpty()) {
            return "";
        }
        String lowered = term.toLowerCase(Locale.ROOT);
        for (String prefix : FIELD_PREFIXES) {
            if (lowered.startsWith(prefix)) {
                return term;
            }
        }
        return "all:\"" + term.replace("\"", "\\\"") + "\"";
    }
}
