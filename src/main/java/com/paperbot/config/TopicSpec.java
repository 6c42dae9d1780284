package com.paperbot.config;

import java.util.List;

/**
 * One configured topic: a display name plus the terms and arXiv categories it searches.
 */
public final class TopicSpec {
    public final String name;
    public final List<String> queryTerms;
    public final List<String> categories;

    public TopicSpec(String name, List<String> queryTerms, List<String> categories) {
        this.name = name == null ? "" : name.trim();
        this.queryTerms = queryTerms == null ? List.of() : List.copyOf(queryTerms);
        this.categories = categories == null ? List.of() : List.copyOf(categories);
    }

    @Override
    public String toString() {
        return "TopicSpec{name=" + name + ", queryTerms=" + queryTerms + ", categories=" + categories + "}";
    }
}
