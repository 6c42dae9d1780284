package com.paperbot.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-topic output of a run, consumed by rendering.
 */
public final class TopicResult {
    public final String name;
    public final List<Candidate> recent;
    public final List<Candidate> educational;

    public TopicResult(String name, List<Candidate> recent, List<Candidate> educational) {
        this.name = name == null ? "" : name;
        this.recent = recent == null ? List.of() : List.copyOf(recent);
        this.educational = educational == null ? List.of() : List.copyOf(educational);
    }

    public List<String> selectedIds() {
        List<String> out = new ArrayList<>(recent.size() + educational.size());
        for (Candidate c : recent) {
            out.add(c.id());
        }
        for (Candidate c : educational) {
            out.add(c.id());
        }
        return out;
    }

    public int selectedCount() {
        return recent.size() + educational.size();
    }
}
