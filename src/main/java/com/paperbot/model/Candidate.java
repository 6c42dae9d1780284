package com.paperbot.model;

import java.time.Instant;

/**
 * A selected-for-consideration item plus its educational tag.
 */
public final class Candidate {
    public final PaperItem item;
    public final boolean educational;

    public Candidate(PaperItem item, boolean educational) {
        this.item = item;
        this.educational = educational;
    }

    public String id() {
        return item.id;
    }

    public Instant publishedAt() {
        return item.publishedAt;
    }
}
