package com.paperbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One normalized feed entry. {@code publishedAt} and {@code updatedAt} may be null when the
 * feed omits or garbles them; such entries never become candidates.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PaperItem {
    public final String id;
    public final String title;
    public final String summary;
    public final List<String> authors;
    public final String category;
    public final Instant publishedAt;
    public final Instant updatedAt;
    public final String url;

    public boolean isValid() {
        return id != null && !id.trim().isEmpty() && publishedAt != null;
    }
}
