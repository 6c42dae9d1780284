package com.paperbot.data;

import com.paperbot.config.TopicSpec;
import com.paperbot.model.PaperItem;

import java.util.List;

/**
 * Supplies normalized items for one topic.
 */
public interface FeedSource {

    /**
     * @throws com.paperbot.core.CollaboratorException when the upstream cannot be read
     */
    List<PaperItem> fetch(TopicSpec topic);
}
