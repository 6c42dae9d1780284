package com.paperbot.data.arxiv;

import com.paperbot.config.DigestSettings;
import com.paperbot.config.SearchQueryBuilder;
import com.paperbot.config.TopicSpec;
import com.paperbot.data.FeedSource;
import com.paperbot.data.http.HttpClientEx;
import com.paperbot.model.PaperItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Queries the arXiv export API, newest submissions first.
 */
public final class ArxivFeedSource implements FeedSource {
    private final HttpClientEx httpClient;
    private final String endpoint;
    private final int maxResults;
    private final int timeoutSec;
    private final Logger logger;

    public ArxivFeedSource(HttpClientEx httpClient, DigestSettings settings) {
        this(httpClient, settings.arxivEndpoint, settings.maxResultsPerTopic, settings.arxivTimeoutSec,
                LogManager.getLogger(ArxivFeedSource.class));
    }

    public ArxivFeedSource(HttpClientEx httpClient, String endpoint, int maxResults, int timeoutSec, Logger logger) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.maxResults = maxResults;
        this.timeoutSec = timeoutSec;
        this.logger = logger;
    }

    @Override
    public List<PaperItem> fetch(TopicSpec topic) {
        String query = SearchQueryBuilder.build(topic);
        String url = requestUrl(query);
        logger.info("arXiv request: topic={} query={} max_results={}", topic.name, query, maxResults);
        String xml = httpClient.getText(url, timeoutSec);
        List<PaperItem> items = AtomParser.parse(xml);
        logger.info("topic={} fetched_entries={}", topic.name, items.size());
        return items;
    }

    String requestUrl(String searchQuery) {
        return endpoint
                + (endpoint.contains("?") ? "&" : "?")
                + "search_query=" + URLEncoder.encode(searchQuery, StandardCharsets.UTF_8)
                + "&start=0"
                + "&max_results=" + maxResults
                + "&sortBy=submittedDate"
                + "&sortOrder=descending";
    }
}
