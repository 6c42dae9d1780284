package com.paperbot.output;

import com.paperbot.core.CollaboratorException;
import com.paperbot.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Posts message units to a Discord webhook with mentions disabled.
 */
public final class DiscordWebhookSink implements TransportSink {
    private final HttpClientEx httpClient;
    private final String webhookUrl;
    private final int maxContentLength;
    private final int timeoutSec;

    public DiscordWebhookSink(HttpClientEx httpClient, String webhookUrl, int maxContentLength, int timeoutSec) {
        this.httpClient = httpClient;
        this.webhookUrl = webhookUrl;
        this.maxContentLength = maxContentLength;
        this.timeoutSec = timeoutSec;
    }

    @Override
    public void send(String unit) {
        if (unit == null || unit.isEmpty()) {
            return;
        }
        if (unit.length() > maxContentLength) {
            throw new CollaboratorException("Content is too long: " + unit.length() + " > " + maxContentLength);
        }
        httpClient.postJson(webhookUrl, payload(unit).toString(), timeoutSec);
    }

    static JSONObject payload(String unit) {
        JSONObject payload = new JSONObject();
        payload.put("content", unit);
        payload.put("allowed_mentions", new JSONObject().put("parse", new JSONArray()));
        return payload;
    }
}
