package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Delivers {@code {event, data}} envelopes over HTTP with bounded exponential backoff.
 * Delivery outcome is reported as a boolean; nothing is thrown.
 */
@Slf4j
@Component
public class WebhookDispatcher {

    private final RestClient restClient;
    private final SyncProperties syncProperties;

    public WebhookDispatcher(RestClient.Builder restClientBuilder, SyncProperties syncProperties) {
        this.restClient = restClientBuilder.build();
        this.syncProperties = syncProperties;
    }

    public boolean dispatch(String eventType, Object data) {
        return dispatch(syncProperties.getDispatch().getTargetUrl(), eventType, data);
    }

    public boolean dispatch(String targetUrl, String eventType, Object data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", eventType);
        envelope.put("data", data);

        int maxAttempts = Math.max(1, syncProperties.getDispatch().getMaxAttempts());
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                restClient.post()
                        .uri(targetUrl)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(envelope)
                        .retrieve()
                        .toBodilessEntity();
                log.debug("Dispatched {} to {} on attempt {}", eventType, targetUrl, attempt + 1);
                return true;
            } catch (RestClientException ex) {
                log.warn("Dispatch of {} to {} failed (attempt {}/{}): {}",
                        eventType, targetUrl, attempt + 1, maxAttempts, ex.getMessage());
            }
            if (attempt + 1 < maxAttempts && !pause(backoff(attempt))) {
                return false;
            }
        }
        log.error("Giving up on {} to {} after {} attempts", eventType, targetUrl, maxAttempts);
        return false;
    }

    Duration backoff(int attempt) {
        Duration base = syncProperties.getDispatch().getBaseDelay();
        if (base == null || base.isNegative()) {
            return Duration.ZERO;
        }
        return base.multipliedBy(1L << attempt);
    }

    private boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Dispatch retry interrupted");
            return false;
        }
    }
}
