package com.example.inboxsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.inboxsync.config.SyncProperties;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class WebhookDispatcherTest {

    private static final String TARGET = "http://sink.test/api/webhooks/messaging";

    private MockRestServiceServer server;
    private WebhookDispatcher dispatcher;
    private SyncProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.getDispatch().setTargetUrl(TARGET);
        properties.getDispatch().setBaseDelay(Duration.ZERO);
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        dispatcher = new WebhookDispatcher(builder, properties);
    }

    @Test
    void dispatch_postsEnvelope_andReturnsTrueOnSuccess() {
        server.expect(once(), requestTo(TARGET))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.event").value("message_received"))
                .andExpect(jsonPath("$.data.message_id").value("m-1"))
                .andRespond(withSuccess());

        assertTrue(dispatcher.dispatch("message_received", Map.of("message_id", "m-1")));
        server.verify();
    }

    @Test
    void dispatch_retriesUntilSuccess() {
        server.expect(times(2), requestTo(TARGET)).andRespond(withServerError());
        server.expect(once(), requestTo(TARGET)).andRespond(withSuccess());

        assertTrue(dispatcher.dispatch("message_received", Map.of()));
        server.verify();
    }

    @Test
    void dispatch_returnsFalse_afterMaxAttempts() {
        server.expect(times(3), requestTo(TARGET)).andRespond(withServerError());

        assertFalse(dispatcher.dispatch("message_received", Map.of()));
        server.verify();
    }

    @Test
    void backoff_doublesPerAttempt() {
        properties.getDispatch().setBaseDelay(Duration.ofMillis(100));

        assertEquals(Duration.ofMillis(100), dispatcher.backoff(0));
        assertEquals(Duration.ofMillis(200), dispatcher.backoff(1));
        assertEquals(Duration.ofMillis(400), dispatcher.backoff(2));
    }
}
