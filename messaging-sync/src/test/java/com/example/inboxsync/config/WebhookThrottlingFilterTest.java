package com.example.inboxsync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import jakarta.servlet.FilterChain;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class WebhookThrottlingFilterTest {

    private WebhookSecurityProperties properties;
    private WebhookThrottlingFilter filter;

    @BeforeEach
    void setUp() {
        properties = new WebhookSecurityProperties();
        properties.getThrottle().setBurst(2);
        properties.getThrottle().setSustained(2);
        properties.getThrottle().setWindow(Duration.ofHours(1));
        filter = new WebhookThrottlingFilter(properties);
    }

    @Test
    void doFilter_rejectsSource_onceBurstIsSpent() throws Exception {
        FilterChain chain = mock(FilterChain.class);

        assertEquals(200, deliver("10.0.0.1", chain).getStatus());
        assertEquals(200, deliver("10.0.0.1", chain).getStatus());
        MockHttpServletResponse throttled = deliver("10.0.0.1", chain);

        assertEquals(429, throttled.getStatus());
        assertNotNull(throttled.getHeader("Retry-After"));
        assertTrue(throttled.getContentAsString().contains("too_many_requests"));
        verify(chain, times(2)).doFilter(any(), any());
    }

    @Test
    void doFilter_keepsSeparateBucketPerForwardedSource() throws Exception {
        FilterChain chain = mock(FilterChain.class);
        deliver("10.0.0.1", chain);
        deliver("10.0.0.1", chain);

        MockHttpServletRequest request = webhookRequest("10.0.0.1");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, chain);

        assertEquals(200, response.getStatus());
    }

    @Test
    void doFilter_passesUnthrottledPaths() throws Exception {
        FilterChain chain = mock(FilterChain.class);
        properties.getThrottle().setBurst(1);

        for (int i = 0; i < 5; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/attachments/att-1");
            request.setRemoteAddr("10.0.0.1");
            MockHttpServletResponse response = new MockHttpServletResponse();
            filter.doFilter(request, response, chain);
            assertEquals(200, response.getStatus());
        }
        verify(chain, times(5)).doFilter(any(), any());
    }

    @Test
    void doFilter_passesEverything_whenThrottleDisabled() throws Exception {
        FilterChain chain = mock(FilterChain.class);
        properties.setThrottleEnabled(false);

        for (int i = 0; i < 4; i++) {
            assertEquals(200, deliver("10.0.0.1", chain).getStatus());
        }
        verify(chain, times(4)).doFilter(any(), any());
    }

    private MockHttpServletResponse deliver(String remoteAddr, FilterChain chain) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(webhookRequest(remoteAddr), response, chain);
        return response;
    }

    private static MockHttpServletRequest webhookRequest(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/webhooks/messaging");
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}
