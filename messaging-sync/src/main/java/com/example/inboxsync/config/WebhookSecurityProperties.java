package com.example.inboxsync.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "sync.security")
public class WebhookSecurityProperties {

    /**
     * Throttle inbound deliveries per source address.
     */
    private boolean throttleEnabled = true;

    /**
     * Request path prefixes the throttle applies to.
     */
    private List<String> throttledPaths = new ArrayList<>(List.of("/api/webhooks/", "/api/dev/"));

    private final Throttle throttle = new Throttle();

    public boolean isThrottleEnabled() {
        return throttleEnabled;
    }

    public void setThrottleEnabled(boolean throttleEnabled) {
        this.throttleEnabled = throttleEnabled;
    }

    public List<String> getThrottledPaths() {
        return throttledPaths;
    }

    public void setThrottledPaths(List<String> throttledPaths) {
        this.throttledPaths = throttledPaths;
    }

    public Throttle getThrottle() {
        return throttle;
    }

    @Validated
    public static class Throttle {

        /**
         * Burst size a single source may deliver before being throttled.
         */
        @Positive
        private long burst = 600;

        /**
         * Deliveries granted back to a source every {@link #window}.
         */
        @Positive
        private long sustained = 600;

        private Duration window = Duration.ofMinutes(1);

        public long getBurst() {
            return burst;
        }

        public void setBurst(long burst) {
            this.burst = burst;
        }

        public long getSustained() {
            return sustained;
        }

        public void setSustained(long sustained) {
            this.sustained = sustained;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
