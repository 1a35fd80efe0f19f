package com.example.inboxsync.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token-bucket throttle for webhook deliveries, one bucket per source address.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class WebhookThrottlingFilter extends OncePerRequestFilter {

    private final WebhookSecurityProperties securityProperties;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public WebhookThrottlingFilter(WebhookSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!securityProperties.isThrottleEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        return securityProperties.getThrottledPaths().stream().noneMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String source = resolveSource(request);
        ConsumptionProbe probe = buckets.computeIfAbsent(source, key -> newBucket()).tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            filterChain.doFilter(request, response);
            return;
        }
        log.warn("Throttling webhook deliveries from {}", source);
        writeThrottledResponse(response, probe.getNanosToWaitForRefill());
    }

    private Bucket newBucket() {
        WebhookSecurityProperties.Throttle throttle = securityProperties.getThrottle();
        Duration window = throttle.getWindow();
        if (window == null || window.isZero() || window.isNegative()) {
            window = Duration.ofMinutes(1);
        }
        Bandwidth limit = Bandwidth.classic(
                Math.max(throttle.getBurst(), 1),
                Refill.greedy(Math.max(throttle.getSustained(), 1), window));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    private void writeThrottledResponse(HttpServletResponse response, long nanosToWait) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        long retryAfterSeconds = Math.max(TimeUnit.NANOSECONDS.toSeconds(nanosToWait), 1);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.getWriter()
                .write("{\"code\":\"too_many_requests\",\"message\":\"Webhook delivery rate exceeded.\"}");
    }

    private String resolveSource(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        return StringUtils.hasText(forwardedFor)
                ? forwardedFor.split(",")[0].trim()
                : request.getRemoteAddr();
    }
}
