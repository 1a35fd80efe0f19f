package com.example.inboxsync.controller;

import com.example.inboxsync.dto.WebhookEnvelope;
import com.example.inboxsync.service.InboundEventRouter;
import com.example.inboxsync.service.SyncEventProcessor;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "webhooks")
@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

    private final SyncEventProcessor eventProcessor;
    private final InboundEventRouter router;

    public WebhookController(SyncEventProcessor eventProcessor, InboundEventRouter router) {
        this.eventProcessor = eventProcessor;
        this.router = router;
    }

    /**
     * Accepts a platform webhook. Events are applied in the background unless {@code sync=true},
     * in which case errors are reported to the caller.
     */
    @PostMapping("/messaging")
    public ResponseEntity<Map<String, Object>> receive(
            @Valid @RequestBody WebhookEnvelope envelope,
            @RequestParam(name = "sync", defaultValue = "false") boolean synchronous) {
        if (synchronous) {
            boolean handled = router.route(envelope);
            return ResponseEntity.ok(Map.of(
                    "event", envelope.getEvent(),
                    "status", handled ? "applied" : "ignored",
                    "timestamp", Instant.now().toString()));
        }
        eventProcessor.submit(envelope);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of(
                        "event", envelope.getEvent(),
                        "status", "accepted",
                        "timestamp", Instant.now().toString()));
    }
}
