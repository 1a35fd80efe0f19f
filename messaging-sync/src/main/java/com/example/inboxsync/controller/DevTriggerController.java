package com.example.inboxsync.controller;

import com.example.inboxsync.dto.SimulatedMessageRequest;
import com.example.inboxsync.service.DevTriggerService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "sync")
@RestController
@RequestMapping("/api/dev")
@ConditionalOnProperty(prefix = "sync.simulation", name = "enabled", havingValue = "true")
public class DevTriggerController {

    private final DevTriggerService devTriggerService;

    public DevTriggerController(DevTriggerService devTriggerService) {
        this.devTriggerService = devTriggerService;
    }

    @PostMapping("/simulated-messages")
    public ResponseEntity<DevTriggerService.SimulationResult> simulate(@Valid @RequestBody SimulatedMessageRequest request) {
        return ResponseEntity.ok(devTriggerService.simulateIncoming(request));
    }
}
