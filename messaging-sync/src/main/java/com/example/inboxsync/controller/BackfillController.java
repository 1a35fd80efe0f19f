package com.example.inboxsync.controller;

import com.example.inboxsync.config.SyncProperties;
import com.example.inboxsync.domain.Account;
import com.example.inboxsync.dto.BackfillRequest;
import com.example.inboxsync.service.AccountResolver;
import com.example.inboxsync.service.BackfillLimits;
import com.example.inboxsync.service.BackfillScheduler;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "sync")
@RestController
@RequestMapping("/api/accounts/{accountId}")
public class BackfillController {

    private final AccountResolver accountResolver;
    private final BackfillScheduler backfillScheduler;
    private final SyncProperties syncProperties;

    public BackfillController(
            AccountResolver accountResolver, BackfillScheduler backfillScheduler, SyncProperties syncProperties) {
        this.accountResolver = accountResolver;
        this.backfillScheduler = backfillScheduler;
        this.syncProperties = syncProperties;
    }

    @PostMapping("/backfill")
    public ResponseEntity<Map<String, Object>> triggerBackfill(
            @PathVariable String accountId,
            @Valid @RequestBody(required = false) BackfillRequest request) {
        Account account = accountResolver.requireActiveAccount(accountId);
        if (account.isSyncRunning() || backfillScheduler.isPending(account.getAccountId())) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of(
                            "timestamp", Instant.now().toString(),
                            "code", "backfill_in_progress",
                            "message", "Backfill already running for account " + accountId));
        }
        BackfillLimits limits = BackfillLimits.from(syncProperties.getBackfill()).withOverrides(request);
        boolean scheduled = backfillScheduler.schedule(account.getAccountId(), limits, Duration.ZERO);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountId", account.getAccountId());
        body.put("scheduled", scheduled);
        body.put("limits", limits);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/sync")
    public ResponseEntity<Map<String, Object>> syncStatus(@PathVariable String accountId) {
        Account account = accountResolver.requireActiveAccount(accountId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountId", account.getAccountId());
        body.put("status", account.getStatus());
        body.put("syncState", account.getSyncState());
        body.put("syncStartedAt", account.getSyncStartedAt());
        body.put("syncCompletedAt", account.getSyncCompletedAt());
        body.put("syncError", account.getSyncError());
        body.put("chatsSynced", account.getChatsSynced());
        body.put("messagesSynced", account.getMessagesSynced());
        body.put("attendeesSynced", account.getAttendeesSynced());
        body.put("pending", backfillScheduler.isPending(account.getAccountId()));
        return ResponseEntity.ok(body);
    }
}
