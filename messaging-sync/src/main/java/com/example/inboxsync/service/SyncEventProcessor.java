package com.example.inboxsync.service;

import com.example.inboxsync.dto.WebhookEnvelope;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Applies webhook events asynchronously. Per-chat ordering is enforced by the chat lock,
 * not by the executor.
 */
@Slf4j
@Component
public class SyncEventProcessor {

    private final TaskExecutor executor;
    private final InboundEventRouter router;

    public SyncEventProcessor(@Qualifier("syncEventExecutor") TaskExecutor executor, InboundEventRouter router) {
        this.executor = executor;
        this.router = router;
    }

    public void submit(WebhookEnvelope envelope) {
        try {
            executor.execute(() -> process(envelope));
        } catch (RejectedExecutionException ex) {
            throw new SyncException(SyncErrorType.TRANSIENT, "Event queue is full; retry later", "queue_full", ex);
        }
    }

    void process(WebhookEnvelope envelope) {
        try {
            router.route(envelope);
        } catch (SyncException ex) {
            if (ex.isRetryable()) {
                log.error("Failed to apply {} event", envelope.getEvent(), ex);
            } else {
                log.warn("Rejected {} event: {}", envelope.getEvent(), ex.getMessage());
            }
        } catch (RuntimeException ex) {
            log.error("Failed to apply {} event", envelope.getEvent(), ex);
        }
    }
}
