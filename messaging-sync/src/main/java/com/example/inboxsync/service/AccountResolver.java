package com.example.inboxsync.service;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.service.exception.SyncException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class AccountResolver {

    private final SyncStore store;

    /**
     * Resolves an account that may receive data. Unknown and disconnected accounts are
     * rejected with {@code NOT_FOUND}; such events are never retried.
     */
    public Account requireActiveAccount(String accountExternalId) {
        if (!StringUtils.hasText(accountExternalId)) {
            throw SyncException.invalidEvent("account_id is required");
        }
        return store.findAccount(accountExternalId)
                .filter(account -> !account.isDeleted())
                .orElseThrow(() -> SyncException.notFound("Account not found: " + accountExternalId));
    }
}
