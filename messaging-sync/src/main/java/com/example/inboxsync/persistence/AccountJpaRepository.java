package com.example.inboxsync.persistence;

import com.example.inboxsync.domain.SyncState;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountJpaRepository extends JpaRepository<AccountEntity, String> {

    Optional<AccountEntity> findByAccountId(String accountId);

    List<AccountEntity> findBySyncState(SyncState syncState);
}
