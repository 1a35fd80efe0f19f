package com.example.inboxsync.persistence;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChatJpaRepository extends JpaRepository<ChatEntity, String> {

    Optional<ChatEntity> findByAccountIdAndExternalId(String accountId, String externalId);

    List<ChatEntity> findByAccountIdOrderByLastMessageAtDesc(String accountId);
}
