package com.example.inboxsync.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, String> {

    Optional<MessageEntity> findByAccountIdAndExternalId(String accountId, String externalId);
}
