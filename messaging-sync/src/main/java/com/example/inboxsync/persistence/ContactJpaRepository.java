package com.example.inboxsync.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ContactJpaRepository extends JpaRepository<ContactEntity, String> {

    Optional<ContactEntity> findByAccountIdAndExternalId(String accountId, String externalId);
}
