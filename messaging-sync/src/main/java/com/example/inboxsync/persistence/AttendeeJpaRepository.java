package com.example.inboxsync.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AttendeeJpaRepository extends JpaRepository<AttendeeEntity, String> {

    Optional<AttendeeEntity> findByChatIdAndExternalId(String chatId, String externalId);
}
