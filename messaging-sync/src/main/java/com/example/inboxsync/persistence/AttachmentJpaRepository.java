package com.example.inboxsync.persistence;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AttachmentJpaRepository extends JpaRepository<AttachmentEntity, String> {

    Optional<AttachmentEntity> findByMessageIdAndExternalId(String messageId, String externalId);

    List<AttachmentEntity> findByMessageId(String messageId);
}
