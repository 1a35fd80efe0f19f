package com.example.inboxsync.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ProfileViewJpaRepository extends JpaRepository<ProfileViewEntity, String> {
}
