package com.example.podpairing.rooms.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PersistentSessionRepository extends JpaRepository<PersistentSession, String> {

    List<PersistentSession> findByEndedFalse();
}
