package com.example.podpairing.config;

import com.example.podpairing.rooms.repo.SessionStore;
import com.example.podpairing.rooms.service.NoOpSessionPersistenceService;
import com.example.podpairing.rooms.service.SessionPersistenceService;
import com.example.podpairing.rooms.service.SessionSnapshotter;
import com.example.podpairing.rooms.service.StoredSessionPersistenceService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PersistenceConfig {

  @Bean
  @ConditionalOnProperty(prefix = "pods.persistence", name = "enabled", havingValue = "true", matchIfMissing = true)
  public SessionPersistenceService storedSessionPersistence(SessionStore store) {
    return new StoredSessionPersistenceService(store);
  }

  // In-memory only: snapshots are dropped
  @Bean
  @ConditionalOnProperty(prefix = "pods.persistence", name = "enabled", havingValue = "false")
  public SessionPersistenceService noOpSessionPersistence() {
    return new NoOpSessionPersistenceService();
  }

  @Bean
  public SessionSnapshotter sessionSnapshotter(SessionPersistenceService service, PodProperties props) {
    return new SessionSnapshotter(service, props.snapshotDebounceMs());
  }
}
