package com.adinsight.config;

import com.adinsight.memory.EphemeralMemoryStore;
import com.adinsight.memory.MemoryMaintenance;
import com.adinsight.memory.MemoryManager;
import com.adinsight.memory.MemoryMetrics;
import com.adinsight.memory.PersistentMemoryStore;
import com.adinsight.memory.RelationalMemoryStore;
import com.adinsight.memory.SessionMemoryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock memoryClock() {
    return Clock.systemUTC();
  }

  @Bean
  public MemoryMetrics memoryMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    return new MemoryMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  public EphemeralMemoryStore ephemeralMemoryStore(
      MemoryProperties properties, Clock clock, MemoryMetrics metrics) {
    MemoryProperties.ShortTerm cfg = properties.shortTerm();
    return new EphemeralMemoryStore(
        cfg.maxItems(), Duration.ofSeconds(cfg.ttlSeconds()), clock, metrics);
  }

  @Bean
  public PersistentMemoryStore persistentMemoryStore(
      MemoryProperties properties, ObjectMapper mapper, Clock clock, MemoryMetrics metrics) {
    MemoryProperties.LongTerm cfg = properties.longTerm();
    return new PersistentMemoryStore(
        cfg.maxItems(), Path.of(cfg.persistenceFile()), mapper, clock, metrics);
  }

  @Bean
  public SessionMemoryStore sessionMemoryStore(
      MemoryProperties properties, Clock clock, MemoryMetrics metrics) {
    MemoryProperties.Episodic cfg = properties.episodic();
    return new SessionMemoryStore(
        cfg.maxSessions(), Duration.ofHours(cfg.sessionTtlHours()), clock, metrics);
  }

  @Bean
  public RelationalMemoryStore relationalMemoryStore(
      MemoryProperties properties, ObjectMapper mapper, Clock clock, MemoryMetrics metrics) {
    MemoryProperties.Semantic cfg = properties.semantic();
    return new RelationalMemoryStore(
        cfg.maxItems(), Path.of(cfg.knowledgeGraphFile()), mapper, clock, metrics);
  }

  @Bean
  public MemoryManager memoryManager(
      EphemeralMemoryStore ephemeral,
      PersistentMemoryStore persistent,
      SessionMemoryStore sessions,
      RelationalMemoryStore relations) {
    return new MemoryManager(ephemeral, persistent, sessions, relations);
  }

  @Bean
  public MemoryMaintenance memoryMaintenance(MemoryManager memoryManager, MemoryProperties properties) {
    return new MemoryMaintenance(memoryManager, Duration.ofMillis(properties.sweepIntervalMs()));
  }
}
