package com.adinsight.memory;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

public class MemoryMaintenance implements SchedulingConfigurer {

  private static final Logger log = LoggerFactory.getLogger(MemoryMaintenance.class);

  private final MemoryManager memoryManager;
  private final Duration interval;

  public MemoryMaintenance(MemoryManager memoryManager, Duration interval) {
    this.memoryManager = memoryManager;
    this.interval = interval;
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.addFixedDelayTask(new FixedDelayTask(this::sweep, interval, interval));
    log.info("Expiry sweep scheduled interval={}", interval);
  }

  public int sweep() {
    int removed = memoryManager.purgeExpired();
    if (removed > 0) {
      log.info("Expiry sweep removed {} entries", removed);
    }
    return removed;
  }
}
