package com.adinsight.memory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MemoryMetrics {

  private final MeterRegistry meterRegistry;

  public MemoryMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void evicted(MemoryTier tier, String reason) {
    Counter.builder("memory.evictions")
        .description("Entries removed to stay within capacity")
        .tag("tier", tier.id())
        .tag("reason", reason)
        .register(meterRegistry)
        .increment();
  }

  public void expired(MemoryTier tier, int count) {
    if (count <= 0) {
      return;
    }
    Counter.builder("memory.expirations")
        .description("Entries or sessions removed after their age ran out")
        .tag("tier", tier.id())
        .register(meterRegistry)
        .increment(count);
  }

  public void persisted(MemoryTier tier, long durationMs) {
    Timer.builder("memory.persist.duration")
        .description("Snapshot write duration")
        .tag("tier", tier.id())
        .register(meterRegistry)
        .record(durationMs, TimeUnit.MILLISECONDS);
  }

  public void persistFailed(MemoryTier tier) {
    Counter.builder("memory.persist.failures")
        .description("Snapshot writes that did not reach disk")
        .tag("tier", tier.id())
        .register(meterRegistry)
        .increment();
  }
}
