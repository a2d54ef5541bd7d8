package com.adinsight.memory;

import static com.adinsight.memory.TestSupport.number;
import static com.adinsight.memory.TestSupport.text;
import static org.junit.jupiter.api.Assertions.*;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class EphemeralMemoryStoreTest {

  private MutableClock clock;
  private SimpleMeterRegistry registry;
  private EphemeralMemoryStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    registry = new SimpleMeterRegistry();
    store = new EphemeralMemoryStore(3, Duration.ofSeconds(60), clock, new MemoryMetrics(registry));
  }

  @Test
  void storesAndReturnsValue() {
    assertTrue(store.put("spend", number(120)));

    assertEquals(number(120), store.get("spend").orElseThrow());
    assertTrue(store.exists("spend"));
  }

  @Test
  void missingKeyReturnsDefault() {
    assertEquals(text("fallback"), store.get("nope", text("fallback")));
    assertFalse(store.delete("nope"));
  }

  @Test
  void deletedAndClearedKeysNoLongerExist() {
    store.put("a", number(1));
    store.put("b", number(2));

    assertTrue(store.delete("a"));
    assertFalse(store.exists("a"));

    assertTrue(store.clear());
    assertFalse(store.exists("b"));
    assertTrue(store.listKeys().isEmpty());
  }

  @Test
  void entryExpiresAfterTtl() {
    store.put("ctr", number(3));

    clock.advance(Duration.ofSeconds(60));
    assertTrue(store.exists("ctr"));

    clock.advance(Duration.ofMillis(1));
    assertTrue(store.get("ctr").isEmpty());
    assertFalse(store.listKeys().contains("ctr"));
    assertEquals(1.0, registry.get("memory.expirations").tag("tier", "ephemeral").counter().count());
  }

  @Test
  void expiredEntriesAreLeftOutOfListing() {
    store.put("old", number(1));
    clock.advance(Duration.ofSeconds(30));
    store.put("new", number(2));
    clock.advance(Duration.ofSeconds(31));

    assertEquals(List.of("new"), store.listKeys());
  }

  @Test
  void overflowEvictsEarliestInsertedWhenNothingWasRead() {
    store.put("k1", number(1));
    store.put("k2", number(2));
    store.put("k3", number(3));
    store.put("k4", number(4));

    assertEquals(List.of("k2", "k3", "k4"), store.listKeys());
    assertEquals(1.0, registry.get("memory.evictions")
        .tag("tier", "ephemeral").tag("reason", "lru").counter().count());
  }

  @Test
  void overflowEvictsLeastRecentlyAccessedNotOldest() {
    store.put("k1", number(1));
    clock.advance(Duration.ofSeconds(1));
    store.put("k2", number(2));
    clock.advance(Duration.ofSeconds(1));
    store.put("k3", number(3));
    clock.advance(Duration.ofSeconds(1));
    store.get("k1");
    clock.advance(Duration.ofSeconds(1));

    store.put("k4", number(4));

    assertTrue(store.exists("k1"));
    assertFalse(store.exists("k2"));
    assertTrue(store.exists("k3"));
    assertTrue(store.exists("k4"));
  }

  @Test
  void overwriteRestartsTtl() {
    store.put("k", number(1));
    clock.advance(Duration.ofSeconds(50));
    store.put("k", number(2));
    clock.advance(Duration.ofSeconds(50));

    assertEquals(number(2), store.get("k").orElseThrow());
  }

  @Test
  void purgeExpiredReportsRemovedCount() {
    store.put("a", number(1));
    store.put("b", number(2));
    clock.advance(Duration.ofMinutes(2));
    store.put("c", number(3));

    // "a" and "b" already went with the sweep that runs before every put
    assertEquals(0, store.purgeExpired());
    clock.advance(Duration.ofMinutes(2));
    assertEquals(1, store.purgeExpired());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class,
        () -> new EphemeralMemoryStore(0, Duration.ofSeconds(1), clock, TestSupport.metrics()));
  }
}
