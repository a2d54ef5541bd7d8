package com.adinsight.memory;

import static com.adinsight.memory.TestSupport.number;
import static com.adinsight.memory.TestSupport.text;
import static org.junit.jupiter.api.Assertions.*;

import com.adinsight.model.SessionEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SessionMemoryStoreTest {

  private MutableClock clock;
  private SimpleMeterRegistry registry;
  private SessionMemoryStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    registry = new SimpleMeterRegistry();
    store = new SessionMemoryStore(2, Duration.ofHours(24), clock, new MemoryMetrics(registry));
  }

  @Test
  void eventsComeBackInInsertionOrder() {
    assertTrue(store.put("s1:e1", text("x")));
    clock.advance(Duration.ofSeconds(1));
    assertTrue(store.put("s1:e2", text("y")));

    List<SessionEvent> events = store.getSessionEvents("s1");

    assertEquals(2, events.size());
    assertEquals("e1", events.get(0).eventId());
    assertEquals(text("x"), events.get(0).payload());
    assertEquals("e2", events.get(1).eventId());
    assertEquals(text("y"), events.get(1).payload());
    assertTrue(events.get(0).timestamp().isBefore(events.get(1).timestamp()));
  }

  @Test
  void deletingLastEventRemovesSession() {
    store.put("s1:e1", text("x"));
    store.put("s1:e2", text("y"));

    assertTrue(store.delete("s1:e1"));
    assertEquals(1, store.sessionCount());
    assertTrue(store.delete("s1:e2"));

    assertEquals(0, store.sessionCount());
    assertTrue(store.getSessionEvents("s1").isEmpty());
    assertFalse(store.exists("s1:e2"));
  }

  @Test
  void malformedKeysFailQuietly() {
    assertFalse(store.put("no-delimiter", text("x")));
    assertFalse(store.put(":e1", text("x")));
    assertTrue(store.get("no-delimiter").isEmpty());
    assertEquals(text("d"), store.get("no-delimiter", text("d")));
    assertFalse(store.delete("no-delimiter"));
    assertFalse(store.exists("no-delimiter"));
    assertEquals(0, store.sessionCount());
  }

  @Test
  void eventIdMayContainDelimiter() {
    store.put("s1:step:1", number(1));

    assertEquals(number(1), store.get("s1:step:1").orElseThrow());
    assertEquals(List.of("s1:step:1"), store.listKeys());
  }

  @Test
  void duplicateEventIdsAreKeptAndResolveToFirst() {
    store.put("s1:e", text("first"));
    store.put("s1:e", text("second"));

    assertEquals(2, store.getSessionEvents("s1").size());
    assertEquals(List.of("s1:e", "s1:e"), store.listKeys());
    assertEquals(text("first"), store.get("s1:e").orElseThrow());

    assertTrue(store.delete("s1:e"));
    assertEquals(text("second"), store.get("s1:e").orElseThrow());
  }

  @Test
  void deleteOfUnknownEventFails() {
    store.put("s1:e1", text("x"));

    assertFalse(store.delete("s1:missing"));
    assertFalse(store.delete("s9:e1"));
    assertEquals(1, store.getSessionEvents("s1").size());
  }

  @Test
  void sessionExpiresByAgeEvenWhenActive() {
    store.put("s1:e1", text("x"));
    clock.advance(Duration.ofHours(23));
    store.get("s1:e1");
    clock.advance(Duration.ofHours(1).plusSeconds(1));

    assertFalse(store.exists("s1:e1"));
    assertEquals(0, store.sessionCount());
    assertEquals(1.0, registry.get("memory.expirations").tag("tier", "session").counter().count());
  }

  @Test
  void expiredSessionsAreLeftOutOfListingAndEvents() {
    store.put("old:e1", text("x"));
    clock.advance(Duration.ofHours(20));
    store.put("new:e1", text("y"));
    clock.advance(Duration.ofHours(5));

    assertEquals(List.of("new:e1"), store.listKeys());
    assertTrue(store.getSessionEvents("old").isEmpty());
  }

  @Test
  void writingToExpiredSessionStartsFreshOne() {
    store.put("s1:e1", text("x"));
    clock.advance(Duration.ofHours(25));

    store.put("s1:e2", text("y"));

    List<SessionEvent> events = store.getSessionEvents("s1");
    assertEquals(1, events.size());
    assertEquals("e2", events.get(0).eventId());
  }

  @Test
  void overflowEvictsOldestSession() {
    store.put("a:e", number(1));
    clock.advance(Duration.ofMinutes(1));
    store.put("b:e", number(2));
    clock.advance(Duration.ofMinutes(1));
    store.put("a:e2", number(3));
    clock.advance(Duration.ofMinutes(1));

    store.put("c:e", number(4));

    assertEquals(2, store.sessionCount());
    assertTrue(store.getSessionEvents("a").isEmpty());
    assertFalse(store.getSessionEvents("b").isEmpty());
    assertFalse(store.getSessionEvents("c").isEmpty());
    assertEquals(1.0, registry.get("memory.evictions")
        .tag("tier", "session").tag("reason", "oldest_session").counter().count());
  }

  @Test
  void deleteSessionAndClearRemoveEverything() {
    store.put("a:e", number(1));
    store.put("b:e", number(2));

    assertTrue(store.deleteSession("a"));
    assertFalse(store.deleteSession("a"));
    assertFalse(store.exists("a:e"));

    assertTrue(store.clear());
    assertFalse(store.exists("b:e"));
    assertTrue(store.listKeys().isEmpty());
  }

  @Test
  void purgeExpiredCountsSessions() {
    store.put("a:e", number(1));
    store.put("b:e", number(2));
    clock.advance(Duration.ofDays(2));

    assertEquals(2, store.purgeExpired());
    assertEquals(0, store.sessionCount());
  }

  @Test
  void returnedEventListIsASnapshot() {
    store.put("s1:e1", text("x"));
    List<SessionEvent> events = store.getSessionEvents("s1");

    store.put("s1:e2", text("y"));

    assertEquals(1, events.size());
    assertThrows(UnsupportedOperationException.class, () -> events.add(events.get(0)));
  }
}
