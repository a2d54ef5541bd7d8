package com.adinsight.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-process cache. Entries expire {@code ttl} after they were written and the
 * least recently accessed ones are evicted once the store grows past {@code maxItems}.
 * Nothing survives a restart.
 */
public class EphemeralMemoryStore implements MemoryStore {

  private static final Logger log = LoggerFactory.getLogger(EphemeralMemoryStore.class);

  private final Map<String, Entry> entries = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  private final int maxItems;
  private final Duration ttl;
  private final Clock clock;
  private final MemoryMetrics metrics;

  public EphemeralMemoryStore(int maxItems, Duration ttl, Clock clock, MemoryMetrics metrics) {
    if (maxItems <= 0) {
      throw new IllegalArgumentException("maxItems must be positive: " + maxItems);
    }
    this.maxItems = maxItems;
    this.ttl = ttl;
    this.clock = clock;
    this.metrics = metrics;
  }

  @Override
  public boolean put(String key, JsonNode value) {
    if (key == null) {
      return false;
    }
    lock.lock();
    try {
      evictExpired();

      Instant now = clock.instant();
      entries.remove(key);
      entries.put(key, new Entry(value == null ? NullNode.getInstance() : value, now));

      evictLeastRecentlyUsed();
      log.debug("Stored key={} tier=ephemeral size={}", key, entries.size());
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to store key={} tier=ephemeral", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<JsonNode> get(String key) {
    if (key == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      Entry entry = liveEntry(key);
      if (entry == null) {
        return Optional.empty();
      }
      entry.accessCount++;
      entry.lastAccessed = clock.instant();
      return Optional.of(entry.value);
    } catch (RuntimeException e) {
      log.error("Failed to retrieve key={} tier=ephemeral", key, e);
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean delete(String key) {
    lock.lock();
    try {
      boolean removed = entries.remove(key) != null;
      if (removed) {
        log.debug("Deleted key={} tier=ephemeral", key);
      }
      return removed;
    } catch (RuntimeException e) {
      log.error("Failed to delete key={} tier=ephemeral", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean clear() {
    lock.lock();
    try {
      entries.clear();
      log.info("Cleared tier=ephemeral");
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to clear tier=ephemeral", e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean exists(String key) {
    lock.lock();
    try {
      return liveEntry(key) != null;
    } catch (RuntimeException e) {
      log.error("Failed to check key={} tier=ephemeral", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<String> listKeys() {
    lock.lock();
    try {
      evictExpired();
      return List.copyOf(entries.keySet());
    } catch (RuntimeException e) {
      log.error("Failed to list keys tier=ephemeral", e);
      return List.of();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int purgeExpired() {
    lock.lock();
    try {
      return evictExpired();
    } catch (RuntimeException e) {
      log.error("Failed to purge expired entries tier=ephemeral", e);
      return 0;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the entry for {@code key}, dropping it first if it has expired. */
  private Entry liveEntry(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    if (isExpired(entry, clock.instant())) {
      entries.remove(key);
      metrics.expired(MemoryTier.EPHEMERAL, 1);
      log.debug("Expired key={} tier=ephemeral", key);
      return null;
    }
    return entry;
  }

  private int evictExpired() {
    Instant now = clock.instant();
    int removed = 0;
    Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
    while (it.hasNext()) {
      if (isExpired(it.next().getValue(), now)) {
        it.remove();
        removed++;
      }
    }
    if (removed > 0) {
      metrics.expired(MemoryTier.EPHEMERAL, removed);
      log.debug("Expired {} entries tier=ephemeral", removed);
    }
    return removed;
  }

  private void evictLeastRecentlyUsed() {
    int excess = entries.size() - maxItems;
    if (excess <= 0) {
      return;
    }
    // stable sort: equal access times fall back to insertion order
    List<Map.Entry<String, Entry>> byAccess = new ArrayList<>(entries.entrySet());
    byAccess.sort(Comparator.comparing(e -> e.getValue().lastAccessed));
    List<String> victims = new ArrayList<>(excess);
    for (int i = 0; i < excess; i++) {
      victims.add(byAccess.get(i).getKey());
    }
    for (String key : victims) {
      entries.remove(key);
      metrics.evicted(MemoryTier.EPHEMERAL, "lru");
      log.debug("Evicted key={} tier=ephemeral reason=lru", key);
    }
  }

  private boolean isExpired(Entry entry, Instant now) {
    return Duration.between(entry.createdAt, now).compareTo(ttl) > 0;
  }

  private static final class Entry {
    private final JsonNode value;
    private final Instant createdAt;
    private Instant lastAccessed;
    private int accessCount;

    private Entry(JsonNode value, Instant createdAt) {
      this.value = value;
      this.createdAt = createdAt;
      this.lastAccessed = createdAt;
    }
  }
}
