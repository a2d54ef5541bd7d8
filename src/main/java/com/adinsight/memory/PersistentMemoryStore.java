package com.adinsight.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capacity-bounded key/value map that rewrites its JSON snapshot after every mutation.
 *
 * <p>When full, the entry with the oldest write timestamp is evicted to make room.
 * Reads update access metadata in memory only; that metadata reaches disk with the
 * next mutation.
 */
public class PersistentMemoryStore implements MemoryStore {

  private static final Logger log = LoggerFactory.getLogger(PersistentMemoryStore.class);

  private final Map<String, JsonNode> memory = new LinkedHashMap<>();
  private final Map<String, EntryMetadata> metadata = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  private final int maxItems;
  private final SnapshotFile<Snapshot> snapshotFile;
  private final Clock clock;
  private final MemoryMetrics metrics;

  public PersistentMemoryStore(
      int maxItems,
      Path persistenceFile,
      ObjectMapper mapper,
      Clock clock,
      MemoryMetrics metrics) {
    if (maxItems <= 0) {
      throw new IllegalArgumentException("maxItems must be positive: " + maxItems);
    }
    this.maxItems = maxItems;
    this.snapshotFile = new SnapshotFile<>(persistenceFile, mapper, Snapshot.class);
    this.clock = clock;
    this.metrics = metrics;
    load();
  }

  @Override
  public boolean put(String key, JsonNode value) {
    if (key == null) {
      return false;
    }
    lock.lock();
    try {
      if (!memory.containsKey(key)) {
        while (memory.size() >= maxItems) {
          evictOldest();
        }
      }

      Instant now = clock.instant();
      memory.put(key, value == null ? NullNode.getInstance() : value);
      metadata.put(key, new EntryMetadata(now, 0, now));

      persist();
      log.debug("Stored key={} tier=persistent size={}", key, memory.size());
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to store key={} tier=persistent", key, e);
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
      JsonNode value = memory.get(key);
      if (value == null) {
        return Optional.empty();
      }
      metadata.compute(key, (k, meta) -> meta == null
          ? new EntryMetadata(clock.instant(), 1, clock.instant())
          : meta.accessed(clock.instant()));
      return Optional.of(value);
    } catch (RuntimeException e) {
      log.error("Failed to retrieve key={} tier=persistent", key, e);
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean delete(String key) {
    lock.lock();
    try {
      if (!memory.containsKey(key)) {
        return false;
      }
      memory.remove(key);
      metadata.remove(key);
      persist();
      log.debug("Deleted key={} tier=persistent", key);
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to delete key={} tier=persistent", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean clear() {
    lock.lock();
    try {
      memory.clear();
      metadata.clear();
      persist();
      log.info("Cleared tier=persistent");
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to clear tier=persistent", e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean exists(String key) {
    lock.lock();
    try {
      return memory.containsKey(key);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<String> listKeys() {
    lock.lock();
    try {
      return List.copyOf(memory.keySet());
    } finally {
      lock.unlock();
    }
  }

  /** Access metadata for {@code key}, as it would be written with the next snapshot. */
  public Optional<EntryMetadata> metadata(String key) {
    lock.lock();
    try {
      return Optional.ofNullable(metadata.get(key));
    } finally {
      lock.unlock();
    }
  }

  private void evictOldest() {
    String oldest = null;
    Instant oldestAt = null;
    for (String key : memory.keySet()) {
      EntryMetadata meta = metadata.get(key);
      Instant at = meta == null ? Instant.MIN : meta.timestamp();
      if (oldestAt == null || at.isBefore(oldestAt)) {
        oldest = key;
        oldestAt = at;
      }
    }
    if (oldest == null) {
      return;
    }
    memory.remove(oldest);
    metadata.remove(oldest);
    metrics.evicted(MemoryTier.PERSISTENT, "oldest");
    log.debug("Evicted key={} tier=persistent reason=oldest", oldest);
  }

  private void load() {
    try {
      Optional<Snapshot> loaded = snapshotFile.read();
      if (loaded.isEmpty()) {
        log.info("No snapshot at {}, starting empty tier=persistent", snapshotFile.path());
        return;
      }
      Snapshot snapshot = loaded.get();
      Instant now = clock.instant();
      if (snapshot.memory() != null) {
        memory.putAll(snapshot.memory());
      }
      for (String key : memory.keySet()) {
        EntryMetadata meta = snapshot.metadata() == null ? null : snapshot.metadata().get(key);
        metadata.put(key, restored(meta, now));
      }
      log.info("Loaded {} keys from {} tier=persistent", memory.size(), snapshotFile.path());
    } catch (IOException | RuntimeException e) {
      memory.clear();
      metadata.clear();
      log.error("Failed to load snapshot {}, starting empty tier=persistent", snapshotFile.path(), e);
    }
  }

  private static EntryMetadata restored(EntryMetadata meta, Instant now) {
    if (meta == null || meta.timestamp() == null) {
      return new EntryMetadata(now, 0, now);
    }
    if (meta.lastAccessed() == null) {
      return new EntryMetadata(meta.timestamp(), meta.accessCount(), meta.timestamp());
    }
    return meta;
  }

  private void persist() {
    long startNanos = System.nanoTime();
    try {
      snapshotFile.write(new Snapshot(
          new LinkedHashMap<>(memory), new LinkedHashMap<>(metadata), clock.instant()));
      metrics.persisted(MemoryTier.PERSISTENT, (System.nanoTime() - startNanos) / 1_000_000);
    } catch (IOException e) {
      metrics.persistFailed(MemoryTier.PERSISTENT);
      log.error("Failed to write snapshot {} tier=persistent", snapshotFile.path(), e);
    }
  }

  public record EntryMetadata(
      Instant timestamp,
      @JsonProperty("access_count") int accessCount,
      @JsonProperty("last_accessed") Instant lastAccessed
  ) {

    EntryMetadata accessed(Instant at) {
      return new EntryMetadata(timestamp, accessCount + 1, at);
    }
  }

  public record Snapshot(
      Map<String, JsonNode> memory,
      Map<String, EntryMetadata> metadata,
      @JsonProperty("last_saved") Instant lastSaved
  ) {}
}
