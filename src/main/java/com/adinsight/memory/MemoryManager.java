package com.adinsight.memory;

import com.adinsight.model.TierStats;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point over the four memory tiers. Callers name the tier as a string;
 * an unknown name is logged and answered with {@code false} or the caller's default.
 */
public class MemoryManager {

  private static final Logger log = LoggerFactory.getLogger(MemoryManager.class);

  public static final String ALL_TIERS = "all";
  public static final String DEFAULT_TIER = MemoryTier.EPHEMERAL.id();

  private final Map<MemoryTier, MemoryStore> stores = new EnumMap<>(MemoryTier.class);
  private final SessionMemoryStore sessions;
  private final RelationalMemoryStore relations;

  public MemoryManager(
      EphemeralMemoryStore ephemeral,
      PersistentMemoryStore persistent,
      SessionMemoryStore sessions,
      RelationalMemoryStore relations) {
    this.sessions = sessions;
    this.relations = relations;
    stores.put(MemoryTier.EPHEMERAL, ephemeral);
    stores.put(MemoryTier.PERSISTENT, persistent);
    stores.put(MemoryTier.SESSION, sessions);
    stores.put(MemoryTier.RELATIONAL, relations);
    log.info("Memory manager initialized tiers={}", stores.keySet());
  }

  public boolean store(String key, JsonNode value, String tier) {
    return resolve(tier, "store").map(store -> store.put(key, value)).orElse(false);
  }

  public boolean store(String key, JsonNode value) {
    return store(key, value, DEFAULT_TIER);
  }

  public JsonNode retrieve(String key, JsonNode defaultValue, String tier) {
    Optional<MemoryStore> store = resolve(tier, "retrieve");
    if (store.isEmpty()) {
      return defaultValue;
    }
    return store.get().get(key, defaultValue);
  }

  public JsonNode retrieve(String key, JsonNode defaultValue) {
    return retrieve(key, defaultValue, DEFAULT_TIER);
  }

  public boolean delete(String key, String tier) {
    return resolve(tier, "delete").map(store -> store.delete(key)).orElse(false);
  }

  public boolean delete(String key) {
    return delete(key, DEFAULT_TIER);
  }

  public boolean exists(String key, String tier) {
    return resolve(tier, "exists").map(store -> store.exists(key)).orElse(false);
  }

  public List<String> listKeys(String tier) {
    return resolve(tier, "listKeys").map(MemoryStore::listKeys).orElse(List.of());
  }

  /**
   * Clears one tier, or every tier for {@value #ALL_TIERS}. With {@value #ALL_TIERS} every
   * tier is attempted even after a failure, and the result is true only if all succeeded.
   */
  public boolean clear(String tier) {
    if (ALL_TIERS.equalsIgnoreCase(tier)) {
      boolean allCleared = true;
      for (Map.Entry<MemoryTier, MemoryStore> entry : stores.entrySet()) {
        boolean cleared = entry.getValue().clear();
        if (!cleared) {
          log.error("Failed to clear tier={} during clear-all", entry.getKey().id());
        }
        allCleared &= cleared;
      }
      return allCleared;
    }
    return resolve(tier, "clear").map(MemoryStore::clear).orElse(false);
  }

  public boolean clear() {
    return clear(ALL_TIERS);
  }

  /**
   * @return total number of entries and sessions removed across tiers
   */
  public int purgeExpired() {
    int removed = 0;
    for (MemoryStore store : stores.values()) {
      removed += store.purgeExpired();
    }
    return removed;
  }

  public Map<String, TierStats> getStats() {
    Map<String, TierStats> stats = new LinkedHashMap<>();
    stores.forEach((tier, store) ->
        stats.put(tier.id(), new TierStats(store.listKeys().size(), store.getClass().getSimpleName())));
    return stats;
  }

  public MemoryStore tier(MemoryTier tier) {
    return stores.get(tier);
  }

  public SessionMemoryStore sessions() {
    return sessions;
  }

  public RelationalMemoryStore relations() {
    return relations;
  }

  private Optional<MemoryStore> resolve(String tier, String operation) {
    Optional<MemoryTier> resolved = MemoryTier.fromName(tier);
    if (resolved.isEmpty()) {
      log.error("Unknown memory tier={} operation={}", tier, operation);
      return Optional.empty();
    }
    return Optional.of(stores.get(resolved.get()));
  }
}
