package com.adinsight.memory;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;

/**
 * Key/value contract shared by every memory tier.
 *
 * <p>Implementations never throw from these methods. Failure is reported as
 * {@code false}, an empty result or the caller's default, and logged.
 */
public interface MemoryStore {

  boolean put(String key, JsonNode value);

  Optional<JsonNode> get(String key);

  default JsonNode get(String key, JsonNode defaultValue) {
    return get(key).orElse(defaultValue);
  }

  boolean delete(String key);

  boolean clear();

  boolean exists(String key);

  List<String> listKeys();

  /**
   * Removes everything whose age has run out.
   *
   * @return number of entries (or sessions) removed
   */
  default int purgeExpired() {
    return 0;
  }
}
