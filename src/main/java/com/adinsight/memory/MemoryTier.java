package com.adinsight.memory;

import java.util.Locale;
import java.util.Optional;

public enum MemoryTier {

  EPHEMERAL("ephemeral", "short_term"),
  PERSISTENT("persistent", "long_term"),
  SESSION("session", "episodic"),
  RELATIONAL("relational", "semantic");

  private final String id;
  private final String alias;

  MemoryTier(String id, String alias) {
    this.id = id;
    this.alias = alias;
  }

  public String id() {
    return id;
  }

  public String alias() {
    return alias;
  }

  /**
   * Resolves a tier by its id or legacy alias. Case and '-' vs '_' are ignored.
   */
  public static Optional<MemoryTier> fromName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (MemoryTier tier : values()) {
      if (tier.id.equals(normalized) || tier.alias.equals(normalized)) {
        return Optional.of(tier);
      }
    }
    return Optional.empty();
  }
}
