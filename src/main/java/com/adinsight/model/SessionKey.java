package com.adinsight.model;

import java.util.Optional;

/**
 * Composite session key of the form {@code <session-id>:<event-id>}.
 *
 * <p>Only the first delimiter splits, so event ids may themselves contain ':'.
 */
public record SessionKey(String sessionId, String eventId) {

  public static final char DELIMITER = ':';

  public static Optional<SessionKey> parse(String key) {
    if (key == null) {
      return Optional.empty();
    }
    int idx = key.indexOf(DELIMITER);
    if (idx <= 0) {
      return Optional.empty();
    }
    return Optional.of(new SessionKey(key.substring(0, idx), key.substring(idx + 1)));
  }

  public String format() {
    return sessionId + DELIMITER + eventId;
  }
}
