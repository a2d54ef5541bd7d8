package com.adinsight.memory;

import com.adinsight.model.SessionEvent;
import com.adinsight.model.SessionKey;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered events grouped by session, addressed as {@code <session-id>:<event-id>}.
 *
 * <p>Event ids are not unique within a session. Appending a duplicate id keeps both
 * events, and {@link #get} and {@link #delete} act on the first one in insertion order.
 *
 * <p>A session expires {@code sessionTtl} after it was created, no matter how recently it
 * was used. Expired sessions are dropped when touched or on {@link #purgeExpired()}.
 */
public class SessionMemoryStore implements MemoryStore {

  private static final Logger log = LoggerFactory.getLogger(SessionMemoryStore.class);

  private final Map<String, Session> sessions = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  private final int maxSessions;
  private final Duration sessionTtl;
  private final Clock clock;
  private final MemoryMetrics metrics;

  public SessionMemoryStore(int maxSessions, Duration sessionTtl, Clock clock, MemoryMetrics metrics) {
    if (maxSessions <= 0) {
      throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
    }
    this.maxSessions = maxSessions;
    this.sessionTtl = sessionTtl;
    this.clock = clock;
    this.metrics = metrics;
  }

  @Override
  public boolean put(String key, JsonNode value) {
    Optional<SessionKey> parsed = parse(key);
    if (parsed.isEmpty()) {
      return false;
    }
    SessionKey sessionKey = parsed.get();
    lock.lock();
    try {
      Instant now = clock.instant();
      Session session = liveSession(sessionKey.sessionId());
      if (session == null) {
        session = new Session(now);
        sessions.put(sessionKey.sessionId(), session);
        log.debug("Opened session={} tier=session", sessionKey.sessionId());
      }
      session.events.add(new SessionEvent(
          sessionKey.eventId(), now, value == null ? NullNode.getInstance() : value));
      session.lastAccessed = now;

      if (sessions.size() > maxSessions) {
        evictOldestSession();
      }
      log.debug("Stored event={} session={} tier=session", sessionKey.eventId(), sessionKey.sessionId());
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to store key={} tier=session", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<JsonNode> get(String key) {
    Optional<SessionKey> parsed = parse(key);
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    SessionKey sessionKey = parsed.get();
    lock.lock();
    try {
      Session session = liveSession(sessionKey.sessionId());
      if (session == null) {
        return Optional.empty();
      }
      for (SessionEvent event : session.events) {
        if (event.eventId().equals(sessionKey.eventId())) {
          session.lastAccessed = clock.instant();
          return Optional.of(event.payload());
        }
      }
      return Optional.empty();
    } catch (RuntimeException e) {
      log.error("Failed to retrieve key={} tier=session", key, e);
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the first event matching the key. Removing the last event of a session
   * removes the session too.
   */
  @Override
  public boolean delete(String key) {
    Optional<SessionKey> parsed = parse(key);
    if (parsed.isEmpty()) {
      return false;
    }
    SessionKey sessionKey = parsed.get();
    lock.lock();
    try {
      Session session = sessions.get(sessionKey.sessionId());
      if (session == null) {
        return false;
      }
      boolean removed = false;
      Iterator<SessionEvent> it = session.events.iterator();
      while (it.hasNext()) {
        if (it.next().eventId().equals(sessionKey.eventId())) {
          it.remove();
          removed = true;
          break;
        }
      }
      if (session.events.isEmpty()) {
        sessions.remove(sessionKey.sessionId());
        log.debug("Closed empty session={} tier=session", sessionKey.sessionId());
      }
      return removed;
    } catch (RuntimeException e) {
      log.error("Failed to delete key={} tier=session", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean clear() {
    lock.lock();
    try {
      sessions.clear();
      log.info("Cleared tier=session");
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to clear tier=session", e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean exists(String key) {
    Optional<SessionKey> parsed = parse(key);
    if (parsed.isEmpty()) {
      return false;
    }
    SessionKey sessionKey = parsed.get();
    lock.lock();
    try {
      Session session = liveSession(sessionKey.sessionId());
      return session != null && session.events.stream()
          .anyMatch(event -> event.eventId().equals(sessionKey.eventId()));
    } catch (RuntimeException e) {
      log.error("Failed to check key={} tier=session", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Keys of every event in every live session. Duplicate event ids yield duplicate keys.
   */
  @Override
  public List<String> listKeys() {
    lock.lock();
    try {
      purgeExpiredSessions();
      List<String> keys = new ArrayList<>();
      sessions.forEach((sessionId, session) -> {
        for (SessionEvent event : session.events) {
          keys.add(new SessionKey(sessionId, event.eventId()).format());
        }
      });
      return keys;
    } catch (RuntimeException e) {
      log.error("Failed to list keys tier=session", e);
      return List.of();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int purgeExpired() {
    lock.lock();
    try {
      return purgeExpiredSessions();
    } catch (RuntimeException e) {
      log.error("Failed to purge expired sessions tier=session", e);
      return 0;
    } finally {
      lock.unlock();
    }
  }

  /** Events of a live session in insertion order, or an empty list. */
  public List<SessionEvent> getSessionEvents(String sessionId) {
    lock.lock();
    try {
      Session session = liveSession(sessionId);
      return session == null ? List.of() : List.copyOf(session.events);
    } catch (RuntimeException e) {
      log.error("Failed to read events session={} tier=session", sessionId, e);
      return List.of();
    } finally {
      lock.unlock();
    }
  }

  public boolean deleteSession(String sessionId) {
    lock.lock();
    try {
      boolean removed = sessions.remove(sessionId) != null;
      if (removed) {
        log.debug("Deleted session={} tier=session", sessionId);
      }
      return removed;
    } catch (RuntimeException e) {
      log.error("Failed to delete session={} tier=session", sessionId, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  public int sessionCount() {
    lock.lock();
    try {
      return sessions.size();
    } finally {
      lock.unlock();
    }
  }

  private Optional<SessionKey> parse(String key) {
    Optional<SessionKey> parsed = SessionKey.parse(key);
    if (parsed.isEmpty()) {
      log.warn("Malformed session key={}, expected <session-id>:<event-id>", key);
    }
    return parsed;
  }

  /** Returns the session, dropping it first if it has expired. */
  private Session liveSession(String sessionId) {
    Session session = sessions.get(sessionId);
    if (session == null) {
      return null;
    }
    if (isExpired(session, clock.instant())) {
      sessions.remove(sessionId);
      metrics.expired(MemoryTier.SESSION, 1);
      log.debug("Expired session={} tier=session", sessionId);
      return null;
    }
    return session;
  }

  private int purgeExpiredSessions() {
    Instant now = clock.instant();
    int removed = 0;
    Iterator<Session> it = sessions.values().iterator();
    while (it.hasNext()) {
      if (isExpired(it.next(), now)) {
        it.remove();
        removed++;
      }
    }
    metrics.expired(MemoryTier.SESSION, removed);
    return removed;
  }

  private void evictOldestSession() {
    String oldest = null;
    Instant oldestAt = null;
    for (Map.Entry<String, Session> entry : sessions.entrySet()) {
      if (oldestAt == null || entry.getValue().createdAt.isBefore(oldestAt)) {
        oldest = entry.getKey();
        oldestAt = entry.getValue().createdAt;
      }
    }
    if (oldest != null) {
      sessions.remove(oldest);
      metrics.evicted(MemoryTier.SESSION, "oldest_session");
      log.debug("Evicted session={} tier=session reason=oldest_session", oldest);
    }
  }

  private boolean isExpired(Session session, Instant now) {
    return Duration.between(session.createdAt, now).compareTo(sessionTtl) > 0;
  }

  private static final class Session {
    private final Instant createdAt;
    private Instant lastAccessed;
    private final List<SessionEvent> events = new ArrayList<>();

    private Session(Instant createdAt) {
      this.createdAt = createdAt;
      this.lastAccessed = createdAt;
    }
  }
}
