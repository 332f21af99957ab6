package com.codeheadsystems.justbot.session;

import com.codeheadsystems.justbot.session.config.SessionConfig;
import com.codeheadsystems.justbot.session.exceptions.MaskConflictException;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps masks to their current {@link Session}.
 * <p>
 * One instance per process, shared by every component that needs sessions. At most one
 * session is registered per mask. All operations are linearizable: reads share a read lock,
 * every mutation takes the write lock. Expired sessions stay registered until stopped or
 * removed by {@link #removeExpired()}.
 *
 * @param <U> the account type, opaque to this library
 */
@Singleton
public class SessionRegistry<U> {

  private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

  private final SessionConfig config;
  private final Clock clock;
  private final Map<String, Session<U>> sessions = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  /**
   * Creates a registry with the default configuration and the system clock.
   */
  public SessionRegistry() {
    this(SessionConfig.DEFAULT, Clock.systemUTC());
  }

  /**
   * Creates a registry.
   *
   * @param config session timing
   * @param clock  time source for session expiration
   */
  @Inject
  public SessionRegistry(final SessionConfig config, final Clock clock) {
    this.config = config;
    this.clock = clock;
    log.info("SessionRegistry({})", config);
  }

  public SessionConfig config() {
    return config;
  }

  /**
   * Creates a session and registers it, replacing any session already held by the mask.
   *
   * @param user the account the session acts as
   * @param mask the mask of the identity
   * @return the new, not yet started, session
   */
  public Session<U> create(U user, String mask) {
    Objects.requireNonNull(mask, "mask");
    Session<U> session = new Session<>(this, clock, config.sessionDuration(), user, mask);
    lock.writeLock().lock();
    try {
      Session<U> previous = sessions.put(mask, session);
      log.debug("create(mask={}, replaced={})", mask, previous != null);
    } finally {
      lock.writeLock().unlock();
    }
    return session;
  }

  /**
   * Finds the session for a mask. Exact match only.
   *
   * @param mask the mask
   * @return the session, or empty if none is registered
   */
  public Optional<Session<U>> lookup(String mask) {
    Objects.requireNonNull(mask, "mask");
    lock.readLock().lock();
    try {
      return Optional.ofNullable(sessions.get(mask));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Finds the session for an identity.
   *
   * @param identity the identity, reduced to its mask
   * @return the session, or empty if none is registered
   */
  public Optional<Session<U>> lookup(MaskedIdentity identity) {
    Objects.requireNonNull(identity, "identity");
    return lookup(identity.mask());
  }

  /**
   * Moves the session registered under {@code oldMask} to {@code newMask}, for when the
   * protocol layer learns of a rename the session does not know about.
   *
   * @param oldMask the current mask
   * @param newMask the new mask
   * @return the moved session, or empty if nothing was registered under {@code oldMask}
   * @throws MaskConflictException if a different session holds {@code newMask}
   */
  public Optional<Session<U>> migrate(String oldMask, String newMask) {
    Objects.requireNonNull(oldMask, "oldMask");
    Objects.requireNonNull(newMask, "newMask");
    lock.writeLock().lock();
    try {
      Session<U> session = sessions.get(oldMask);
      if (session == null) {
        log.debug("migrate({} -> {}): no session", oldMask, newMask);
        return Optional.empty();
      }
      move(session, oldMask, newMask);
      return Optional.of(session);
    } finally {
      lock.writeLock().unlock();
    }
  }

  void rename(Session<U> session, String newMask) {
    Objects.requireNonNull(newMask, "newMask");
    lock.writeLock().lock();
    try {
      String oldMask = session.mask();
      if (sessions.get(oldMask) != session) {
        throw new IllegalStateException("Session is not registered: " + oldMask);
      }
      move(session, oldMask, newMask);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void move(Session<U> session, String oldMask, String newMask) {
    if (oldMask.equals(newMask)) {
      return;
    }
    Session<U> occupant = sessions.get(newMask);
    if (occupant != null && occupant != session) {
      log.warn("migrate({} -> {}): target mask already has a session", oldMask, newMask);
      throw new MaskConflictException(oldMask, newMask);
    }
    sessions.remove(oldMask);
    sessions.put(newMask, session);
    session.assignMask(newMask);
    log.debug("migrate({} -> {})", oldMask, newMask);
  }

  boolean stop(Session<U> session) {
    lock.writeLock().lock();
    try {
      // mask is only stable while the write lock is held
      String mask = session.mask();
      boolean removed = sessions.remove(mask, session);
      log.debug("stop(mask={}, removed={})", mask, removed);
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Removes every session that was started and has since expired. Sessions that were never
   * started are kept.
   *
   * @return the number of sessions removed
   */
  public int removeExpired() {
    lock.writeLock().lock();
    try {
      int before = sessions.size();
      sessions.values().removeIf(Session::expired);
      int removed = before - sessions.size();
      if (removed > 0) {
        log.info("Removed {} expired session(s)", removed);
      }
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Snapshot of all registered sessions, for administration by the host.
   *
   * @return an unmodifiable copy of the mask to session mapping
   */
  public Map<String, Session<U>> all() {
    lock.readLock().lock();
    try {
      return Map.copyOf(sessions);
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return sessions.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
