package com.codeheadsystems.justbot.session;

import com.codeheadsystems.justbot.session.auth.ConfirmationResult;
import com.codeheadsystems.justbot.session.auth.ConfirmationVerifier;
import com.codeheadsystems.justbot.session.storage.SessionStorage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A time-boxed authorization context bound to one mask and one user.
 * <p>
 * Created through {@link SessionRegistry#create(Object, String)}. A new session is inactive
 * until {@link #start()} is called, and acts as its user only once it is both active and
 * confirmed.
 *
 * @param <U> the account type, opaque to this library
 */
public class Session<U> {

  private static final Logger log = LoggerFactory.getLogger(Session.class);

  private final SessionRegistry<U> registry;
  private final Clock clock;
  private final Duration duration;
  private final U user;
  private final SessionStorage storage = new SessionStorage();

  private volatile String mask;
  private volatile Instant expiration;
  private volatile boolean confirmed;

  Session(SessionRegistry<U> registry, Clock clock, Duration duration, U user, String mask) {
    this.registry = registry;
    this.clock = clock;
    this.duration = duration;
    this.user = user;
    this.mask = mask;
  }

  public U user() {
    return user;
  }

  public String mask() {
    return mask;
  }

  /**
   * Plugin data for this session. Plugins should only use it for users that are {@link #authed()}.
   *
   * @return the session storage
   */
  public SessionStorage storage() {
    return storage;
  }

  /**
   * When the session stops being active.
   *
   * @return the expiration, or empty if the session was never started
   */
  public Optional<Instant> expiration() {
    return Optional.ofNullable(expiration);
  }

  /**
   * Starts the session, or restarts it from now if already started.
   */
  public void start() {
    expiration = clock.instant().plus(duration);
    log.debug("start(mask={}, expiration={})", mask, expiration);
  }

  /**
   * Whether the session was started and has not yet expired.
   *
   * @return true if active
   */
  public boolean active() {
    Instant current = expiration;
    return current != null && clock.instant().isBefore(current);
  }

  /**
   * Whether the session may act as its user.
   *
   * @return true if active and confirmed
   */
  public boolean authed() {
    return active() && confirmed;
  }

  /**
   * Whether the session was started and has since run out.
   *
   * @return true if expired
   */
  public boolean expired() {
    Instant current = expiration;
    return current != null && !clock.instant().isBefore(current);
  }

  /**
   * Confirms the session with a challenge response.
   *
   * @param response the response the identity sent
   * @param verifier checks the response
   * @return {@link ConfirmationResult#NOT_REQUIRED} if already confirmed,
   *     {@link ConfirmationResult#KEY_INCORRECT} if the verifier rejected the response,
   *     {@link ConfirmationResult#CONFIRMED} otherwise
   */
  public synchronized ConfirmationResult confirm(String response, ConfirmationVerifier verifier) {
    Objects.requireNonNull(verifier, "verifier");
    if (confirmed) {
      log.debug("confirm(mask={}): not required", mask);
      return ConfirmationResult.NOT_REQUIRED;
    }
    if (!verifier.verify(this, response)) {
      log.debug("confirm(mask={}): key incorrect", mask);
      return ConfirmationResult.KEY_INCORRECT;
    }
    confirmed = true;
    log.info("confirm(mask={}): confirmed", mask);
    return ConfirmationResult.CONFIRMED;
  }

  /**
   * Moves the session to a new mask in its registry. Data kept elsewhere under the old mask
   * must be moved by its owner.
   *
   * @param newMask the new mask
   * @throws com.codeheadsystems.justbot.session.exceptions.MaskConflictException if another
   *     session holds the new mask
   * @throws IllegalStateException if this session is no longer registered
   */
  public void setMask(String newMask) {
    registry.rename(this, newMask);
  }

  /**
   * Ends the session by removing it from its registry.
   *
   * @return true if the session was still registered
   */
  public boolean stop() {
    return registry.stop(this);
  }

  // Called by the registry while it holds its write lock.
  void assignMask(String newMask) {
    this.mask = newMask;
  }

  @Override
  public String toString() {
    return "Session{mask=" + mask + ", expiration=" + expiration + ", confirmed=" + confirmed + "}";
  }
}
