package com.codeheadsystems.justbot.session.auth;

import com.codeheadsystems.justbot.session.MaskedIdentity;
import com.codeheadsystems.justbot.session.Session;
import com.codeheadsystems.justbot.session.SessionRegistry;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session checks for the plugin dispatch boundary.
 * <p>
 * A missing session is treated as unauthenticated. Failures surface as
 * {@link SecurityException}, which the dispatcher reports to the user as access denied.
 *
 * @param <U> the account type
 */
@Singleton
public class SessionGuard<U> {

  private static final Logger log = LoggerFactory.getLogger(SessionGuard.class);

  private final SessionRegistry<U> registry;
  private final ConfirmationVerifier verifier;

  /**
   * Instantiates a new Session guard.
   *
   * @param registry the session registry
   * @param verifier checks confirmation responses
   */
  @Inject
  public SessionGuard(final SessionRegistry<U> registry, final ConfirmationVerifier verifier) {
    this.registry = registry;
    this.verifier = verifier;
  }

  /**
   * The identity's session, if it may act as its user.
   *
   * @param identity the identity
   * @return the authed session, or empty
   */
  public Optional<Session<U>> authedSession(MaskedIdentity identity) {
    return registry.lookup(identity).filter(Session::authed);
  }

  /**
   * The identity's session, requiring it to be authed.
   *
   * @param identity the identity
   * @return the authed session
   * @throws SecurityException if there is no session, or it is inactive or unconfirmed
   */
  public Session<U> requireAuthed(MaskedIdentity identity) {
    return authedSession(identity).orElseThrow(() -> {
      log.debug("requireAuthed(mask={}): denied", identity.mask());
      return new SecurityException("Access denied");
    });
  }

  /**
   * Confirms the identity's session.
   *
   * @param identity the identity
   * @param response the challenge response
   * @return the result; {@link ConfirmationResult#KEY_INCORRECT} if the identity has no session
   */
  public ConfirmationResult confirm(MaskedIdentity identity, String response) {
    return registry.lookup(identity)
        .map(session -> session.confirm(response, verifier))
        .orElse(ConfirmationResult.KEY_INCORRECT);
  }
}
