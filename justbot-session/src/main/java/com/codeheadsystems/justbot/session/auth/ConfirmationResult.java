package com.codeheadsystems.justbot.session.auth;

import com.codeheadsystems.justbot.session.exceptions.SessionConfirmationException;

/**
 * Outcome of {@code Session.confirm}.
 */
public enum ConfirmationResult {

  /** The response was accepted and the session is now confirmed. */
  CONFIRMED,

  /** The session was already confirmed. */
  NOT_REQUIRED,

  /** The verifier rejected the response. */
  KEY_INCORRECT;

  public boolean isSuccess() {
    return this == CONFIRMED;
  }

  /**
   * Converts a failed confirmation into an exception.
   *
   * @return this result, if successful
   * @throws SessionConfirmationException for {@link #NOT_REQUIRED} and {@link #KEY_INCORRECT}
   */
  public ConfirmationResult orThrow() {
    if (!isSuccess()) {
      throw new SessionConfirmationException(this);
    }
    return this;
  }
}
