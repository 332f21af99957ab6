package com.codeheadsystems.justbot.session.exceptions;

import com.codeheadsystems.justbot.session.auth.ConfirmationResult;

/**
 * Thrown when a session is confirmed when no confirmation was required, or with the wrong key.
 * Callers should treat it as a rejected authorization attempt.
 */
public class SessionConfirmationException extends RuntimeException {

  private final ConfirmationResult result;

  /**
   * Instantiates a new Session confirmation exception.
   *
   * @param result the failed confirmation result
   */
  public SessionConfirmationException(final ConfirmationResult result) {
    super("Confirmation key incorrect");
    this.result = result;
  }

  /**
   * The result that caused the failure.
   *
   * @return the confirmation result
   */
  public ConfirmationResult result() {
    return result;
  }
}
