package com.codeheadsystems.justbot.session.auth;

import com.codeheadsystems.justbot.session.Session;

/**
 * Checks a confirmation response for a session. Supplied by the host, which owns how
 * challenges are issued and compared.
 */
@FunctionalInterface
public interface ConfirmationVerifier {

  /**
   * Verifies the response.
   *
   * @param session  the session being confirmed
   * @param response the response the identity sent
   * @return true if the response is correct
   */
  boolean verify(Session<?> session, String response);
}
