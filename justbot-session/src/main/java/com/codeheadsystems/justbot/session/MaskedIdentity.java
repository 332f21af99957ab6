package com.codeheadsystems.justbot.session;

/**
 * Anything the protocol layer can reduce to a mask, such as a chat user or an inbound message.
 */
@FunctionalInterface
public interface MaskedIdentity {

  /**
   * The mask that identifies this participant, e.g. {@code nick!~user@host}.
   *
   * @return the mask string
   */
  String mask();
}
