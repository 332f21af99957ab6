package com.codeheadsystems.justbot.session.exceptions;

/**
 * Thrown when a session is moved onto a mask already held by a different session.
 */
public class MaskConflictException extends IllegalStateException {

  private final String oldMask;
  private final String newMask;

  /**
   * Instantiates a new Mask conflict exception.
   *
   * @param oldMask the mask being moved
   * @param newMask the occupied target mask
   */
  public MaskConflictException(final String oldMask, final String newMask) {
    super("Mask already has a session: " + newMask);
    this.oldMask = oldMask;
    this.newMask = newMask;
  }

  public String oldMask() {
    return oldMask;
  }

  public String newMask() {
    return newMask;
  }
}
