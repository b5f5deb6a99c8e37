package io.faultline;

/**
 * Hooks for tests that exercise the process-wide client.
 */
public final class FaultlineTestSupport {

  private FaultlineTestSupport() {
  }

  /**
   * Closes the current client without waiting and forgets it, returning {@link Faultline}
   * to its uninitialized state.
   */
  public static void reset() {
    Faultline.reset();
  }
}
