package de.ialistannen.searchlight.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs side actions whose failure must never abort the caller. Failures are logged as warnings with the full
 * stacktrace, so they stay visible.
 */
public final class BestEffort {

  private static final Logger LOGGER = LoggerFactory.getLogger(BestEffort.class);

  private BestEffort() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Runs the action and logs any exception it throws.
   *
   * @param description what the action does, used in the log message
   * @param action the action to run
   * @return true if the action completed without an exception
   */
  public static boolean run(String description, ExceptionalRunnable action) {
    try {
      action.run();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while {}", description, e);
      return false;
    } catch (Exception e) {
      LOGGER.warn("Failed {}", description, e);
      return false;
    }
  }
}
