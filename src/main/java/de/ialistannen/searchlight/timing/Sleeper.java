package de.ialistannen.searchlight.timing;

import java.time.Duration;

/**
 * Blocks the current thread. Exists so polling code can be driven by a fake clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
