package io.recall.schedule;

/**
 * Blocking pause used between retry attempts. Tests substitute a recording
 * implementation so backoff can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
