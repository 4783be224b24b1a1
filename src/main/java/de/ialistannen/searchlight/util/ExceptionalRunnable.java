package de.ialistannen.searchlight.util;

@FunctionalInterface
public interface ExceptionalRunnable {

  void run() throws Exception;
}
