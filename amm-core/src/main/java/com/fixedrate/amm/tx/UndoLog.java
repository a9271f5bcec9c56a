package com.fixedrate.amm.tx;

import lombok.NonNull;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating actions recorded while a transaction runs, replayed newest first on failure.
 */
public final class UndoLog {

  private final Deque<Compensation> entries = new ArrayDeque<>();

  UndoLog() {
  }

  public void record(@NonNull String description, @NonNull Runnable compensation) {
    entries.push(new Compensation(description, compensation));
  }

  int size() {
    return entries.size();
  }

  /**
   * Runs every compensation. Failures are attached to {@code cause} and do not stop the remaining ones.
   */
  void rollback(Throwable cause) {
    while (!entries.isEmpty()) {
      Compensation entry = entries.pop();
      try {
        entry.action().run();
      } catch (RuntimeException e) {
        cause.addSuppressed(new IllegalStateException("compensation failed: " + entry.description(), e));
      }
    }
  }

  private record Compensation(String description, Runnable action) {
  }
}
