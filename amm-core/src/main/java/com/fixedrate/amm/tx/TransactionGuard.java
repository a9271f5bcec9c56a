package com.fixedrate.amm.tx;

import com.fixedrate.amm.error.ValidationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs mutating operations one at a time with all-or-nothing effects.
 * <p>
 * Callers on other threads wait for the lock; a nested call from the thread already inside a
 * transaction is rejected. When the body throws, every compensation it recorded runs in reverse order
 * and the original exception is rethrown.
 */
@Slf4j
public class TransactionGuard {

  private final String name;
  private final ReentrantLock lock = new ReentrantLock(true);

  public TransactionGuard(@NonNull String name) {
    this.name = name;
  }

  public <T> T execute(@NonNull String operation, @NonNull Transaction<T> body) {
    if (lock.isHeldByCurrentThread()) {
      throw new ValidationException(ValidationException.Reason.REENTRANT_CALL,
          name + "." + operation + " called from inside another " + name + " operation");
    }
    lock.lock();
    try {
      UndoLog undo = new UndoLog();
      try {
        return body.run(undo);
      } catch (RuntimeException e) {
        log.warn("{} {} rolled back ({} compensations): {}", name, operation, undo.size(), e.getMessage());
        undo.rollback(e);
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  public boolean isActive() {
    return lock.isHeldByCurrentThread();
  }

  @FunctionalInterface
  public interface Transaction<T> {
    T run(UndoLog undo);
  }
}
