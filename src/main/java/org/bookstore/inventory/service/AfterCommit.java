package org.bookstore.inventory.service;

import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/** Defers work until the current transaction commits. */
final class AfterCommit {

  private AfterCommit() {}

  /**
   * Run {@code action} after the active transaction commits, or right away when none is active.
   * Actions registered in the same transaction run in registration order, after any
   * transaction-aware cache eviction registered before them.
   *
   * @param action work to run
   */
  static void run(Runnable action) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      action.run();
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCommit() {
            action.run();
          }
        });
  }
}
