package com.fixedrate.amm.pool;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Applies the latest checkpoint on a fixed delay so matured positions leave the reserves even when
 * nobody trades.
 */
@RequiredArgsConstructor
@Slf4j
public class CheckpointKeeper {

  private final @NonNull PositionLedger ledger;

  @Scheduled(fixedDelayString = "${amm.pool.checkpoint-keeper-interval-millis:60000}")
  public void tick() {
    if (!ledger.poolInfo().initialized()) {
      return;
    }
    try {
      Checkpoint checkpoint = ledger.checkpoint(ledger.latestCheckpoint());
      log.debug("checkpoint keeper pool={} vaultSharePrice={}", ledger.address(), checkpoint.vaultSharePrice());
    } catch (Exception e) {
      log.warn("checkpoint keeper tick failed pool={}: {}", ledger.address(), e.toString());
    }
  }
}
