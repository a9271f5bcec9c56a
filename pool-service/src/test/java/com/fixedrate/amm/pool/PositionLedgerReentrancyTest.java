package com.fixedrate.amm.pool;

import com.fixedrate.amm.config.PoolConfig;
import com.fixedrate.amm.error.ValidationException;
import com.fixedrate.amm.pool.port.DepositResult;
import com.fixedrate.amm.pool.port.YieldSource;
import com.fixedrate.amm.pool.sim.InMemoryPositionTokenLedger;
import com.fixedrate.amm.pricing.Options;
import com.fixedrate.amm.pricing.PricingMath;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static com.fixedrate.amm.math.FixedPointMath.ONE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * A vault that calls back into the pool while a deposit is in flight.
 */
@ExtendWith(MockitoExtension.class)
class PositionLedgerReentrancyTest {

  private static final String POOL = "0x00000000000000000000000000000000000a4d01";
  private static final String ALICE = "0x00000000000000000000000000000000000a11ce";
  private static final String MALLORY = "0x000000000000000000000000000000000000bad1";
  private static final BigInteger FIVE_PERCENT = new BigInteger("50000000000000000");

  @Mock
  private YieldSource yieldSource;

  private PositionLedger ledger;

  @BeforeEach
  void setUp() {
    PoolConfig config = new PoolConfig(POOL, ONE, 365L * 86_400, 86_400L, PricingMath.calculateTimeStretch(FIVE_PERCENT),
        BigInteger.ONE, PoolConfig.Fees.none(), POOL);
    Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneId.of("UTC"));
    ledger = new PositionLedger(config, yieldSource, new InMemoryPositionTokenLedger(), clock, new SimpleMeterRegistry());
  }

  @Test
  void nestedCallFromTheVaultIsRejectedAndRolledBack() {
    BigInteger thousand = ONE.multiply(BigInteger.valueOf(1_000));
    when(yieldSource.vaultSharePrice()).thenReturn(ONE);
    when(yieldSource.depositBase(any(), any()))
        .thenReturn(new DepositResult(thousand, BigInteger.ZERO))
        .thenAnswer(invocation -> ledger.openLong(MALLORY, ONE, BigInteger.ZERO, BigInteger.ZERO, new Options(MALLORY, true)));

    ledger.initialize(ALICE, thousand, FIVE_PERCENT, new Options(ALICE, true));
    PoolInfo before = ledger.poolInfo();

    assertThatThrownBy(() -> ledger.openLong(MALLORY, ONE, BigInteger.ZERO, BigInteger.ZERO, new Options(MALLORY, true)))
        .isInstanceOf(ValidationException.class)
        .satisfies(e -> assertThat(((ValidationException) e).getReason())
            .isEqualTo(ValidationException.Reason.REENTRANT_CALL));

    assertThat(ledger.poolInfo()).isEqualTo(before);
    verify(yieldSource, never()).withdrawBase(any(), any());
  }
}
