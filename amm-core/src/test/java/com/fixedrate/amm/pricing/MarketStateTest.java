package com.fixedrate.amm.pricing;

import com.fixedrate.amm.config.PoolConfig;
import com.fixedrate.amm.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.fixedrate.amm.math.FixedPointMath.ONE;
import static com.fixedrate.amm.math.FixedPointMath.UINT128_MAX;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarketStateTest {

  private static final long DAY = 86_400L;
  private static final long YEAR = 365 * DAY;
  private static final String POOL = "0x00000000000000000000000000000000000a4d01";
  private static final String COLLECTOR = "0x00000000000000000000000000000000000fee01";
  private static final BigInteger TIME_STRETCH = new BigInteger("44463125629060298");
  // 1000 shares seeded at 5% with 1000 LP shares
  private static final BigInteger SHARES = e18(1_000);
  private static final BigInteger BONDS = new BigInteger("1996118033880151421000");
  private static final PoolConfig.Fees FEES =
      new PoolConfig.Fees(pct(1), new BigInteger("500000000000000"), pct(15));

  private static BigInteger e18(long units) {
    return BigInteger.valueOf(units).multiply(ONE);
  }

  private static BigInteger pct(long percent) {
    return ONE.multiply(BigInteger.valueOf(percent)).divide(BigInteger.valueOf(100));
  }

  private static MarketState market(PoolConfig.Fees fees, BigInteger longExposure, BigInteger checkpointExposure) {
    PoolConfig config = new PoolConfig(POOL, ONE, YEAR, DAY, TIME_STRETCH, new BigInteger("1000000000000000"), fees,
        COLLECTOR);
    return new MarketState(SHARES, BONDS, SHARES, ONE, ONE, longExposure, checkpointExposure, config);
  }

  private static MarketState seeded() {
    return market(FEES, BigInteger.ZERO, BigInteger.ZERO);
  }

  @Test
  void maxSpotPriceLeavesRoomForFees() {
    assertThat(seeded().maxSpotPrice()).isEqualTo(new BigInteger("999000749375499594"));
    assertThat(market(PoolConfig.Fees.none(), BigInteger.ZERO, BigInteger.ZERO).maxSpotPrice()).isEqualTo(ONE);
  }

  @Test
  void openLongQuoteChargesTheCurveFeeInBonds() {
    TradeQuote quote = seeded().openLong(e18(10));

    assertThat(quote.bonds()).isEqualTo(new BigInteger("10491855194053387825"));
    assertThat(quote.curveFee()).isEqualTo(new BigInteger("5000000000000000"));
    assertThat(quote.shareReserves()).isEqualTo(SHARES.add(e18(10)).subtract(quote.governanceFee()));
    assertThat(quote.bondReserves()).isEqualTo(BONDS.subtract(quote.bonds()));
    assertThat(quote.spotPrice()).isGreaterThan(seeded().spotPrice());
    assertThat(quote.solvency()).isEqualTo(quote.shareReserves().subtract(quote.bonds()));
  }

  @Test
  void maxLongStopsAtTheMaxSpotPrice() {
    MarketState market = seeded();
    BigInteger maxLong = market.maxLong(UINT128_MAX);

    assertThat(maxLong).isEqualTo(new BigInteger("964373651046026038133"));
    assertThat(market.openLong(maxLong).spotPrice()).isLessThanOrEqualTo(market.maxSpotPrice());
    assertThat(market.openLong(maxLong.add(BigInteger.ONE)).spotPrice()).isGreaterThan(market.maxSpotPrice());
    assertThat(market.maxLong(e18(10))).isEqualTo(e18(10));
    assertThat(market.maxLong(BigInteger.ZERO)).isZero();
  }

  @Test
  void shortIntoTheSameMaturityNetsAgainstItsLongs() {
    TradeQuote netted = market(FEES, e18(100), e18(100)).openShort(e18(40));
    TradeQuote elsewhere = market(FEES, e18(100), BigInteger.ZERO).openShort(e18(40));

    assertThat(netted.solvency()).isEqualTo(netted.shareReserves().subtract(e18(60)));
    assertThat(elsewhere.solvency()).isEqualTo(elsewhere.shareReserves().subtract(e18(100)));
  }

  @Test
  void maxShortSpendsTheWholeDepositBudget() {
    MarketState market = seeded();
    BigInteger bonds = market.maxShort(e18(100), true);

    assertThat(market.shortDeposit(bonds, true)).isLessThanOrEqualTo(e18(100));
    assertThat(market.shortDeposit(bonds.add(BigInteger.ONE), true)).isGreaterThan(e18(100));
    assertThat(market.openShort(bonds).isSolvent()).isTrue();
  }

  @Test
  void targetedLongRejectsATargetAboveTheCurrentRate() {
    assertThatThrownBy(() -> seeded().targetedLong(pct(6), e18(1_000)))
        .isInstanceOfSatisfying(ValidationException.class,
            e -> assertThat(e.getReason()).isEqualTo(ValidationException.Reason.INVALID_APR));
  }

  @Test
  void targetedLongRejectsATargetNoAllowedLongReaches() {
    assertThatThrownBy(() -> seeded().targetedLong(BigInteger.ZERO, UINT128_MAX))
        .isInstanceOfSatisfying(ValidationException.class,
            e -> assertThat(e.getReason()).isEqualTo(ValidationException.Reason.INSUFFICIENT_LIQUIDITY));
  }

  @Test
  void rejectsNegativeExposure() {
    assertThatThrownBy(() -> market(FEES, BigInteger.ONE.negate(), BigInteger.ZERO))
        .isInstanceOf(ValidationException.class);
  }
}
