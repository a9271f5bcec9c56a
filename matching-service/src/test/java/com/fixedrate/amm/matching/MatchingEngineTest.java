package com.fixedrate.amm.matching;

import com.fixedrate.amm.asset.AssetId;
import com.fixedrate.amm.config.PoolConfig;
import com.fixedrate.amm.error.AuthorizationException;
import com.fixedrate.amm.error.SlippageException;
import com.fixedrate.amm.error.ValidationException;
import com.fixedrate.amm.matching.MatchResult.Settlement;
import com.fixedrate.amm.matching.config.MatchingConfig;
import com.fixedrate.amm.matching.signature.EcdsaSignatureVerifier;
import com.fixedrate.amm.pool.PositionLedger;
import com.fixedrate.amm.pool.sim.InMemoryPositionTokenLedger;
import com.fixedrate.amm.pool.sim.SimulatedYieldSource;
import com.fixedrate.amm.pricing.Options;
import com.fixedrate.amm.pricing.PricingMath;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.fixedrate.amm.math.FixedPointMath.ONE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchingEngineTest {

  private static final String POOL = "0x00000000000000000000000000000000000a4d01";
  private static final String ENGINE = "0x00000000000000000000000000000000000a4d02";
  private static final String COLLECTOR = "0x00000000000000000000000000000000000fee01";
  private static final String LP = "0x00000000000000000000000000000000000001b0";
  private static final String SURPLUS = "0x0000000000000000000000000000000000005eed";

  private static final ECKeyPair ALICE_KEY = ECKeyPair.create(new BigInteger("a11ce", 16));
  private static final ECKeyPair BOB_KEY = ECKeyPair.create(new BigInteger("b0b", 16));
  private static final ECKeyPair CAROL_KEY = ECKeyPair.create(new BigInteger("ca401", 16));
  private static final String ALICE = Credentials.create(ALICE_KEY).getAddress();
  private static final String BOB = Credentials.create(BOB_KEY).getAddress();
  private static final String CAROL = Credentials.create(CAROL_KEY).getAddress();

  private static final long DAY = 86_400L;
  private static final long YEAR = 365 * DAY;
  private static final long START = 20_000 * DAY + 3_600;
  private static final long MATURITY = START - 3_600 + YEAR;
  private static final BigInteger FIVE_PERCENT = new BigInteger("50000000000000000");

  private SimpleMeterRegistry meterRegistry;
  private SimulatedYieldSource vault;
  private PositionLedger ledger;
  private OrderHasher hasher;
  private MatchingEngine engine;
  private long salt;

  private static BigInteger e18(long units) {
    return BigInteger.valueOf(units).multiply(ONE);
  }

  private static BigInteger milli(long units) {
    return BigInteger.valueOf(units).multiply(BigInteger.TEN.pow(15));
  }

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.ofEpochSecond(START), ZoneOffset.UTC);
    meterRegistry = new SimpleMeterRegistry();
    vault = SimulatedYieldSource.create(POOL);
    PoolConfig poolConfig = new PoolConfig(POOL, ONE, YEAR, DAY, PricingMath.calculateTimeStretch(FIVE_PERCENT),
        milli(1), new PoolConfig.Fees(e18(1).divide(BigInteger.valueOf(100)), new BigInteger("500000000000000"),
        new BigInteger("150000000000000000")), COLLECTOR);
    ledger = new PositionLedger(poolConfig, vault, new InMemoryPositionTokenLedger(), clock, meterRegistry);
    hasher = new OrderHasher("Fixed Rate Matching Engine", "1", 1L, ENGINE);
    engine = new MatchingEngine(new MatchingConfig(ENGINE, ENGINE, "Fixed Rate Matching Engine", "1", 1L), ledger,
        vault.getBaseToken(), vault.getVaultShares(), hasher, new EcdsaSignatureVerifier(), clock, meterRegistry);

    for (String account : List.of(LP, ALICE, BOB, CAROL)) {
      vault.getBaseToken().mint(account, e18(1_000));
    }
    ledger.initialize(LP, e18(1_000), FIVE_PERCENT, new Options(LP, true));
  }

  private OrderIntent.OrderIntentBuilder order(String trader, OrderType type, BigInteger fund, BigInteger bond) {
    boolean close = !type.isOpen();
    return OrderIntent.builder()
        .trader(trader)
        .counterparty(Options.ZERO_ADDRESS)
        .pool(POOL)
        .fundAmount(fund)
        .bondAmount(bond)
        .minVaultSharePrice(BigInteger.ZERO)
        .options(new Options(trader, true))
        .orderType(type)
        .minMaturityTime(close ? MATURITY : 0L)
        .maxMaturityTime(close ? MATURITY : MATURITY + YEAR)
        .expiry(START + DAY)
        .salt(BigInteger.valueOf(++salt));
  }

  private OrderIntent signed(OrderIntent.OrderIntentBuilder builder, ECKeyPair key) {
    OrderIntent order = builder.build();
    Sign.SignatureData data = Sign.signMessage(hasher.digest(order), key, false);
    byte[] raw = new byte[65];
    System.arraycopy(data.getR(), 0, raw, 0, 32);
    System.arraycopy(data.getS(), 0, raw, 32, 32);
    raw[64] = data.getV()[0];
    return order.withSignature(Numeric.toHexString(raw));
  }

  private BigInteger base(String account) {
    return vault.getBaseToken().balanceOf(account);
  }

  private MatchResult mintAliceLongBobShort() {
    OrderIntent longOrder = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10)), ALICE_KEY);
    OrderIntent shortOrder = signed(order(BOB, OrderType.OPEN_SHORT, e18(5), e18(10)), BOB_KEY);
    return engine.matchOrders(longOrder, shortOrder, SURPLUS);
  }

  private static void assertRejected(ThrowingCallable call, ValidationException.Reason reason) {
    assertThatThrownBy(call).isInstanceOfSatisfying(ValidationException.class,
        e -> assertThat(e.getReason()).isEqualTo(reason));
  }

  private static void assertRejected(ThrowingCallable call, AuthorizationException.Reason reason) {
    assertThatThrownBy(call).isInstanceOfSatisfying(AuthorizationException.class,
        e -> assertThat(e.getReason()).isEqualTo(reason));
  }

  @Test
  void shouldMintPairFromOpposingOpenOrders() {
    // When
    MatchResult result = mintAliceLongBobShort();

    // Then
    assertThat(result.settlement()).isEqualTo(Settlement.MINT);
    assertThat(result.maturityTime()).isEqualTo(MATURITY);
    assertThat(result.bondAmount()).isEqualTo(e18(10));
    assertThat(result.order1Funds()).isEqualTo(e18(6));
    assertThat(result.order2Funds()).isEqualTo(e18(5));
    // 11 funded, 10 + 0.005 flat fee + 2 * 0.15 * 0.005 governance spent
    assertThat(result.surplus()).isEqualTo(new BigInteger("993500000000000000"));

    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), ALICE)).isEqualTo(e18(10));
    assertThat(ledger.balanceOf(AssetId.shorts(MATURITY), BOB)).isEqualTo(e18(10));
    assertThat(base(ALICE)).isEqualTo(e18(994));
    assertThat(base(BOB)).isEqualTo(e18(995));
    assertThat(base(SURPLUS)).isEqualTo(result.surplus());
    assertThat(base(ENGINE)).isZero();
    assertThat(engine.orderAmountsUsed(result.order1Hash())).isEqualTo(new OrderAmounts(e18(10), e18(6)));
    assertThat(meterRegistry.get("amm.matching.matches").tag("settlement", "mint").counter().count()).isEqualTo(1.0);
  }

  @Test
  void shouldFillOrderAcrossPartialMatchesUpToItsSignedAmounts() {
    // Given
    OrderIntent maker = signed(order(ALICE, OrderType.OPEN_LONG, e18(30), e18(50)), ALICE_KEY);
    OrderIntent first = signed(order(BOB, OrderType.OPEN_SHORT, e18(10), e18(20)), BOB_KEY);
    OrderIntent second = signed(order(CAROL, OrderType.OPEN_SHORT, e18(15), e18(30)), CAROL_KEY);
    OrderIntent third = signed(order(BOB, OrderType.OPEN_SHORT, e18(5), e18(10)), BOB_KEY);

    // When
    MatchResult firstFill = engine.matchOrders(maker, first, SURPLUS);
    MatchResult secondFill = engine.matchOrders(maker, second, SURPLUS);

    // Then
    assertThat(firstFill.bondAmount()).isEqualTo(e18(20));
    assertThat(firstFill.order1Funds()).isEqualTo(e18(12));
    assertThat(secondFill.bondAmount()).isEqualTo(e18(30));
    assertThat(secondFill.order1Funds()).isEqualTo(e18(18));
    assertThat(engine.orderAmountsUsed(engine.hashOrderIntent(maker))).isEqualTo(new OrderAmounts(e18(50), e18(30)));
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), ALICE)).isEqualTo(e18(50));
    assertThat(base(ALICE)).isEqualTo(e18(970));

    assertRejected(() -> engine.matchOrders(maker, third, SURPLUS), AuthorizationException.Reason.ALREADY_FULLY_EXECUTED);
  }

  @Test
  void shouldRoundPaymentsDownAcrossPartialFills() {
    // Given: 10 funds over 3 bonds do not split evenly
    OrderIntent maker = signed(order(ALICE, OrderType.OPEN_LONG, e18(10), e18(3)), ALICE_KEY);
    OrderIntent first = signed(order(BOB, OrderType.OPEN_SHORT, e18(1), e18(1)), BOB_KEY);
    OrderIntent second = signed(order(CAROL, OrderType.OPEN_SHORT, e18(2), e18(2)), CAROL_KEY);

    // When
    MatchResult firstFill = engine.matchOrders(maker, first, SURPLUS);
    MatchResult secondFill = engine.matchOrders(maker, second, SURPLUS);

    // Then
    assertThat(firstFill.order1Funds()).isEqualTo(new BigInteger("3333333333333333333"));
    assertThat(firstFill.order1Funds().add(secondFill.order1Funds())).isEqualTo(e18(10));
    assertThat(engine.orderAmountsUsed(engine.hashOrderIntent(maker))).isEqualTo(new OrderAmounts(e18(3), e18(10)));
  }

  @Test
  void shouldRejectMintWhenOrdersDoNotCoverCostAndLeaveNothingBehind() {
    // Given
    OrderIntent longOrder = signed(order(ALICE, OrderType.OPEN_LONG, e18(5), e18(10)), ALICE_KEY);
    OrderIntent shortOrder = signed(order(BOB, OrderType.OPEN_SHORT, e18(5), e18(10)), BOB_KEY);

    // When / Then
    assertRejected(() -> engine.matchOrders(longOrder, shortOrder, SURPLUS),
        AuthorizationException.Reason.INSUFFICIENT_FUNDING);
    assertThat(base(ALICE)).isEqualTo(e18(1_000));
    assertThat(base(BOB)).isEqualTo(e18(1_000));
    assertThat(engine.orderAmountsUsed(engine.hashOrderIntent(longOrder))).isEqualTo(OrderAmounts.NONE);
    assertThat(ledger.poolInfo().longsOutstanding()).isZero();
    assertThat(meterRegistry.get("amm.matching.rejections").counter().count()).isEqualTo(1.0);
  }

  @Test
  void shouldBurnPairAndPayEachTraderTheirMinimum() {
    // Given
    mintAliceLongBobShort();
    OrderIntent closeLong = signed(order(ALICE, OrderType.CLOSE_LONG, e18(4), e18(10)), ALICE_KEY);
    OrderIntent closeShort = signed(order(BOB, OrderType.CLOSE_SHORT, e18(5), e18(10)), BOB_KEY);
    BigInteger surplusBefore = base(SURPLUS);

    // When
    MatchResult result = engine.matchOrders(closeLong, closeShort, SURPLUS);

    // Then
    assertThat(result.settlement()).isEqualTo(Settlement.BURN);
    assertThat(result.maturityTime()).isEqualTo(MATURITY);
    assertThat(result.surplus()).isEqualTo(e18(1));
    assertThat(base(ALICE)).isEqualTo(e18(998));
    assertThat(base(BOB)).isEqualTo(e18(1_000));
    assertThat(base(SURPLUS)).isEqualTo(surplusBefore.add(e18(1)));
    assertThat(base(ENGINE)).isZero();
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), ALICE)).isZero();
    assertThat(ledger.balanceOf(AssetId.shorts(MATURITY), BOB)).isZero();
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), ENGINE)).isZero();
    assertThat(ledger.poolInfo().longsOutstanding()).isZero();
    assertThat(ledger.poolInfo().shortsOutstanding()).isZero();
  }

  @Test
  void shouldReturnPositionsWhenBurnPaysLessThanBothMinimums() {
    // Given
    mintAliceLongBobShort();
    OrderIntent closeLong = signed(order(ALICE, OrderType.CLOSE_LONG, e18(6), e18(10)), ALICE_KEY);
    OrderIntent closeShort = signed(order(BOB, OrderType.CLOSE_SHORT, e18(5), e18(10)), BOB_KEY);

    // When / Then
    assertThatThrownBy(() -> engine.matchOrders(closeLong, closeShort, SURPLUS))
        .isInstanceOf(SlippageException.class);
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), ALICE)).isEqualTo(e18(10));
    assertThat(ledger.balanceOf(AssetId.shorts(MATURITY), BOB)).isEqualTo(e18(10));
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), ENGINE)).isZero();
    assertThat(engine.orderAmountsUsed(engine.hashOrderIntent(closeLong))).isEqualTo(OrderAmounts.NONE);
  }

  @Test
  void shouldTransferPositionFromClosingToOpeningTrader() {
    // Given
    mintAliceLongBobShort();
    OrderIntent buy = signed(order(CAROL, OrderType.OPEN_LONG, new BigInteger("9500000000000000000"), e18(10)), CAROL_KEY);
    OrderIntent sell = signed(order(ALICE, OrderType.CLOSE_LONG, e18(9), e18(10)), ALICE_KEY);
    BigInteger surplusBefore = base(SURPLUS);

    // When
    MatchResult result = engine.matchOrders(buy, sell, SURPLUS);

    // Then
    assertThat(result.settlement()).isEqualTo(Settlement.TRANSFER);
    assertThat(result.surplus()).isEqualTo(new BigInteger("500000000000000000"));
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), CAROL)).isEqualTo(e18(10));
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), ALICE)).isZero();
    assertThat(base(ALICE)).isEqualTo(e18(1_003));
    assertThat(base(CAROL)).isEqualTo(new BigInteger("990500000000000000000"));
    assertThat(base(SURPLUS)).isEqualTo(surplusBefore.add(result.surplus()));
    assertThat(ledger.poolInfo().longsOutstanding()).isEqualTo(e18(10));
  }

  @Test
  void shouldRejectTransferWhenBuyerPaysLessThanSellerAccepts() {
    // Given
    mintAliceLongBobShort();
    OrderIntent buy = signed(order(CAROL, OrderType.OPEN_LONG, e18(8), e18(10)), CAROL_KEY);
    OrderIntent sell = signed(order(ALICE, OrderType.CLOSE_LONG, e18(9), e18(10)), ALICE_KEY);

    // When / Then
    assertRejected(() -> engine.matchOrders(buy, sell, SURPLUS), AuthorizationException.Reason.INSUFFICIENT_FUNDING);
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), ALICE)).isEqualTo(e18(10));
    assertThat(base(CAROL)).isEqualTo(e18(1_000));
  }

  @Test
  void shouldLetOnlyTheSignerCancel() {
    // Given
    OrderIntent longOrder = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10)), ALICE_KEY);
    OrderIntent shortOrder = signed(order(BOB, OrderType.OPEN_SHORT, e18(5), e18(10)), BOB_KEY);
    String hash = engine.hashOrderIntent(longOrder);

    // When / Then
    assertRejected(() -> engine.cancelOrders(BOB, List.of(longOrder)), AuthorizationException.Reason.UNAUTHORIZED_CALLER);
    assertThat(engine.isCancelled(hash)).isFalse();

    assertThat(engine.cancelOrders(ALICE, List.of(longOrder))).containsExactly(hash);
    assertThat(engine.isCancelled(hash)).isTrue();
    assertThat(engine.cancelOrders(ALICE, List.of(longOrder))).isEmpty();
    assertThat(meterRegistry.get("amm.matching.cancellations").counter().count()).isEqualTo(1.0);

    assertRejected(() -> engine.matchOrders(longOrder, shortOrder, SURPLUS), AuthorizationException.Reason.CANCELLED);
  }

  @Test
  void shouldRejectExpiredOrders() {
    OrderIntent longOrder = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10)).expiry(START - 1), ALICE_KEY);
    OrderIntent shortOrder = signed(order(BOB, OrderType.OPEN_SHORT, e18(5), e18(10)), BOB_KEY);

    assertRejected(() -> engine.matchOrders(longOrder, shortOrder, SURPLUS), AuthorizationException.Reason.EXPIRED);
  }

  @Test
  void shouldRejectOrdersNotSignedByTheirTrader() {
    OrderIntent shortOrder = signed(order(BOB, OrderType.OPEN_SHORT, e18(5), e18(10)), BOB_KEY);
    OrderIntent wrongKey = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10)), CAROL_KEY);
    OrderIntent tampered = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10)), ALICE_KEY)
        .toBuilder().fundAmount(e18(7)).build();

    assertRejected(() -> engine.matchOrders(wrongKey, shortOrder, SURPLUS), AuthorizationException.Reason.INVALID_SIGNATURE);
    assertRejected(() -> engine.matchOrders(tampered, shortOrder, SURPLUS), AuthorizationException.Reason.INVALID_SIGNATURE);
  }

  @Test
  void shouldRejectMismatchedOrders() {
    OrderIntent shortOrder = signed(order(BOB, OrderType.OPEN_SHORT, e18(5), e18(10)), BOB_KEY);
    OrderIntent onlyCarol = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10)).counterparty(CAROL), ALICE_KEY);
    OrderIntent inShares = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10))
        .options(new Options(ALICE, false)), ALICE_KEY);
    OrderIntent otherPool = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10))
        .pool("0x000000000000000000000000000000000000dead"), ALICE_KEY);
    OrderIntent tooEarly = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10))
        .maxMaturityTime(MATURITY - DAY), ALICE_KEY);

    assertRejected(() -> engine.matchOrders(onlyCarol, shortOrder, SURPLUS), ValidationException.Reason.COUNTERPARTY_MISMATCH);
    assertRejected(() -> engine.matchOrders(inShares, shortOrder, SURPLUS), ValidationException.Reason.SETTLEMENT_ASSET_MISMATCH);
    assertRejected(() -> engine.matchOrders(otherPool, shortOrder, SURPLUS), ValidationException.Reason.POOL_MISMATCH);
    assertRejected(() -> engine.matchOrders(tooEarly, shortOrder, SURPLUS), ValidationException.Reason.INVALID_MATURITY_TIME);
    assertRejected(() -> engine.matchOrders(onlyCarol, shortOrder, Options.ZERO_ADDRESS), ValidationException.Reason.INVALID_DESTINATION);
  }

  @Test
  void shouldRejectCloseOrdersSpanningSeveralMaturities() {
    mintAliceLongBobShort();
    OrderIntent closeLong = signed(order(ALICE, OrderType.CLOSE_LONG, e18(4), e18(10))
        .minMaturityTime(MATURITY - DAY), ALICE_KEY);
    OrderIntent closeShort = signed(order(BOB, OrderType.CLOSE_SHORT, e18(5), e18(10)), BOB_KEY);

    assertRejected(() -> engine.matchOrders(closeLong, closeShort, SURPLUS), ValidationException.Reason.INVALID_MATURITY_TIME);
  }

  @Test
  void shouldRejectPairsWithNoSettlement() {
    OrderIntent openLong = signed(order(ALICE, OrderType.OPEN_LONG, e18(6), e18(10)), ALICE_KEY);
    OrderIntent otherOpenLong = signed(order(BOB, OrderType.OPEN_LONG, e18(6), e18(10)), BOB_KEY);
    OrderIntent closeShort = signed(order(BOB, OrderType.CLOSE_SHORT, e18(5), e18(10)), BOB_KEY);
    OrderIntent closeLong = signed(order(ALICE, OrderType.CLOSE_LONG, e18(4), e18(10)), ALICE_KEY);

    assertRejected(() -> engine.matchOrders(openLong, otherOpenLong, SURPLUS), ValidationException.Reason.INVALID_ORDER_COMBINATION);
    assertRejected(() -> engine.matchOrders(openLong, closeShort, SURPLUS), ValidationException.Reason.INVALID_ORDER_COMBINATION);
    assertRejected(() -> engine.matchOrders(closeShort, closeLong, SURPLUS), ValidationException.Reason.INVALID_ORDER_COMBINATION);
  }

  @Test
  void shouldFillMakerOrderWithCallerBuiltTakerOrder() {
    // Given
    OrderIntent maker = signed(order(BOB, OrderType.OPEN_SHORT, e18(5), e18(10)), BOB_KEY);
    OrderIntent taker = order(CAROL, OrderType.OPEN_LONG, e18(6), e18(10)).build();

    // When / Then
    assertRejected(() -> engine.fillOrder(maker, taker, ALICE), AuthorizationException.Reason.UNAUTHORIZED_CALLER);

    MatchResult result = engine.fillOrder(maker, taker, CAROL);

    assertThat(result.settlement()).isEqualTo(Settlement.MINT);
    assertThat(result.order1Hash()).isEqualTo(engine.hashOrderIntent(taker));
    assertThat(ledger.balanceOf(AssetId.longs(MATURITY), CAROL)).isEqualTo(e18(10));
    assertThat(ledger.balanceOf(AssetId.shorts(MATURITY), BOB)).isEqualTo(e18(10));
    assertThat(base(CAROL)).isEqualTo(e18(994).add(new BigInteger("993500000000000000")));
    assertThat(engine.orderAmountsUsed(engine.hashOrderIntent(maker))).isEqualTo(new OrderAmounts(e18(10), e18(5)));
    assertThat(engine.orderAmountsUsed(engine.hashOrderIntent(taker))).isEqualTo(OrderAmounts.NONE);
  }
}
