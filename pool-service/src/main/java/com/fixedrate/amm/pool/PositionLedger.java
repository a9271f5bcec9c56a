package com.fixedrate.amm.pool;

import com.fixedrate.amm.asset.AssetId;
import com.fixedrate.amm.config.PoolConfig;
import com.fixedrate.amm.error.AmmException;
import com.fixedrate.amm.error.AuthorizationException;
import com.fixedrate.amm.error.InvalidCurveStateException;
import com.fixedrate.amm.error.SlippageException;
import com.fixedrate.amm.error.ValidationException;
import com.fixedrate.amm.pool.port.DepositResult;
import com.fixedrate.amm.pool.port.PositionTokenLedger;
import com.fixedrate.amm.pool.port.YieldSource;
import com.fixedrate.amm.pricing.MarketState;
import com.fixedrate.amm.pricing.Options;
import com.fixedrate.amm.pricing.PairOptions;
import com.fixedrate.amm.pricing.PricingMath;
import com.fixedrate.amm.pricing.TradeQuote;
import com.fixedrate.amm.pricing.TradeResult;
import com.fixedrate.amm.tx.TransactionGuard;
import com.fixedrate.amm.tx.UndoLog;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

import static com.fixedrate.amm.math.FixedPointMath.ONE;
import static com.fixedrate.amm.math.FixedPointMath.add;
import static com.fixedrate.amm.math.FixedPointMath.divDown;
import static com.fixedrate.amm.math.FixedPointMath.divUp;
import static com.fixedrate.amm.math.FixedPointMath.min;
import static com.fixedrate.amm.math.FixedPointMath.mulDivDown;
import static com.fixedrate.amm.math.FixedPointMath.mulDivUp;
import static com.fixedrate.amm.math.FixedPointMath.mulDown;
import static com.fixedrate.amm.math.FixedPointMath.mulUp;
import static com.fixedrate.amm.math.FixedPointMath.sub;

/**
 * A single fixed-rate pool: reserves, checkpoints, LP accounting and the long/short trade lifecycle.
 * <p>
 * Every mutating call runs inside the pool's {@link TransactionGuard}. The pool state is snapshotted
 * first and each deposit, mint, burn and transfer made through the ports records its compensation, so a
 * failing call leaves reserves, balances and checkpoints exactly as they were. Payouts to the trader are
 * always the last step.
 * <p>
 * Amounts tagged "shares" are vault shares; amounts passed in and out follow {@link Options#asBase()}.
 */
@Slf4j
public class PositionLedger {

  private enum TradeType {
    OPEN_LONG, CLOSE_LONG, OPEN_SHORT, CLOSE_SHORT, ADD_LIQUIDITY, REMOVE_LIQUIDITY, REDEEM_WITHDRAWAL, MINT, BURN
  }

  private final PoolConfig config;
  private final YieldSource yieldSource;
  private final PositionTokenLedger tokens;
  private final Clock clock;
  private final PoolState state = new PoolState();
  private final TransactionGuard guard;

  private final Map<TradeType, Counter> tradeCounters = new EnumMap<>(TradeType.class);
  private final Counter checkpointCounter;
  private final Counter rollbackCounter;

  public PositionLedger(
      @NonNull PoolConfig config,
      @NonNull YieldSource yieldSource,
      @NonNull PositionTokenLedger tokens,
      @NonNull Clock clock,
      @NonNull MeterRegistry meterRegistry
  ) {
    this.config = config;
    this.yieldSource = yieldSource;
    this.tokens = tokens;
    this.clock = clock;
    this.guard = new TransactionGuard("pool[" + config.poolAddress() + "]");

    for (TradeType type : TradeType.values()) {
      tradeCounters.put(type, Counter.builder("amm.pool.trades")
          .description("Pool operations completed")
          .tag("pool", config.poolAddress())
          .tag("type", type.name().toLowerCase(Locale.ROOT))
          .register(meterRegistry));
    }
    this.checkpointCounter = Counter.builder("amm.pool.checkpoints")
        .description("Checkpoints applied")
        .tag("pool", config.poolAddress())
        .register(meterRegistry);
    this.rollbackCounter = Counter.builder("amm.pool.rollbacks")
        .description("Pool operations rolled back after a failure")
        .tag("pool", config.poolAddress())
        .register(meterRegistry);
  }

  // ---------------------------------------------------------------------------------------------
  // Liquidity
  // ---------------------------------------------------------------------------------------------

  /**
   * Seeds the pool with {@code contribution} priced at {@code apr}. Mints one LP share per vault share
   * contributed.
   *
   * @return LP shares minted
   */
  public BigInteger initialize(@NonNull String provider, @NonNull BigInteger contribution, @NonNull BigInteger apr,
                               @NonNull Options options) {
    return transact("initialize", undo -> {
      if (state.isInitialized()) {
        throw new ValidationException(ValidationException.Reason.ALREADY_INITIALIZED, config.poolAddress());
      }
      requireMinimum(contribution);
      if (apr.signum() <= 0) {
        throw new ValidationException(ValidationException.Reason.INVALID_APR, "initial apr must be positive: " + apr);
      }
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latestCheckpoint(), c);

      BigInteger shares = deposit(provider, contribution, options.asBase(), undo);
      BigInteger bondReserves = PricingMath.calculateBondReserves(shares, shares, config.initialVaultSharePrice(),
          apr, config.positionDuration(), config.timeStretch());
      if (bondReserves.signum() == 0) {
        throw new ValidationException(ValidationException.Reason.INVALID_APR, "apr " + apr + " leaves no bond reserves");
      }
      state.setShareReserves(shares);
      state.setBondReserves(bondReserves);
      state.setLpTotalSupply(shares);
      state.markInitialized();
      mintPosition(AssetId.LP, options.destination(), shares, undo);

      log.info("pool initialized pool={} shares={} bondReserves={} apr={}", config.poolAddress(), shares, bondReserves, apr);
      return shares;
    });
  }

  /**
   * @return LP shares minted
   */
  public BigInteger addLiquidity(@NonNull String provider, @NonNull BigInteger contribution,
                                 @NonNull BigInteger minApr, @NonNull BigInteger maxApr, @NonNull Options options) {
    return transact("addLiquidity", undo -> {
      requireInitialized();
      requireMinimum(contribution);
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latestCheckpoint(), c);

      BigInteger apr = PricingMath.calculateRateFromPrice(currentSpotPrice(), config.positionDuration());
      if (apr.compareTo(minApr) < 0) {
        throw new SlippageException("pool apr below minimum", apr, minApr);
      }
      if (apr.compareTo(maxApr) > 0) {
        throw new SlippageException("pool apr above maximum", apr, maxApr);
      }

      BigInteger shares = deposit(provider, contribution, options.asBase(), undo);
      BigInteger lpShares = PricingMath.calculateLpSharesOutForSharesIn(shares, state.getShareReserves(),
          state.effectiveLpSupply(), state.getLongsOutstanding(), state.getShortsOutstanding(), c);
      if (lpShares.signum() == 0) {
        throw new ValidationException(ValidationException.Reason.ZERO_AMOUNT, "contribution buys no LP shares");
      }
      updateLiquidity(shares, false);
      state.setLpTotalSupply(add(state.getLpTotalSupply(), lpShares));
      mintPosition(AssetId.LP, options.destination(), lpShares, undo);
      requireSolvent(c);

      tradeCounters.get(TradeType.ADD_LIQUIDITY).increment();
      log.debug("liquidity added provider={} shares={} lpShares={}", provider, shares, lpShares);
      return lpShares;
    });
  }

  /**
   * Burns {@code lpShares}. The idle part of their value is paid now; the part still backing open
   * positions is converted to withdrawal shares.
   */
  public LiquidityRemoval removeLiquidity(@NonNull String provider, @NonNull BigInteger lpShares,
                                          @NonNull BigInteger minOutput, @NonNull Options options) {
    return transact("removeLiquidity", undo -> {
      requireInitialized();
      requireMinimum(lpShares);
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latestCheckpoint(), c);
      burnPosition(AssetId.LP, provider, lpShares, undo);

      BigInteger totalSupply = state.effectiveLpSupply();
      BigInteger presentValue = presentValue(c);
      BigInteger payable = min(idle(c), presentValue);
      BigInteger shareProceeds = mulDivDown(payable, lpShares, totalSupply);
      BigInteger withdrawalShares = presentValue.signum() == 0
          ? BigInteger.ZERO
          : mulDivDown(lpShares, sub(presentValue, payable), presentValue);

      updateLiquidity(shareProceeds, true);
      state.setLpTotalSupply(sub(state.getLpTotalSupply(), lpShares));
      state.setWithdrawalSharesOutstanding(add(state.getWithdrawalSharesOutstanding(), withdrawalShares));
      if (withdrawalShares.signum() > 0) {
        mintPosition(AssetId.WITHDRAWAL_SHARE, options.destination(), withdrawalShares, undo);
      }
      requireSolvent(c);
      requireMinOutput(shareProceeds, minOutput, options);
      BigInteger proceeds = withdraw(shareProceeds, options);

      tradeCounters.get(TradeType.REMOVE_LIQUIDITY).increment();
      log.debug("liquidity removed provider={} lpShares={} proceeds={} withdrawalShares={}",
          provider, lpShares, proceeds, withdrawalShares);
      return new LiquidityRemoval(proceeds, withdrawalShares);
    });
  }

  /**
   * Redeems up to {@code withdrawalShares} against the ready pool. Redeems nothing while no shares are
   * ready.
   */
  public WithdrawalRedemption redeemWithdrawalShares(@NonNull String provider, @NonNull BigInteger withdrawalShares,
                                                     @NonNull BigInteger minOutputPerShare, @NonNull Options options) {
    return transact("redeemWithdrawalShares", undo -> {
      requireInitialized();
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latestCheckpoint(), c);
      distributeExcessIdle(c);

      BigInteger ready = state.getWithdrawalSharesReadyToWithdraw();
      BigInteger redeemed = min(withdrawalShares, ready);
      if (redeemed.signum() == 0) {
        return new WithdrawalRedemption(BigInteger.ZERO, BigInteger.ZERO);
      }
      BigInteger shareProceeds = mulDivDown(state.getWithdrawalSharesProceeds(), redeemed, ready);
      burnPosition(AssetId.WITHDRAWAL_SHARE, provider, redeemed, undo);
      state.setWithdrawalSharesReadyToWithdraw(sub(ready, redeemed));
      state.setWithdrawalSharesProceeds(sub(state.getWithdrawalSharesProceeds(), shareProceeds));
      state.setWithdrawalSharesOutstanding(sub(state.getWithdrawalSharesOutstanding(), redeemed));

      BigInteger perShare = divDown(toOutput(shareProceeds, options), redeemed);
      if (perShare.compareTo(minOutputPerShare) < 0) {
        throw new SlippageException("withdrawal proceeds per share below minimum", perShare, minOutputPerShare);
      }
      BigInteger proceeds = withdraw(shareProceeds, options);

      tradeCounters.get(TradeType.REDEEM_WITHDRAWAL).increment();
      log.debug("withdrawal shares redeemed provider={} shares={} proceeds={}", provider, redeemed, proceeds);
      return new WithdrawalRedemption(proceeds, redeemed);
    });
  }

  // ---------------------------------------------------------------------------------------------
  // Longs
  // ---------------------------------------------------------------------------------------------

  /**
   * Buys bonds maturing one position duration after the latest checkpoint.
   *
   * @param amount           base or shares paid in
   * @param minOutput        fewest bonds accepted
   * @param minVaultSharePrice lowest vault share price accepted
   */
  public OpenPosition openLong(@NonNull String trader, @NonNull BigInteger amount, @NonNull BigInteger minOutput,
                               @NonNull BigInteger minVaultSharePrice, @NonNull Options options) {
    return transact("openLong", undo -> {
      requireInitialized();
      requireMinimum(amount);
      long latest = latestCheckpoint();
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latest, c);
      requireVaultSharePrice(c, minVaultSharePrice);

      BigInteger shares = deposit(trader, amount, options.asBase(), undo);
      long maturity = latest + config.positionDuration();
      TradeQuote quote = market(latest, c).openLong(shares);
      BigInteger bondProceeds = quote.bonds();
      if (bondProceeds.compareTo(minOutput) < 0) {
        throw new SlippageException("long bond proceeds below minimum", bondProceeds, minOutput);
      }

      state.setShareReserves(quote.shareReserves());
      state.setBondReserves(quote.bondReserves());
      state.setLongsOutstanding(add(state.getLongsOutstanding(), bondProceeds));
      state.setGovernanceFeesAccrued(add(state.getGovernanceFeesAccrued(), quote.governanceFee()));
      recordLongSharePrice(latest, maturity, bondProceeds, c);
      mintPosition(AssetId.longs(maturity), options.destination(), bondProceeds, undo);
      requireNonNegativeRate();
      requireSolvent(c);

      tradeCounters.get(TradeType.OPEN_LONG).increment();
      log.debug("long opened trader={} maturity={} shares={} bonds={} fee={}", trader, maturity, shares, bondProceeds,
          quote.curveFee());
      return new OpenPosition(maturity, bondProceeds, amount);
    });
  }

  /**
   * Sells {@code bondAmount} longs back to the pool, or redeems them at face value once matured.
   *
   * @return base or shares paid out
   */
  public BigInteger closeLong(@NonNull String trader, long maturityTime, @NonNull BigInteger bondAmount,
                              @NonNull BigInteger minOutput, @NonNull Options options) {
    return transact("closeLong", undo -> {
      requireInitialized();
      requireMinimum(bondAmount);
      requireMaturity(maturityTime);
      long latest = latestCheckpoint();
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latest, c);
      boolean matured = maturityTime <= now();
      if (matured) {
        applyCheckpoint(maturityTime, c);
      }
      burnPosition(AssetId.longs(maturityTime), trader, bondAmount, undo);

      BigInteger openSharePrice = state.checkpoint(maturityTime - config.positionDuration()).longSharePrice();
      BigInteger shareProceeds;
      if (matured) {
        BigInteger closeSharePrice = state.checkpoint(maturityTime).vaultSharePrice();
        shareProceeds = divDown(bondAmount, closeSharePrice);
        shareProceeds = PricingMath.applyNegativeInterest(shareProceeds, openSharePrice, closeSharePrice);
      } else {
        BigInteger t = PricingMath.calculateNormalizedTimeRemaining(maturityTime, latest, config.positionDuration());
        BigInteger spotPrice = currentSpotPrice();
        TradeResult trade = PricingMath.calculateOutGivenIn(state.getShareReserves(), state.getBondReserves(),
            state.bondReserveAdjustment(), bondAmount, t, config.timeStretch(), c, config.initialVaultSharePrice(), false);
        BigInteger curveFee = PricingMath.calculateCloseCurveFee(bondAmount, spotPrice, t, c, config.fees().curve());
        BigInteger flatFee = PricingMath.calculateCloseFlatFee(bondAmount, t, c, config.fees().flat());
        BigInteger governanceCurve = PricingMath.calculateGovernanceFee(curveFee, config.fees().governance());
        BigInteger governanceFlat = PricingMath.calculateGovernanceFee(flatFee, config.fees().governance());

        updateLiquidity(sub(trade.flatShares(), sub(flatFee, governanceFlat)), true);
        state.setShareReserves(sub(state.getShareReserves(), sub(trade.curveShares(), sub(curveFee, governanceCurve))));
        state.setBondReserves(add(state.getBondReserves(), trade.curveBonds()));
        state.setLongsOutstanding(sub(state.getLongsOutstanding(), bondAmount));
        state.setGovernanceFeesAccrued(add(state.getGovernanceFeesAccrued(), add(governanceCurve, governanceFlat)));

        shareProceeds = sub(trade.amount(), add(curveFee, flatFee));
        shareProceeds = PricingMath.applyNegativeInterest(shareProceeds, openSharePrice, c);
      }
      distributeExcessIdle(c);
      requireSolvent(c);
      requireMinOutput(shareProceeds, minOutput, options);
      BigInteger proceeds = withdraw(shareProceeds, options);

      tradeCounters.get(TradeType.CLOSE_LONG).increment();
      log.debug("long closed trader={} maturity={} bonds={} proceeds={} matured={}",
          trader, maturityTime, bondAmount, proceeds, matured);
      return proceeds;
    });
  }

  // ---------------------------------------------------------------------------------------------
  // Shorts
  // ---------------------------------------------------------------------------------------------

  /**
   * Sells {@code bondAmount} bonds to the pool. The trader deposits the bonds' face value at the
   * checkpoint price less the curve proceeds.
   *
   * @param maxDeposit most base or shares the trader will deposit
   */
  public OpenPosition openShort(@NonNull String trader, @NonNull BigInteger bondAmount, @NonNull BigInteger maxDeposit,
                                @NonNull BigInteger minVaultSharePrice, @NonNull Options options) {
    return transact("openShort", undo -> {
      requireInitialized();
      requireMinimum(bondAmount);
      long latest = latestCheckpoint();
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latest, c);
      requireVaultSharePrice(c, minVaultSharePrice);

      long maturity = latest + config.positionDuration();
      TradeQuote quote = market(latest, c).openShort(bondAmount);
      BigInteger required = options.asBase() ? mulUp(quote.shares(), c) : quote.shares();
      if (required.compareTo(maxDeposit) > 0) {
        throw new SlippageException("short deposit above maximum", required, maxDeposit);
      }
      deposit(trader, required, options.asBase(), undo);

      state.setShareReserves(quote.shareReserves());
      state.setBondReserves(quote.bondReserves());
      state.setShortsOutstanding(add(state.getShortsOutstanding(), bondAmount));
      state.setGovernanceFeesAccrued(add(state.getGovernanceFeesAccrued(), quote.governanceFee()));
      mintPosition(AssetId.shorts(maturity), options.destination(), bondAmount, undo);
      requireSolvent(c);

      tradeCounters.get(TradeType.OPEN_SHORT).increment();
      log.debug("short opened trader={} maturity={} bonds={} deposit={} fee={}", trader, maturity, bondAmount, required,
          quote.curveFee());
      return new OpenPosition(maturity, bondAmount, required);
    });
  }

  /**
   * Buys {@code bondAmount} bonds back from the pool and pays the short its interest.
   *
   * @return base or shares paid out
   */
  public BigInteger closeShort(@NonNull String trader, long maturityTime, @NonNull BigInteger bondAmount,
                               @NonNull BigInteger minOutput, @NonNull Options options) {
    return transact("closeShort", undo -> {
      requireInitialized();
      requireMinimum(bondAmount);
      requireMaturity(maturityTime);
      long latest = latestCheckpoint();
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latest, c);
      boolean matured = maturityTime <= now();
      if (matured) {
        applyCheckpoint(maturityTime, c);
      }
      burnPosition(AssetId.shorts(maturityTime), trader, bondAmount, undo);
      BigInteger openSharePrice = openSharePrice(maturityTime);

      BigInteger shareProceeds;
      if (matured) {
        BigInteger closeSharePrice = state.checkpoint(maturityTime).vaultSharePrice();
        shareProceeds = PricingMath.calculateShortProceeds(bondAmount, divDown(bondAmount, closeSharePrice),
            openSharePrice, closeSharePrice, closeSharePrice);
      } else {
        BigInteger t = PricingMath.calculateNormalizedTimeRemaining(maturityTime, latest, config.positionDuration());
        BigInteger spotPrice = currentSpotPrice();
        TradeResult trade = PricingMath.calculateInGivenOut(state.getShareReserves(), state.getBondReserves(),
            state.bondReserveAdjustment(), bondAmount, t, config.timeStretch(), c, config.initialVaultSharePrice());
        BigInteger curveFee = PricingMath.calculateCloseCurveFee(bondAmount, spotPrice, t, c, config.fees().curve());
        BigInteger flatFee = PricingMath.calculateCloseFlatFee(bondAmount, t, c, config.fees().flat());
        BigInteger governanceCurve = PricingMath.calculateGovernanceFee(curveFee, config.fees().governance());
        BigInteger governanceFlat = PricingMath.calculateGovernanceFee(flatFee, config.fees().governance());

        updateLiquidity(sub(add(trade.flatShares(), flatFee), governanceFlat), false);
        state.setShareReserves(sub(add(state.getShareReserves(), add(trade.curveShares(), curveFee)), governanceCurve));
        state.setBondReserves(sub(state.getBondReserves(), trade.curveBonds()));
        state.setShortsOutstanding(sub(state.getShortsOutstanding(), bondAmount));
        state.setGovernanceFeesAccrued(add(state.getGovernanceFeesAccrued(), add(governanceCurve, governanceFlat)));

        BigInteger sharePayment = add(trade.amount(), add(curveFee, flatFee));
        shareProceeds = PricingMath.calculateShortProceeds(bondAmount, sharePayment, openSharePrice, c, c);
      }
      distributeExcessIdle(c);
      requireSolvent(c);
      requireMinOutput(shareProceeds, minOutput, options);
      BigInteger proceeds = withdraw(shareProceeds, options);

      tradeCounters.get(TradeType.CLOSE_SHORT).increment();
      log.debug("short closed trader={} maturity={} bonds={} proceeds={} matured={}",
          trader, maturityTime, bondAmount, proceeds, matured);
      return proceeds;
    });
  }

  // ---------------------------------------------------------------------------------------------
  // Pairs
  // ---------------------------------------------------------------------------------------------

  /**
   * Mints {@code bondAmount} longs and shorts of the same maturity against fully collateralized
   * backing, without trading on the curve.
   *
   * @param maxCost most base or shares the payer will deposit
   */
  public OpenPosition mint(@NonNull String payer, @NonNull BigInteger bondAmount, @NonNull BigInteger maxCost,
                           @NonNull BigInteger minVaultSharePrice, @NonNull PairOptions options) {
    return transact("mint", undo -> {
      requireInitialized();
      requireMinimum(bondAmount);
      long latest = latestCheckpoint();
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latest, c);
      requireVaultSharePrice(c, minVaultSharePrice);

      long maturity = latest + config.positionDuration();
      BigInteger openSharePrice = state.checkpoint(latest).vaultSharePrice();
      BigInteger costBase = PricingMath.calculateMintCost(bondAmount, c, openSharePrice,
          config.fees().flat(), config.fees().governance());
      BigInteger cost = options.asBase() ? costBase : divUp(costBase, c);
      if (cost.compareTo(maxCost) > 0) {
        throw new SlippageException("mint cost above maximum", cost, maxCost);
      }
      deposit(payer, cost, options.asBase(), undo);

      BigInteger flatFeeBase = mulUp(bondAmount, config.fees().flat());
      BigInteger governanceBase = mulDown(flatFeeBase, config.fees().governance()).shiftLeft(1);
      updateLiquidity(divDown(flatFeeBase, c), false);
      state.setGovernanceFeesAccrued(add(state.getGovernanceFeesAccrued(), divDown(governanceBase, c)));
      state.setLongsOutstanding(add(state.getLongsOutstanding(), bondAmount));
      state.setShortsOutstanding(add(state.getShortsOutstanding(), bondAmount));
      recordLongSharePrice(latest, maturity, bondAmount, c);
      mintPosition(AssetId.longs(maturity), options.longDestination(), bondAmount, undo);
      mintPosition(AssetId.shorts(maturity), options.shortDestination(), bondAmount, undo);
      requireSolvent(c);

      tradeCounters.get(TradeType.MINT).increment();
      log.debug("pair minted payer={} maturity={} bonds={} cost={}", payer, maturity, bondAmount, cost);
      return new OpenPosition(maturity, bondAmount, cost);
    });
  }

  /**
   * Burns {@code bondAmount} longs and shorts of one maturity held by {@code owner} and releases their
   * backing, less the flat fee on the unmatured part.
   *
   * @return base or shares paid out
   */
  public BigInteger burn(@NonNull String owner, long maturityTime, @NonNull BigInteger bondAmount,
                         @NonNull BigInteger minOutput, @NonNull Options options) {
    return transact("burn", undo -> {
      requireInitialized();
      requireMinimum(bondAmount);
      requireMaturity(maturityTime);
      long latest = latestCheckpoint();
      BigInteger c = yieldSource.vaultSharePrice();
      applyCheckpoint(latest, c);
      boolean matured = maturityTime <= now();
      if (matured) {
        applyCheckpoint(maturityTime, c);
      }
      burnPosition(AssetId.longs(maturityTime), owner, bondAmount, undo);
      burnPosition(AssetId.shorts(maturityTime), owner, bondAmount, undo);

      BigInteger openSharePrice = openSharePrice(maturityTime);
      BigInteger closeSharePrice = matured ? state.checkpoint(maturityTime).vaultSharePrice() : c;
      BigInteger shareProceeds = mulDivDown(bondAmount, closeSharePrice, mulDown(openSharePrice, c));
      if (!matured) {
        BigInteger t = PricingMath.calculateNormalizedTimeRemaining(maturityTime, latest, config.positionDuration());
        BigInteger flatFee = PricingMath.calculateCloseFlatFee(bondAmount, t, c, config.fees().flat());
        BigInteger governanceFee = PricingMath.calculateGovernanceFee(flatFee, config.fees().governance());
        shareProceeds = sub(shareProceeds, flatFee);
        state.setLongsOutstanding(sub(state.getLongsOutstanding(), bondAmount));
        state.setShortsOutstanding(sub(state.getShortsOutstanding(), bondAmount));
        updateLiquidity(sub(flatFee, governanceFee), false);
        state.setGovernanceFeesAccrued(add(state.getGovernanceFeesAccrued(), governanceFee));
      }
      distributeExcessIdle(c);
      requireSolvent(c);
      requireMinOutput(shareProceeds, minOutput, options);
      BigInteger proceeds = withdraw(shareProceeds, options);

      tradeCounters.get(TradeType.BURN).increment();
      log.debug("pair burned owner={} maturity={} bonds={} proceeds={}", owner, maturityTime, bondAmount, proceeds);
      return proceeds;
    });
  }

  /**
   * Moves a long or short position between accounts without touching reserves.
   */
  public void transferPosition(@NonNull AssetId id, @NonNull String from, @NonNull String to, @NonNull BigInteger amount) {
    transact("transferPosition", undo -> {
      requireInitialized();
      if (!id.kind().hasMaturity()) {
        throw new ValidationException(ValidationException.Reason.INVALID_ASSET_ID, "only longs and shorts transfer: " + id);
      }
      tokens.transfer(id, from, to, amount);
      undo.record("return " + id + " to " + from, () -> tokens.transfer(id, to, from, amount));
      return null;
    });
  }

  // ---------------------------------------------------------------------------------------------
  // Checkpoints and governance
  // ---------------------------------------------------------------------------------------------

  /**
   * Applies the checkpoint at {@code time}, which must be a checkpoint boundary no later than now.
   * Applying an already applied checkpoint changes nothing.
   */
  public Checkpoint checkpoint(long time) {
    return transact("checkpoint", undo -> {
      requireInitialized();
      if (time < 0 || time % config.checkpointDuration() != 0 || time > now()) {
        throw new ValidationException(ValidationException.Reason.INVALID_TIMESTAMP,
            "not a past checkpoint boundary: " + time);
      }
      return applyCheckpoint(time, yieldSource.vaultSharePrice());
    });
  }

  /**
   * Pays accrued governance fees to the fee collector.
   *
   * @return base or shares paid out
   */
  public BigInteger collectGovernanceFees(@NonNull String caller, @NonNull Options options) {
    return transact("collectGovernanceFees", undo -> {
      if (!caller.equalsIgnoreCase(config.feeCollector())) {
        throw new AuthorizationException(AuthorizationException.Reason.UNAUTHORIZED_CALLER,
            caller + " is not the fee collector");
      }
      BigInteger fees = state.getGovernanceFeesAccrued();
      state.setGovernanceFeesAccrued(BigInteger.ZERO);
      BigInteger proceeds = withdraw(fees, options);
      log.info("governance fees collected pool={} shares={} proceeds={}", config.poolAddress(), fees, proceeds);
      return proceeds;
    });
  }

  // ---------------------------------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------------------------------

  public String address() {
    return config.poolAddress();
  }

  public PoolConfig config() {
    return config;
  }

  public PoolInfo poolInfo() {
    return read("poolInfo", state::toInfo);
  }

  public Checkpoint checkpointAt(long time) {
    return read("checkpointAt", () -> state.checkpoint(time));
  }

  public BigInteger spotPrice() {
    return read("spotPrice", this::currentSpotPrice);
  }

  public BigInteger spotRate() {
    return read("spotRate", () -> PricingMath.calculateRateFromPrice(currentSpotPrice(), config.positionDuration()));
  }

  /**
   * Value of one LP share in base.
   */
  public BigInteger lpSharePrice() {
    return read("lpSharePrice", () -> {
      BigInteger c = yieldSource.vaultSharePrice();
      BigInteger totalSupply = state.effectiveLpSupply();
      if (totalSupply.signum() == 0) {
        return BigInteger.ZERO;
      }
      return mulDivDown(presentValue(c), c, totalSupply);
    });
  }

  public BigInteger vaultSharePrice() {
    return yieldSource.vaultSharePrice();
  }

  /**
   * Present value of the pool in shares, net of open long and short exposure.
   */
  public BigInteger presentValue() {
    return read("presentValue", () -> presentValue(yieldSource.vaultSharePrice()));
  }

  /**
   * What {@link #mint} would charge right now for {@code bondAmount} pairs, in base or shares.
   */
  public BigInteger quoteMintCost(@NonNull BigInteger bondAmount, boolean asBase) {
    return read("quoteMintCost", () -> {
      BigInteger c = yieldSource.vaultSharePrice();
      Checkpoint latest = state.checkpoint(latestCheckpoint());
      BigInteger openSharePrice = latest.isApplied() ? latest.vaultSharePrice() : c;
      BigInteger cost = PricingMath.calculateMintCost(bondAmount, c, openSharePrice,
          config.fees().flat(), config.fees().governance());
      return asBase ? cost : divUp(cost, c);
    });
  }

  /**
   * What {@link #openLong} would settle right now for {@code amount} paid in, with the spot price it
   * leaves behind.
   */
  public TradeQuote previewOpenLong(@NonNull BigInteger amount, boolean asBase) {
    return read("previewOpenLong", () -> currentMarket().openLong(toShares(amount, asBase)));
  }

  /**
   * What {@link #openShort} would settle right now for {@code bondAmount}. The quote's shares are the
   * deposit in vault shares.
   */
  public TradeQuote previewOpenShort(@NonNull BigInteger bondAmount) {
    return read("previewOpenShort", () -> currentMarket().openShort(bondAmount));
  }

  public BigInteger quoteShortDeposit(@NonNull BigInteger bondAmount, boolean asBase) {
    return read("quoteShortDeposit", () -> currentMarket().shortDeposit(bondAmount, asBase));
  }

  /**
   * Largest long that {@code budget} can open right now, in the budget's unit.
   */
  public BigInteger maxLong(@NonNull BigInteger budget, boolean asBase) {
    return read("maxLong", () -> {
      BigInteger budgetShares = toShares(budget, asBase);
      return toAmount(currentMarket().maxLong(budgetShares), budgetShares, budget, asBase);
    });
  }

  /**
   * Largest short, in bonds, whose deposit fits {@code budget} right now.
   */
  public BigInteger maxShort(@NonNull BigInteger budget, boolean asBase) {
    return read("maxShort", () -> currentMarket().maxShort(budget, asBase));
  }

  /**
   * Smallest long that brings the spot rate down to {@code targetRate}, capped at {@code budget}.
   */
  public BigInteger targetedLong(@NonNull BigInteger targetRate, @NonNull BigInteger budget, boolean asBase) {
    return read("targetedLong", () -> {
      BigInteger budgetShares = toShares(budget, asBase);
      return toAmount(currentMarket().targetedLong(targetRate, budgetShares), budgetShares, budget, asBase);
    });
  }

  public BigInteger maxSpotPrice() {
    return read("maxSpotPrice", () -> currentMarket().maxSpotPrice());
  }

  public BigInteger minSpotPrice() {
    return read("minSpotPrice", () -> currentMarket().minSpotPrice());
  }

  /**
   * Share reserves left over once open longs are covered.
   */
  public BigInteger solvency() {
    return read("solvency", () -> currentMarket().solvency());
  }

  public BigInteger balanceOf(@NonNull AssetId id, @NonNull String account) {
    return tokens.balanceOf(id, account);
  }

  public long latestCheckpoint() {
    return config.toCheckpoint(now());
  }

  /**
   * Maturity a position opened now would receive.
   */
  public long maturityForNewPositions() {
    return latestCheckpoint() + config.positionDuration();
  }

  // ---------------------------------------------------------------------------------------------
  // Internals; callers hold the transaction lock
  // ---------------------------------------------------------------------------------------------

  private <T> T transact(String operation, TransactionGuard.Transaction<T> body) {
    try {
      return guard.execute(operation, undo -> {
        PoolState snapshot = state.copy();
        undo.record("restore pool state", () -> state.restore(snapshot));
        return body.run(undo);
      });
    } catch (AmmException e) {
      rollbackCounter.increment();
      throw e;
    }
  }

  private <T> T read(String operation, Supplier<T> query) {
    return guard.execute(operation, undo -> query.get());
  }

  private Checkpoint applyCheckpoint(long time, BigInteger c) {
    Checkpoint existing = state.checkpoint(time);
    if (existing.isApplied()) {
      return existing;
    }
    Checkpoint applied = new Checkpoint(c, existing.longSharePrice());
    state.putCheckpoint(time, applied);

    if (state.isInitialized()) {
      BigInteger maturedLongs = tokens.totalSupply(AssetId.longs(time));
      BigInteger maturedShorts = tokens.totalSupply(AssetId.shorts(time));
      // matched pairs cancel; only the net exposure moves through the reserves
      BigInteger netShares = divDown(maturedShorts, c).subtract(divDown(maturedLongs, c));
      updateLiquidity(netShares.abs(), netShares.signum() < 0);
      state.setLongsOutstanding(sub(state.getLongsOutstanding(), maturedLongs));
      state.setShortsOutstanding(sub(state.getShortsOutstanding(), maturedShorts));
      distributeExcessIdle(c);
      log.info("checkpoint applied pool={} time={} vaultSharePrice={} maturedLongs={} maturedShorts={}",
          config.poolAddress(), time, c, maturedLongs, maturedShorts);
    }
    checkpointCounter.increment();
    return applied;
  }

  /**
   * Moves shares in or out of the reserves while holding the spot rate: bond reserves scale with
   * share reserves.
   */
  private void updateLiquidity(BigInteger shareDelta, boolean remove) {
    BigInteger shareReserves = state.getShareReserves();
    if (shareDelta.signum() == 0 || shareReserves.signum() == 0) {
      return;
    }
    BigInteger updated = remove ? sub(shareReserves, shareDelta) : add(shareReserves, shareDelta);
    state.setBondReserves(PricingMath.rescaleBonds(shareReserves, state.getBondReserves(), updated));
    state.setShareReserves(updated);
  }

  /**
   * Pays idle shares to withdrawal shares that are not yet ready, at the LP share price.
   */
  private void distributeExcessIdle(BigInteger c) {
    BigInteger notReady = sub(state.getWithdrawalSharesOutstanding(), state.getWithdrawalSharesReadyToWithdraw());
    if (notReady.signum() == 0) {
      return;
    }
    BigInteger idle = idle(c);
    BigInteger presentValue = presentValue(c);
    if (idle.signum() == 0 || presentValue.signum() == 0) {
      return;
    }
    BigInteger needed = mulDivUp(presentValue, notReady, state.effectiveLpSupply());
    BigInteger paid = min(idle, needed);
    BigInteger released = paid.equals(needed) ? notReady : mulDivDown(notReady, paid, needed);
    if (released.signum() == 0) {
      return;
    }
    updateLiquidity(paid, true);
    state.setWithdrawalSharesReadyToWithdraw(add(state.getWithdrawalSharesReadyToWithdraw(), released));
    state.setWithdrawalSharesProceeds(add(state.getWithdrawalSharesProceeds(), paid));
    log.debug("withdrawal pool paid shares={} released={}", paid, released);
  }

  private void recordLongSharePrice(long checkpointTime, long maturity, BigInteger bonds, BigInteger c) {
    Checkpoint checkpoint = state.checkpoint(checkpointTime);
    BigInteger existingBonds = tokens.totalSupply(AssetId.longs(maturity));
    BigInteger totalBonds = add(existingBonds, bonds);
    BigInteger weighted = add(mulDown(checkpoint.longSharePrice(), existingBonds), mulDown(c, bonds));
    state.putCheckpoint(checkpointTime, checkpoint.withLongSharePrice(divDown(weighted, totalBonds)));
  }

  private BigInteger currentSpotPrice() {
    return PricingMath.calculateSpotPrice(state.getShareReserves(), state.getBondReserves(),
        state.bondReserveAdjustment(), config.initialVaultSharePrice(), config.timeStretch());
  }

  private BigInteger presentValue(BigInteger c) {
    BigInteger longs = divUp(state.getLongsOutstanding(), c);
    BigInteger value = add(state.getShareReserves(), divDown(state.getShortsOutstanding(), c));
    return value.compareTo(longs) > 0 ? value.subtract(longs) : BigInteger.ZERO;
  }

  /**
   * Share reserves not needed to cover the net long exposure.
   */
  private BigInteger idle(BigInteger c) {
    BigInteger exposure = longExposure(c);
    BigInteger shareReserves = state.getShareReserves();
    return shareReserves.compareTo(exposure) > 0 ? shareReserves.subtract(exposure) : BigInteger.ZERO;
  }

  private BigInteger longExposure(BigInteger c) {
    BigInteger exposure = longExposureBonds();
    return exposure.signum() > 0 ? divUp(exposure, c) : BigInteger.ZERO;
  }

  /**
   * Bonds owed to longs that shorts of the same maturity do not offset, summed over every maturity
   * whose checkpoint is still pending.
   */
  private BigInteger longExposureBonds() {
    BigInteger exposure = BigInteger.ZERO;
    for (long opened : state.checkpointTimes()) {
      long maturity = opened + config.positionDuration();
      if (state.checkpoint(maturity).isApplied()) {
        continue;
      }
      BigInteger net = netLongs(maturity);
      if (net.signum() > 0) {
        exposure = exposure.add(net);
      }
    }
    return exposure;
  }

  private BigInteger netLongs(long maturity) {
    return tokens.totalSupply(AssetId.longs(maturity)).subtract(tokens.totalSupply(AssetId.shorts(maturity)));
  }

  /**
   * The pool as new positions opening in checkpoint {@code latest} see it.
   */
  private MarketState market(long latest, BigInteger c) {
    Checkpoint opening = state.checkpoint(latest);
    return new MarketState(state.getShareReserves(), state.getBondReserves(), state.bondReserveAdjustment(), c,
        opening.isApplied() ? opening.vaultSharePrice() : c, longExposureBonds(),
        netLongs(latest + config.positionDuration()), config);
  }

  private BigInteger openSharePrice(long maturityTime) {
    BigInteger price = state.checkpoint(maturityTime - config.positionDuration()).vaultSharePrice();
    if (price.signum() == 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_MATURITY_TIME,
          "no opening checkpoint for maturity " + maturityTime);
    }
    return price;
  }

  private void requireSolvent(BigInteger c) {
    BigInteger exposure = longExposure(c);
    if (state.getShareReserves().compareTo(exposure) < 0) {
      throw new ValidationException(ValidationException.Reason.INSUFFICIENT_LIQUIDITY,
          "share reserves " + state.getShareReserves() + " do not cover long exposure " + exposure);
    }
  }

  private void requireNonNegativeRate() {
    BigInteger spotPrice = currentSpotPrice();
    if (spotPrice.compareTo(ONE) > 0) {
      throw new InvalidCurveStateException("trade pushes spot price above one: " + spotPrice);
    }
  }

  private void requireInitialized() {
    if (!state.isInitialized()) {
      throw new ValidationException(ValidationException.Reason.NOT_INITIALIZED, config.poolAddress());
    }
  }

  private void requireMinimum(BigInteger amount) {
    if (amount.signum() == 0) {
      throw new ValidationException(ValidationException.Reason.ZERO_AMOUNT, "amount must be positive");
    }
    if (amount.compareTo(config.minimumTransactionAmount()) < 0) {
      throw new ValidationException(ValidationException.Reason.MINIMUM_TRANSACTION_AMOUNT,
          amount + " is below the minimum " + config.minimumTransactionAmount());
    }
  }

  private void requireMaturity(long maturityTime) {
    if (maturityTime <= 0 || maturityTime % config.checkpointDuration() != 0
        || maturityTime < config.positionDuration()) {
      throw new ValidationException(ValidationException.Reason.INVALID_MATURITY_TIME,
          "not a position maturity: " + maturityTime);
    }
  }

  private static void requireVaultSharePrice(BigInteger c, BigInteger minVaultSharePrice) {
    if (c.compareTo(minVaultSharePrice) < 0) {
      throw new SlippageException("vault share price below minimum", c, minVaultSharePrice);
    }
  }

  private void requireMinOutput(BigInteger shares, BigInteger minOutput, Options options) {
    BigInteger output = toOutput(shares, options);
    if (output.compareTo(minOutput) < 0) {
      throw new SlippageException("proceeds below minimum", output, minOutput);
    }
  }

  private BigInteger toOutput(BigInteger shares, Options options) {
    return options.asBase() ? yieldSource.convertToBase(shares) : shares;
  }

  private BigInteger deposit(String payer, BigInteger amount, boolean asBase, UndoLog undo) {
    if (asBase) {
      DepositResult result = yieldSource.depositBase(payer, amount);
      undo.record("return base deposit to " + payer, () -> yieldSource.withdrawBase(result.shares(), payer));
      if (result.refund().signum() > 0) {
        log.debug("deposit refunded payer={} refund={}", payer, result.refund());
      }
      return result.shares();
    }
    BigInteger shares = yieldSource.depositShares(payer, amount);
    undo.record("return share deposit to " + payer, () -> yieldSource.withdrawShares(shares, payer));
    return shares;
  }

  private MarketState currentMarket() {
    requireInitialized();
    return market(latestCheckpoint(), yieldSource.vaultSharePrice());
  }

  private BigInteger toShares(BigInteger amount, boolean asBase) {
    return asBase ? yieldSource.convertToShares(amount) : amount;
  }

  // a whole budget maps back to itself; anything less converts at the vault rate
  private BigInteger toAmount(BigInteger shares, BigInteger budgetShares, BigInteger budget, boolean asBase) {
    if (!asBase) {
      return shares;
    }
    return shares.equals(budgetShares) ? budget : yieldSource.convertToBase(shares);
  }

  private BigInteger withdraw(BigInteger shares, Options options) {
    if (shares.signum() == 0) {
      return BigInteger.ZERO;
    }
    return options.asBase()
        ? yieldSource.withdrawBase(shares, options.destination())
        : yieldSource.withdrawShares(shares, options.destination());
  }

  private void mintPosition(AssetId id, String account, BigInteger amount, UndoLog undo) {
    tokens.mint(id, account, amount);
    undo.record("burn " + id + " minted to " + account, () -> tokens.burn(id, account, amount));
  }

  private void burnPosition(AssetId id, String account, BigInteger amount, UndoLog undo) {
    tokens.burn(id, account, amount);
    undo.record("re-mint " + id + " burned from " + account, () -> tokens.mint(id, account, amount));
  }

  private long now() {
    return clock.instant().getEpochSecond();
  }
}
