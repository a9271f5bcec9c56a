package com.fixedrate.amm.matching;

import com.fixedrate.amm.asset.AssetId;
import com.fixedrate.amm.error.AmmException;
import com.fixedrate.amm.error.AuthorizationException;
import com.fixedrate.amm.error.FixedPointMathException;
import com.fixedrate.amm.error.SlippageException;
import com.fixedrate.amm.error.ValidationException;
import com.fixedrate.amm.matching.MatchResult.Settlement;
import com.fixedrate.amm.matching.config.MatchingConfig;
import com.fixedrate.amm.matching.signature.SignatureVerifier;
import com.fixedrate.amm.pool.OpenPosition;
import com.fixedrate.amm.pool.PositionLedger;
import com.fixedrate.amm.pool.port.FungibleToken;
import com.fixedrate.amm.pricing.Options;
import com.fixedrate.amm.pricing.PairOptions;
import com.fixedrate.amm.tx.TransactionGuard;
import com.fixedrate.amm.tx.UndoLog;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import static com.fixedrate.amm.math.FixedPointMath.add;
import static com.fixedrate.amm.math.FixedPointMath.max;
import static com.fixedrate.amm.math.FixedPointMath.min;
import static com.fixedrate.amm.math.FixedPointMath.mulDivDown;
import static com.fixedrate.amm.math.FixedPointMath.mulDivUp;
import static com.fixedrate.amm.math.FixedPointMath.sub;

/**
 * Settles pairs of signed order intents against one pool.
 * <p>
 * Two opens on opposite sides mint a long/short pair from both traders' funds, two closes on opposite
 * sides burn one, and an open with a close on the same side hands the position over without touching
 * the reserves. Each match fills {@code min} of both orders' remaining bonds; an order's funds are
 * consumed in proportion, rounded down for what it pays and up for what it is owed, and tracked per
 * order hash so repeated partial fills never exceed what was signed. Whatever the engine account holds
 * after both traders are settled goes to the surplus recipient.
 * <p>
 * Every operation runs inside the engine's own {@link TransactionGuard}; fill amounts, cancellations
 * and token movements roll back together when any step fails. Calls into the pool are the pool's own
 * transactions and are undone through compensating pool calls where possible, so the pool mint or burn
 * is always the last step that can fail.
 */
@Slf4j
public class MatchingEngine {

  private final MatchingConfig config;
  private final PositionLedger pool;
  private final FungibleToken baseToken;
  private final FungibleToken vaultShareToken;
  private final OrderHasher hasher;
  private final SignatureVerifier signatures;
  private final Clock clock;
  private final TransactionGuard guard;

  private final Map<String, OrderAmounts> amountsUsed = new HashMap<>();
  private final Set<String> cancelled = new HashSet<>();

  private final Map<Settlement, Counter> matchCounters = new EnumMap<>(Settlement.class);
  private final Counter cancellationCounter;
  private final Counter rejectionCounter;

  public MatchingEngine(
      @NonNull MatchingConfig config,
      @NonNull PositionLedger pool,
      @NonNull FungibleToken baseToken,
      @NonNull FungibleToken vaultShareToken,
      @NonNull OrderHasher hasher,
      @NonNull SignatureVerifier signatures,
      @NonNull Clock clock,
      @NonNull MeterRegistry meterRegistry
  ) {
    this.config = config;
    this.pool = pool;
    this.baseToken = baseToken;
    this.vaultShareToken = vaultShareToken;
    this.hasher = hasher;
    this.signatures = signatures;
    this.clock = clock;
    this.guard = new TransactionGuard("matching[" + config.address() + "]");

    for (Settlement settlement : Settlement.values()) {
      matchCounters.put(settlement, Counter.builder("amm.matching.matches")
          .description("Order pairs settled by the matching engine")
          .tag("settlement", settlement.name().toLowerCase(Locale.ROOT))
          .register(meterRegistry));
    }
    this.cancellationCounter = Counter.builder("amm.matching.cancellations")
        .description("Order intents cancelled by their signer")
        .register(meterRegistry);
    this.rejectionCounter = Counter.builder("amm.matching.rejections")
        .description("Match, fill and cancel calls that failed and rolled back")
        .register(meterRegistry);
  }

  /**
   * Settles two signed orders against each other. The pair is read in order: the long or opening leg
   * comes first.
   *
   * @param surplusRecipient receives whatever is left once both traders are settled
   */
  public MatchResult matchOrders(@NonNull OrderIntent order1, @NonNull OrderIntent order2,
                                 @NonNull String surplusRecipient) {
    return transact("matchOrders", undo -> {
      requireDestination(surplusRecipient);
      Leg leg1 = signedLeg(order1);
      Leg leg2 = signedLeg(order2);
      validate(leg1, leg2);
      return settle(leg1, leg2, surplusRecipient, undo);
    });
  }

  /**
   * Fills a signed maker order with a taker order the caller builds on the spot. The taker order is
   * neither signed nor tracked; the caller must be its trader and collects any surplus.
   */
  public MatchResult fillOrder(@NonNull OrderIntent makerOrder, @NonNull OrderIntent takerOrder,
                               @NonNull String caller) {
    return transact("fillOrder", undo -> {
      if (!takerOrder.trader().equalsIgnoreCase(caller)) {
        throw new AuthorizationException(AuthorizationException.Reason.UNAUTHORIZED_CALLER,
            caller + " cannot fill on behalf of " + takerOrder.trader());
      }
      Leg maker = signedLeg(makerOrder);
      Leg taker = new Leg(takerOrder, hasher.hash(takerOrder), OrderAmounts.NONE, false);
      boolean makerFirst = makerOrder.orderType().isOpen() == takerOrder.orderType().isOpen()
          ? makerOrder.orderType().isLong()
          : makerOrder.orderType().isOpen();
      Leg leg1 = makerFirst ? maker : taker;
      Leg leg2 = makerFirst ? taker : maker;
      validate(leg1, leg2);
      return settle(leg1, leg2, caller, undo);
    });
  }

  /**
   * Permanently cancels orders signed by {@code caller}.
   *
   * @return hashes of the cancelled orders
   */
  public List<String> cancelOrders(@NonNull String caller, @NonNull List<OrderIntent> orders) {
    return transact("cancelOrders", undo -> {
      List<String> hashes = new ArrayList<>(orders.size());
      for (OrderIntent order : orders) {
        if (!order.trader().equalsIgnoreCase(caller)) {
          throw new AuthorizationException(AuthorizationException.Reason.UNAUTHORIZED_CALLER,
              caller + " cannot cancel an order of " + order.trader());
        }
        byte[] digest = hasher.digest(order);
        if (!signatures.verify(digest, order.signature(), order.trader())) {
          throw new AuthorizationException(AuthorizationException.Reason.INVALID_SIGNATURE,
              "cancellation of an order not signed by " + order.trader());
        }
        String hash = hasher.hash(order);
        if (cancelled.add(hash)) {
          hashes.add(hash);
          log.info("order cancelled hash={} trader={}", hash, order.trader());
        }
      }
      cancellationCounter.increment(hashes.size());
      return hashes;
    });
  }

  public String hashOrderIntent(@NonNull OrderIntent order) {
    return hasher.hash(order);
  }

  public boolean isCancelled(@NonNull String orderHash) {
    return read("isCancelled", () -> cancelled.contains(key(orderHash)));
  }

  public OrderAmounts orderAmountsUsed(@NonNull String orderHash) {
    return read("orderAmountsUsed", () -> amountsUsed.getOrDefault(key(orderHash), OrderAmounts.NONE));
  }

  public String engineAccount() {
    return config.engineAccount();
  }

  // ---------------------------------------------------------------------------------------------
  // Validation
  // ---------------------------------------------------------------------------------------------

  private Leg signedLeg(OrderIntent order) {
    String hash = hasher.hash(order);
    return new Leg(order, hash, amountsUsed.getOrDefault(hash, OrderAmounts.NONE), true);
  }

  private void validate(Leg leg1, Leg leg2) {
    OrderIntent order1 = leg1.order();
    OrderIntent order2 = leg2.order();
    if (!order1.acceptsCounterparty(order2.trader()) || !order2.acceptsCounterparty(order1.trader())) {
      throw new ValidationException(ValidationException.Reason.COUNTERPARTY_MISMATCH,
          "orders " + leg1.hash() + " and " + leg2.hash() + " exclude each other");
    }
    long now = now();
    for (Leg leg : List.of(leg1, leg2)) {
      if (now > leg.order().expiry()) {
        throw new AuthorizationException(AuthorizationException.Reason.EXPIRED,
            "order " + leg.hash() + " expired at " + leg.order().expiry());
      }
    }
    for (Leg leg : List.of(leg1, leg2)) {
      if (!leg.order().pool().equalsIgnoreCase(pool.address())) {
        throw new ValidationException(ValidationException.Reason.POOL_MISMATCH,
            "order " + leg.hash() + " targets " + leg.order().pool() + ", not " + pool.address());
      }
    }
    if (order1.options().asBase() != order2.options().asBase()) {
      throw new ValidationException(ValidationException.Reason.SETTLEMENT_ASSET_MISMATCH,
          "one order settles in base, the other in vault shares");
    }
    for (Leg leg : List.of(leg1, leg2)) {
      OrderIntent order = leg.order();
      if (order.minMaturityTime() > order.maxMaturityTime()) {
        throw new ValidationException(ValidationException.Reason.INVALID_MATURITY_TIME,
            "order " + leg.hash() + " has min maturity after max maturity");
      }
      if (!order.orderType().isOpen() && order.minMaturityTime() != order.maxMaturityTime()) {
        throw new ValidationException(ValidationException.Reason.INVALID_MATURITY_TIME,
            "close order " + leg.hash() + " must name a single maturity");
      }
    }
    for (Leg leg : List.of(leg1, leg2)) {
      if (leg.remaining().signum() == 0) {
        throw new AuthorizationException(AuthorizationException.Reason.ALREADY_FULLY_EXECUTED,
            "order " + leg.hash() + " has no bonds left to fill");
      }
      if (leg.signed() && cancelled.contains(leg.hash())) {
        throw new AuthorizationException(AuthorizationException.Reason.CANCELLED,
            "order " + leg.hash() + " was cancelled");
      }
      if (leg.signed() && !signatures.verify(hasher.digest(leg.order()), leg.order().signature(), leg.order().trader())) {
        throw new AuthorizationException(AuthorizationException.Reason.INVALID_SIGNATURE,
            "order " + leg.hash() + " is not signed by " + leg.order().trader());
      }
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Settlement
  // ---------------------------------------------------------------------------------------------

  private MatchResult settle(Leg leg1, Leg leg2, String surplusRecipient, UndoLog undo) {
    BigInteger bondMatch = min(leg1.remaining(), leg2.remaining());
    BigInteger vaultSharePrice = pool.vaultSharePrice();
    for (Leg leg : List.of(leg1, leg2)) {
      if (vaultSharePrice.compareTo(leg.order().minVaultSharePrice()) < 0) {
        throw new SlippageException("vault share price below order " + leg.hash() + " minimum",
            vaultSharePrice, leg.order().minVaultSharePrice());
      }
    }

    OrderType type1 = leg1.order().orderType();
    OrderType type2 = leg2.order().orderType();
    MatchResult result;
    if (type1 == OrderType.OPEN_LONG && type2 == OrderType.OPEN_SHORT) {
      result = mintPair(leg1, leg2, bondMatch, surplusRecipient, undo);
    } else if (type1 == OrderType.CLOSE_LONG && type2 == OrderType.CLOSE_SHORT) {
      result = burnPair(leg1, leg2, bondMatch, surplusRecipient, undo);
    } else if (type1.isOpen() && !type2.isOpen() && type1.isLong() == type2.isLong()) {
      result = transferPosition(leg1, leg2, bondMatch, surplusRecipient, undo);
    } else {
      throw new ValidationException(ValidationException.Reason.INVALID_ORDER_COMBINATION,
          type1 + " cannot be matched with " + type2);
    }

    matchCounters.get(result.settlement()).increment();
    log.info("orders matched settlement={} order1={} order2={} maturity={} bonds={} surplus={}",
        result.settlement(), result.order1Hash(), result.order2Hash(), result.maturityTime(),
        result.bondAmount(), result.surplus());
    return result;
  }

  private MatchResult mintPair(Leg longLeg, Leg shortLeg, BigInteger bondMatch, String surplusRecipient,
                               UndoLog undo) {
    boolean asBase = longLeg.order().options().asBase();
    long maturity = pool.maturityForNewPositions();
    requireMaturityInRange(longLeg, maturity);
    requireMaturityInRange(shortLeg, maturity);

    BigInteger longFunds = longLeg.paying(bondMatch);
    BigInteger shortFunds = shortLeg.paying(bondMatch);
    BigInteger available = add(longFunds, shortFunds);
    BigInteger cost = pool.quoteMintCost(bondMatch, asBase);
    if (available.compareTo(cost) < 0) {
      throw new AuthorizationException(AuthorizationException.Reason.INSUFFICIENT_FUNDING,
          "orders fund " + available + " but minting " + bondMatch + " bonds costs " + cost);
    }
    recordFill(longLeg, bondMatch, longFunds, undo);
    recordFill(shortLeg, bondMatch, shortFunds, undo);

    FungibleToken token = token(asBase);
    pull(token, longLeg.order().trader(), longFunds, undo);
    pull(token, shortLeg.order().trader(), shortFunds, undo);
    OpenPosition minted = pool.mint(
        config.engineAccount(),
        bondMatch,
        available,
        max(longLeg.order().minVaultSharePrice(), shortLeg.order().minVaultSharePrice()),
        new PairOptions(longLeg.order().options().destination(), shortLeg.order().options().destination(), asBase)
    );
    BigInteger surplus = sub(available, minted.amountPaid());
    pay(token, surplusRecipient, surplus, undo);
    return new MatchResult(longLeg.hash(), shortLeg.hash(), Settlement.MINT, minted.maturityTime(), bondMatch,
        longFunds, shortFunds, surplus);
  }

  private MatchResult burnPair(Leg longLeg, Leg shortLeg, BigInteger bondMatch, String surplusRecipient,
                               UndoLog undo) {
    long maturity = longLeg.order().minMaturityTime();
    if (shortLeg.order().minMaturityTime() != maturity) {
      throw new ValidationException(ValidationException.Reason.INVALID_MATURITY_TIME,
          "long closes maturity " + maturity + ", short closes " + shortLeg.order().minMaturityTime());
    }
    boolean asBase = longLeg.order().options().asBase();
    BigInteger longFunds = longLeg.receiving(bondMatch);
    BigInteger shortFunds = shortLeg.receiving(bondMatch);
    BigInteger owed = add(longFunds, shortFunds);
    recordFill(longLeg, bondMatch, longFunds, undo);
    recordFill(shortLeg, bondMatch, shortFunds, undo);

    String engine = config.engineAccount();
    movePosition(AssetId.longs(maturity), longLeg.order().trader(), engine, bondMatch, undo);
    movePosition(AssetId.shorts(maturity), shortLeg.order().trader(), engine, bondMatch, undo);
    BigInteger proceeds = pool.burn(engine, maturity, bondMatch, owed, new Options(engine, asBase));

    FungibleToken token = token(asBase);
    pay(token, longLeg.order().options().destination(), longFunds, undo);
    pay(token, shortLeg.order().options().destination(), shortFunds, undo);
    BigInteger surplus = sub(proceeds, owed);
    pay(token, surplusRecipient, surplus, undo);
    return new MatchResult(longLeg.hash(), shortLeg.hash(), Settlement.BURN, maturity, bondMatch,
        longFunds, shortFunds, surplus);
  }

  private MatchResult transferPosition(Leg openLeg, Leg closeLeg, BigInteger bondMatch, String surplusRecipient,
                                       UndoLog undo) {
    long maturity = closeLeg.order().minMaturityTime();
    requireMaturityInRange(openLeg, maturity);
    AssetId position = openLeg.order().orderType().isLong() ? AssetId.longs(maturity) : AssetId.shorts(maturity);

    BigInteger paid = openLeg.paying(bondMatch);
    BigInteger owed = closeLeg.receiving(bondMatch);
    if (paid.compareTo(owed) < 0) {
      throw new AuthorizationException(AuthorizationException.Reason.INSUFFICIENT_FUNDING,
          "buyer pays " + paid + " but seller requires " + owed + " for " + bondMatch + " of " + position);
    }
    recordFill(openLeg, bondMatch, paid, undo);
    recordFill(closeLeg, bondMatch, owed, undo);

    FungibleToken token = token(openLeg.order().options().asBase());
    pull(token, openLeg.order().trader(), paid, undo);
    movePosition(position, closeLeg.order().trader(), openLeg.order().options().destination(), bondMatch, undo);
    pay(token, closeLeg.order().options().destination(), owed, undo);
    BigInteger surplus = sub(paid, owed);
    pay(token, surplusRecipient, surplus, undo);
    return new MatchResult(openLeg.hash(), closeLeg.hash(), Settlement.TRANSFER, maturity, bondMatch,
        paid, owed, surplus);
  }

  // ---------------------------------------------------------------------------------------------
  // Internals; callers hold the transaction lock
  // ---------------------------------------------------------------------------------------------

  private <T> T transact(String operation, TransactionGuard.Transaction<T> body) {
    try {
      return guard.execute(operation, undo -> {
        Map<String, OrderAmounts> amountsSnapshot = new HashMap<>(amountsUsed);
        Set<String> cancelledSnapshot = new HashSet<>(cancelled);
        undo.record("restore order book", () -> {
          amountsUsed.clear();
          amountsUsed.putAll(amountsSnapshot);
          cancelled.clear();
          cancelled.addAll(cancelledSnapshot);
        });
        return body.run(undo);
      });
    } catch (AmmException e) {
      rejectionCounter.increment();
      throw e;
    }
  }

  private <T> T read(String operation, Supplier<T> query) {
    return guard.execute(operation, undo -> query.get());
  }

  private void requireMaturityInRange(Leg leg, long maturity) {
    OrderIntent order = leg.order();
    if (maturity < order.minMaturityTime() || maturity > order.maxMaturityTime()) {
      throw new ValidationException(ValidationException.Reason.INVALID_MATURITY_TIME,
          "maturity " + maturity + " outside [" + order.minMaturityTime() + ", " + order.maxMaturityTime()
              + "] of order " + leg.hash());
    }
  }

  private void recordFill(Leg leg, BigInteger bonds, BigInteger funds, UndoLog undo) {
    if (!leg.signed()) {
      return;
    }
    OrderAmounts updated = leg.used().plus(bonds, funds);
    if (updated.bondAmount().compareTo(leg.order().bondAmount()) > 0
        || updated.fundAmount().compareTo(leg.order().fundAmount()) > 0) {
      throw new FixedPointMathException("fills of order " + leg.hash() + " exceed its signed amounts: " + updated);
    }
    amountsUsed.put(leg.hash(), updated);
  }

  private void pull(FungibleToken token, String from, BigInteger amount, UndoLog undo) {
    move(token, from, config.engineAccount(), amount, undo);
  }

  private void pay(FungibleToken token, String to, BigInteger amount, UndoLog undo) {
    move(token, config.engineAccount(), to, amount, undo);
  }

  private void move(FungibleToken token, String from, String to, BigInteger amount, UndoLog undo) {
    if (amount.signum() == 0) {
      return;
    }
    token.transfer(from, to, amount);
    undo.record("return " + amount + " " + token.symbol() + " to " + from, () -> token.transfer(to, from, amount));
  }

  private void movePosition(AssetId id, String from, String to, BigInteger amount, UndoLog undo) {
    pool.transferPosition(id, from, to, amount);
    undo.record("return " + id + " to " + from, () -> pool.transferPosition(id, to, from, amount));
  }

  private FungibleToken token(boolean asBase) {
    return asBase ? baseToken : vaultShareToken;
  }

  private static void requireDestination(String account) {
    if (account.isBlank() || Options.ZERO_ADDRESS.equalsIgnoreCase(account)) {
      throw new ValidationException(ValidationException.Reason.INVALID_DESTINATION, "surplus recipient must be set");
    }
  }

  private static String key(String orderHash) {
    return orderHash.toLowerCase(Locale.ROOT);
  }

  private long now() {
    return clock.instant().getEpochSecond();
  }

  /**
   * One side of a match: the order, its hash and what has been filled against it so far.
   */
  private record Leg(OrderIntent order, String hash, OrderAmounts used, boolean signed) {

    BigInteger remaining() {
      return sub(order.bondAmount(), used.bondAmount());
    }

    /** Funds this order pays for {@code bonds} more, rounded down over its cumulative fill. */
    BigInteger paying(BigInteger bonds) {
      return sub(mulDivDown(order.fundAmount(), add(used.bondAmount(), bonds), order.bondAmount()), used.fundAmount());
    }

    /** Funds this order is owed for {@code bonds} more, rounded up over its cumulative fill. */
    BigInteger receiving(BigInteger bonds) {
      return sub(mulDivUp(order.fundAmount(), add(used.bondAmount(), bonds), order.bondAmount()), used.fundAmount());
    }
  }
}
