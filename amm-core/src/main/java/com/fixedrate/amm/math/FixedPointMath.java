package com.fixedrate.amm.math;

import com.fixedrate.amm.error.FixedPointMathException;
import lombok.NonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Unsigned 18-decimal fixed-point arithmetic over the 256-bit range.
 * <p>
 * Every method states its rounding direction. Pricing code picks the direction that favours the pool,
 * so raw {@link BigInteger} arithmetic is never used for reserve or amount math.
 */
public final class FixedPointMath {

  public static final BigInteger ONE = BigInteger.TEN.pow(18);
  public static final BigInteger RAY = BigInteger.TEN.pow(27);
  public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
  public static final BigInteger UINT128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
  public static final BigInteger INT256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);
  public static final BigInteger INT256_MIN = BigInteger.ONE.shiftLeft(255).negate();

  private static final BigInteger RAY_TO_WAD = BigInteger.TEN.pow(9);

  private static final BigInteger EXP_MIN = new BigInteger("-42139678854452767551");
  private static final BigInteger EXP_MAX = new BigInteger("135305999368893231589");
  private static final BigInteger FIVE_POW_18 = BigInteger.valueOf(5).pow(18);
  private static final BigInteger LN2_Q96 = new BigInteger("54916777467707473351141471128");
  private static final BigInteger HALF_Q96 = BigInteger.ONE.shiftLeft(95);
  private static final BigInteger EXP_SCALE = new BigInteger("29d9dc38563c32e5c2f6dc192ee70ef65f9978af3", 16);

  private static final BigInteger LN_SCALE = new BigInteger("1340daa0d5f769dba1915cef59f0815a5506", 16);
  private static final BigInteger LN_K_SCALE = new BigInteger("267a36c0c95b3975ab3ee5b203a7614a3f75373f047d803ae7b6687f2b3", 16);
  private static final BigInteger LN_OFFSET = new BigInteger("57115e47018c7177eebf7cd370a3356a1b7863008a5ae8028c72b8864284", 16);

  private FixedPointMath() {
  }

  public static BigInteger add(@NonNull BigInteger a, @NonNull BigInteger b) {
    BigInteger result = requireUint256(a, "add").add(requireUint256(b, "add"));
    if (result.compareTo(UINT256_MAX) > 0) {
      throw new FixedPointMathException("add overflow: " + a + " + " + b);
    }
    return result;
  }

  public static BigInteger sub(@NonNull BigInteger a, @NonNull BigInteger b) {
    requireUint256(a, "sub");
    requireUint256(b, "sub");
    if (a.compareTo(b) < 0) {
      throw new FixedPointMathException("sub underflow: " + a + " - " + b);
    }
    return a.subtract(b);
  }

  /**
   * {@code floor(x * y / d)}.
   */
  public static BigInteger mulDivDown(@NonNull BigInteger x, @NonNull BigInteger y, @NonNull BigInteger d) {
    BigInteger product = checkedProduct(x, y, d);
    return product.divide(d);
  }

  /**
   * {@code ceil(x * y / d)}, exactly zero when {@code x * y == 0}.
   */
  public static BigInteger mulDivUp(@NonNull BigInteger x, @NonNull BigInteger y, @NonNull BigInteger d) {
    BigInteger product = checkedProduct(x, y, d);
    if (product.signum() == 0) {
      return BigInteger.ZERO;
    }
    BigInteger[] qr = product.divideAndRemainder(d);
    return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
  }

  public static BigInteger mulDown(BigInteger a, BigInteger b) {
    return mulDivDown(a, b, ONE);
  }

  public static BigInteger mulUp(BigInteger a, BigInteger b) {
    return mulDivUp(a, b, ONE);
  }

  public static BigInteger divDown(BigInteger a, BigInteger b) {
    return mulDivDown(a, ONE, b);
  }

  public static BigInteger divUp(BigInteger a, BigInteger b) {
    return mulDivUp(a, ONE, b);
  }

  public static BigInteger min(@NonNull BigInteger a, @NonNull BigInteger b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  public static BigInteger max(@NonNull BigInteger a, @NonNull BigInteger b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  /**
   * {@code x^y} computed as {@code exp(y * ln(x))}. The approximation is not monotone in the last few
   * units, so callers that need a bound pick their rounding on the surrounding terms.
   */
  public static BigInteger pow(@NonNull BigInteger x, @NonNull BigInteger y) {
    requireUint256(x, "pow");
    requireUint256(y, "pow");
    if (y.signum() == 0) {
      return ONE;
    }
    if (x.signum() == 0) {
      return BigInteger.ZERO;
    }
    if (y.equals(ONE)) {
      return x;
    }
    if (y.compareTo(INT256_MAX) > 0) {
      throw new FixedPointMathException("pow exponent out of range: " + y);
    }
    BigInteger ylnx = y.multiply(ln(x));
    if (ylnx.compareTo(INT256_MAX) > 0 || ylnx.compareTo(INT256_MIN) < 0) {
      throw new FixedPointMathException("pow overflow: x=" + x + " y=" + y);
    }
    return exp(ylnx.divide(ONE));
  }

  /**
   * Natural exponent of a signed 18-decimal value. Inputs at or below about -42.14 round to zero,
   * inputs at or above about 135.3 are not representable and fail.
   */
  public static BigInteger exp(@NonNull BigInteger x) {
    if (x.compareTo(EXP_MIN) <= 0) {
      return BigInteger.ZERO;
    }
    if (x.compareTo(EXP_MAX) >= 0) {
      throw new FixedPointMathException("invalid exponent: " + x);
    }

    // to base-2 fixed point with 96 fractional bits, then reduce by k * ln(2)
    x = x.shiftLeft(78).divide(FIVE_POW_18);
    BigInteger k = x.shiftLeft(96).divide(LN2_Q96).add(HALF_Q96).shiftRight(96);
    x = x.subtract(k.multiply(LN2_Q96));

    BigInteger y = x.add(new BigInteger("1346386616545796478920950773328"));
    y = y.multiply(x).shiftRight(96).add(new BigInteger("57155421227552351082224309758442"));
    BigInteger p = y.add(x).subtract(new BigInteger("94201549194550492254356042504812"));
    p = p.multiply(y).shiftRight(96).add(new BigInteger("28719021644029726153956944680412240"));
    p = p.multiply(x).add(new BigInteger("4385272521454847904659076985693276").shiftLeft(96));

    BigInteger q = x.subtract(new BigInteger("2855989394907223263936484059900"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("50020603652535783019961831881945"));
    q = q.multiply(x).shiftRight(96).subtract(new BigInteger("533845033583426703283633433725380"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("3604857256930695427073651918091429"));
    q = q.multiply(x).shiftRight(96).subtract(new BigInteger("14423608567350463180887372962807573"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("26449188498355588339934803723976023"));

    BigInteger r = p.divide(q);
    return r.multiply(EXP_SCALE).shiftRight(195 - k.intValueExact());
  }

  /**
   * Natural logarithm of a positive 18-decimal value below {@code 2^255}.
   */
  public static BigInteger ln(@NonNull BigInteger x) {
    if (x.signum() <= 0) {
      throw new FixedPointMathException("ln of non-positive value: " + x);
    }
    if (x.compareTo(INT256_MAX) > 0) {
      throw new FixedPointMathException("ln argument out of range: " + x);
    }

    int r = x.bitLength() - 1;
    int k = r - 96;
    x = k > 0 ? x.shiftRight(k) : x.shiftLeft(-k);

    BigInteger p = x.add(new BigInteger("3273285459638523848632254066296"));
    p = p.multiply(x).shiftRight(96).add(new BigInteger("24828157081833163892658089445524"));
    p = p.multiply(x).shiftRight(96).add(new BigInteger("43456485725739037958740375743393"));
    p = p.multiply(x).shiftRight(96).subtract(new BigInteger("11111509109440967052023855526967"));
    p = p.multiply(x).shiftRight(96).subtract(new BigInteger("45023709667254063763336534515857"));
    p = p.multiply(x).shiftRight(96).subtract(new BigInteger("14706773417378608786704636184526"));
    p = p.multiply(x).subtract(new BigInteger("795164235651350426258249787498").shiftLeft(96));

    BigInteger q = x.add(new BigInteger("5573035233440673466300451813936"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("71694874799317883764090561454958"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("283447036172924575727196451306956"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("401686690394027663651624208769553"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("204048457590392012362485061816622"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("31853899698501571402653359427138"));
    q = q.multiply(x).shiftRight(96).add(new BigInteger("909429971244387300277376558375"));

    BigInteger result = p.divide(q);
    result = result.multiply(LN_SCALE);
    result = result.add(LN_K_SCALE.multiply(BigInteger.valueOf(k)));
    result = result.add(LN_OFFSET);
    return result.shiftRight(174);
  }

  /**
   * Narrows a value to the unsigned 128-bit range used for stored reserves and order bookkeeping.
   */
  public static BigInteger toUint128(@NonNull BigInteger value) {
    if (value.signum() < 0 || value.compareTo(UINT128_MAX) > 0) {
      throw new FixedPointMathException("value does not fit in uint128: " + value);
    }
    return value;
  }

  /**
   * Rescales a 27-decimal adapter value to 18 decimals, rounding down.
   */
  public static BigInteger rayToWad(@NonNull BigInteger ray) {
    return requireUint256(ray, "rayToWad").divide(RAY_TO_WAD);
  }

  public static BigInteger wadToRay(@NonNull BigInteger wad) {
    return checkedProduct(wad, RAY_TO_WAD, BigInteger.ONE);
  }

  /**
   * Parses a decimal such as {@code 0.05} into 18-decimal fixed point, rounding down.
   */
  public static BigInteger fromDecimal(@NonNull BigDecimal value) {
    if (value.signum() < 0) {
      throw new FixedPointMathException("negative fixed-point value: " + value);
    }
    return requireUint256(value.movePointRight(18).setScale(0, RoundingMode.DOWN).toBigIntegerExact(), "fromDecimal");
  }

  public static BigDecimal toDecimal(@NonNull BigInteger value) {
    return new BigDecimal(value).movePointLeft(18).stripTrailingZeros();
  }

  private static BigInteger checkedProduct(BigInteger x, BigInteger y, BigInteger d) {
    requireUint256(x, "mulDiv");
    requireUint256(y, "mulDiv");
    requireUint256(d, "mulDiv");
    if (d.signum() == 0) {
      throw new FixedPointMathException("division by zero");
    }
    BigInteger product = x.multiply(y);
    if (product.compareTo(UINT256_MAX) > 0) {
      throw new FixedPointMathException("mulDiv overflow: " + x + " * " + y);
    }
    return product;
  }

  private static BigInteger requireUint256(BigInteger value, String op) {
    if (value.signum() < 0 || value.compareTo(UINT256_MAX) > 0) {
      throw new FixedPointMathException(op + " operand outside uint256: " + value);
    }
    return value;
  }
}
