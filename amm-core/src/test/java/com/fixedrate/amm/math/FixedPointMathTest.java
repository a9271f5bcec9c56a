package com.fixedrate.amm.math;

import com.fixedrate.amm.error.ErrorCategory;
import com.fixedrate.amm.error.FixedPointMathException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Random;

import static com.fixedrate.amm.math.FixedPointMath.ONE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedPointMathTest {

  private static BigInteger e18(long units) {
    return BigInteger.valueOf(units).multiply(ONE);
  }

  @Test
  void mulDivDownNeverExceedsMulDivUp() {
    Random random = new Random(42);
    for (int i = 0; i < 500; i++) {
      BigInteger x = new BigInteger(100, random).add(BigInteger.ONE);
      BigInteger y = new BigInteger(100, random).add(BigInteger.ONE);
      BigInteger d = new BigInteger(80, random).add(BigInteger.ONE);

      BigInteger down = FixedPointMath.mulDivDown(x, y, d);
      BigInteger up = FixedPointMath.mulDivUp(x, y, d);

      assertThat(down).isLessThanOrEqualTo(up);
      assertThat(up.subtract(down)).isLessThanOrEqualTo(BigInteger.ONE);
      if (x.multiply(y).mod(d).signum() == 0) {
        assertThat(down).isEqualTo(up).isEqualTo(x.multiply(y).divide(d));
      }
    }
  }

  @Test
  void mulDivUpIsZeroForZeroProduct() {
    assertThat(FixedPointMath.mulDivUp(BigInteger.ZERO, e18(5), e18(3))).isZero();
    assertThat(FixedPointMath.mulUp(e18(5), BigInteger.ZERO)).isZero();
  }

  @Test
  void roundingDirectionsDifferByOneUnit() {
    BigInteger third = FixedPointMath.divDown(ONE, e18(3));
    assertThat(third).isEqualTo(new BigInteger("333333333333333333"));
    assertThat(FixedPointMath.divUp(ONE, e18(3))).isEqualTo(new BigInteger("333333333333333334"));
    assertThat(FixedPointMath.mulDown(third, e18(3))).isEqualTo(new BigInteger("999999999999999999"));
  }

  @Test
  void divisionByZeroFails() {
    assertThatThrownBy(() -> FixedPointMath.divDown(ONE, BigInteger.ZERO))
        .isInstanceOf(FixedPointMathException.class)
        .hasMessageContaining("division by zero");
    assertThatThrownBy(() -> FixedPointMath.mulDivUp(BigInteger.ZERO, ONE, BigInteger.ZERO))
        .isInstanceOf(FixedPointMathException.class);
  }

  @Test
  void checkedAddAndSubFailInsteadOfWrapping() {
    assertThatThrownBy(() -> FixedPointMath.add(FixedPointMath.UINT256_MAX, BigInteger.ONE))
        .isInstanceOf(FixedPointMathException.class)
        .satisfies(e -> assertThat(((FixedPointMathException) e).getCategory()).isEqualTo(ErrorCategory.ARITHMETIC));
    assertThatThrownBy(() -> FixedPointMath.sub(ONE, e18(2)))
        .isInstanceOf(FixedPointMathException.class)
        .hasMessageContaining("underflow");
    assertThatThrownBy(() -> FixedPointMath.mulDown(FixedPointMath.UINT256_MAX, e18(2)))
        .isInstanceOf(FixedPointMathException.class);
  }

  @Test
  void expAndLnMatchKnownConstants() {
    assertThat(FixedPointMath.exp(BigInteger.ZERO)).isEqualTo(ONE);
    assertThat(FixedPointMath.exp(ONE)).isEqualTo(new BigInteger("2718281828459045235"));
    assertThat(FixedPointMath.ln(ONE)).isZero();
    assertThat(FixedPointMath.ln(e18(2))).isEqualTo(new BigInteger("693147180559945309"));
  }

  @Test
  void powHandlesIdentitiesExactly() {
    BigInteger x = new BigInteger("1234567890123456789");
    assertThat(FixedPointMath.pow(x, BigInteger.ZERO)).isEqualTo(ONE);
    assertThat(FixedPointMath.pow(BigInteger.ZERO, e18(3))).isZero();
    assertThat(FixedPointMath.pow(x, ONE)).isEqualTo(x);
  }

  @Test
  void powApproximatesWithinAFewUnits() {
    assertThat(FixedPointMath.pow(e18(2), e18(2))).isEqualTo(new BigInteger("3999999999999999996"));
    assertThat(FixedPointMath.pow(e18(4), ONE.divide(BigInteger.TWO))).isEqualTo(new BigInteger("1999999999999999999"));
  }

  @Test
  void expUnderflowRoundsToZeroAndOverflowFails() {
    assertThat(FixedPointMath.exp(e18(-43))).isZero();
    assertThat(FixedPointMath.exp(e18(-41))).isEqualTo(BigInteger.ONE);
    assertThatThrownBy(() -> FixedPointMath.exp(e18(136)))
        .isInstanceOf(FixedPointMathException.class)
        .hasMessageContaining("invalid exponent");
  }

  @Test
  void lnRejectsValuesOutsideItsDomain() {
    assertThatThrownBy(() -> FixedPointMath.ln(BigInteger.ZERO)).isInstanceOf(FixedPointMathException.class);
    assertThatThrownBy(() -> FixedPointMath.ln(BigInteger.ONE.shiftLeft(255))).isInstanceOf(FixedPointMathException.class);
  }

  @Test
  void narrowsAndRescales() {
    assertThat(FixedPointMath.toUint128(FixedPointMath.UINT128_MAX)).isEqualTo(FixedPointMath.UINT128_MAX);
    assertThatThrownBy(() -> FixedPointMath.toUint128(FixedPointMath.UINT128_MAX.add(BigInteger.ONE)))
        .isInstanceOf(FixedPointMathException.class);

    BigInteger ray = new BigInteger("1050000000123456789123456789");
    assertThat(FixedPointMath.rayToWad(ray)).isEqualTo(new BigInteger("1050000000123456789"));
    assertThat(FixedPointMath.wadToRay(ONE)).isEqualTo(FixedPointMath.RAY);
  }

  @Test
  void convertsDecimalsAtEighteenPlaces() {
    assertThat(FixedPointMath.fromDecimal(new BigDecimal("0.05"))).isEqualTo(new BigInteger("50000000000000000"));
    assertThat(FixedPointMath.toDecimal(new BigInteger("1500000000000000000"))).isEqualByComparingTo("1.5");
  }
}
