package io.statusmvp.gasrouter.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

public final class UsdMath {
  /** Scale kept for intermediate USD amounts. */
  public static final int SCALE = 18;

  private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

  private UsdMath() {}

  public static BigDecimal fromUnits(BigInteger amount, int decimals) {
    return new BigDecimal(amount).movePointLeft(decimals);
  }

  /** {@code value * bps / 10000}. */
  public static BigDecimal applyBps(BigDecimal value, long bps) {
    return value.multiply(BigDecimal.valueOf(bps)).divide(BPS, SCALE, RoundingMode.HALF_UP);
  }

  /** {@code part / whole} in basis points, rounded down; zero when {@code whole} is not positive. */
  public static long toBps(BigDecimal part, BigDecimal whole) {
    if (whole == null || whole.signum() <= 0) return 0;
    return part.multiply(BPS).divide(whole, 0, RoundingMode.DOWN).longValueExact();
  }

  /** Rounded to {@link #SCALE}, trailing zeros dropped, never in exponent form. */
  public static BigDecimal usd(BigDecimal value) {
    BigDecimal v = value.setScale(SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    return v.scale() < 0 ? v.setScale(0) : v;
  }
}
