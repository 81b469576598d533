package io.b2mash.lms.course;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Platform commission on a course price. Up to 500 the fee is a flat 50 (never more than the
 * price itself); above 500 it is 13%, rounded to cents.
 */
public final class PlatformFeeCalculator {

  static final BigDecimal FLAT_FEE_CEILING = new BigDecimal("500");
  static final BigDecimal FLAT_FEE = new BigDecimal("50");
  static final BigDecimal COMMISSION_RATE = new BigDecimal("0.13");

  private PlatformFeeCalculator() {}

  /** Fee on the sale price when one is set, otherwise on the list price. Null if neither. */
  public static BigDecimal feeFor(BigDecimal price, BigDecimal salePrice) {
    BigDecimal basis = salePrice != null ? salePrice : price;
    if (basis == null) {
      return null;
    }
    if (basis.compareTo(FLAT_FEE_CEILING) <= 0) {
      return basis.min(FLAT_FEE).setScale(2, RoundingMode.HALF_UP);
    }
    return basis.multiply(COMMISSION_RATE).setScale(2, RoundingMode.HALF_UP);
  }
}
