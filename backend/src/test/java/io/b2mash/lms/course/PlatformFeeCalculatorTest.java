package io.b2mash.lms.course;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PlatformFeeCalculatorTest {

  @Test
  void priceAboveFlatFee_chargesFlatFee() {
    assertThat(PlatformFeeCalculator.feeFor(new BigDecimal("100"), null))
        .isEqualByComparingTo("50.00");
  }

  @Test
  void priceBelowFlatFee_neverExceedsPrice() {
    assertThat(PlatformFeeCalculator.feeFor(new BigDecimal("30"), null))
        .isEqualByComparingTo("30.00");
  }

  @Test
  void priceAtCeiling_stillFlat() {
    assertThat(PlatformFeeCalculator.feeFor(new BigDecimal("500"), null))
        .isEqualByComparingTo("50.00");
  }

  @Test
  void priceAboveCeiling_chargesCommission() {
    assertThat(PlatformFeeCalculator.feeFor(new BigDecimal("1000"), null))
        .isEqualByComparingTo("130.00");
  }

  @Test
  void salePrice_takesPrecedence() {
    assertThat(PlatformFeeCalculator.feeFor(new BigDecimal("1000"), new BigDecimal("40")))
        .isEqualByComparingTo("40.00");
  }

  @Test
  void noPrice_returnsNull() {
    assertThat(PlatformFeeCalculator.feeFor(null, null)).isNull();
  }
}
