package com.athl3t.backend.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MoneyUtilsTest {

    @Test
    void cashAmountsRoundHalfUpToCents() {
        assertThat(MoneyUtils.multiply(new BigDecimal("10.00"), new BigDecimal("3.9155"))).isEqualByComparingTo("39.16");
        assertThat(MoneyUtils.multiply(new BigDecimal("7.50"), 3)).isEqualByComparingTo("22.50");
        assertThat(MoneyUtils.add(new BigDecimal("0.105"), new BigDecimal("0.10"))).isEqualByComparingTo("0.21");
        assertThat(MoneyUtils.scale(null)).isEqualByComparingTo("0.00");
    }

    @Test
    void pricesKeepFourDecimals() {
        assertThat(MoneyUtils.price(new BigDecimal("1.91")).scale()).isEqualTo(4);
        assertThat(MoneyUtils.price(new BigDecimal("12.345678"))).isEqualByComparingTo("12.3457");
    }
}
