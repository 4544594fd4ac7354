package com.talentledger.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmountFormatTest {

    @ParameterizedTest
    @CsvSource({
            "1500000000000000000, 1.5",
            "1000000000000000000, 1",
            "1, 0.000000000000000001",
            "0, 0",
            "123456789012345678901234567890, 123456789012.34567890123456789"
    })
    void toEtherIsLossless(String wei, String ether) {
        assertThat(AmountFormat.toEther(new BigInteger(wei))).isEqualTo(ether);
        assertThat(AmountFormat.parseEther(ether)).isEqualTo(new BigInteger(wei));
    }

    @Test
    void toEtherAcceptsDecimal128Values() {
        assertThat(AmountFormat.toEther(new BigDecimal("60000000000000000"))).isEqualTo("0.06");
    }

    @Test
    void parseEtherRejectsSubWeiPrecision() {
        assertThatThrownBy(() -> AmountFormat.parseEther("0.0000000000000000001"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("decimals");
    }

    @Test
    void parseEtherRejectsGarbage() {
        assertThatThrownBy(() -> AmountFormat.parseEther("one ether")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AmountFormat.parseEther(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void weiStringsTreatBlankAsZero() {
        assertThat(AmountFormat.fromWeiString(null)).isEqualTo(BigInteger.ZERO);
        assertThat(AmountFormat.fromWeiString("42")).isEqualTo(BigInteger.valueOf(42));
        assertThat(AmountFormat.toWeiString(null)).isNull();
    }
}
