package com.talentledger.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressFormatTest {

    @Test
    void normalizeLowercasesChecksumAddress() {
        assertThat(AddressFormat.normalize("0x742d35Cc6634C0532925a3b844Bc454e4438f44e"))
                .isEqualTo("0x742d35cc6634c0532925a3b844bc454e4438f44e");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0x", "742d35Cc6634C0532925a3b844Bc454e4438f44e", "0x742d35Cc6634C0532925a3b844Bc454e4438f44",
            "0x742d35Cc6634C0532925a3b844Bc454e4438f44eZZ", "0xg42d35Cc6634C0532925a3b844Bc454e4438f44e"})
    void rejectsMalformed(String address) {
        assertThat(AddressFormat.isValid(address)).isFalse();
        assertThatThrownBy(() -> AddressFormat.normalize(address)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullableNormalization() {
        assertThat(AddressFormat.normalizeNullable(null)).isNull();
        assertThat(AddressFormat.isValid(null)).isFalse();
    }
}
