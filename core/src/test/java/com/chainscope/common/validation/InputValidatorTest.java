package com.chainscope.common.validation;

import com.chainscope.common.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputValidatorTest {

    @Test
    @DisplayName("valid address is accepted and lower-cased")
    void validAddress() {
        assertThat(InputValidator.requireAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e"))
                .isEqualTo("0x742d35cc6634c0532925a3b844bc454e4438f44e");
        assertThat(InputValidator.isValidAddress("0x0000000000000000000000000000000000000000")).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"0x123", "nothex", "742d35Cc6634C0532925a3b844Bc454e4438f44e", "0xZZ2d35Cc6634C0532925a3b844Bc454e4438f44e"})
    @DisplayName("malformed address is rejected")
    void invalidAddress(String address) {
        assertThatThrownBy(() -> InputValidator.requireAddress(address))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid address");
    }

    @Test
    @DisplayName("transaction hash must be 32 bytes of hex")
    void txHash() {
        String hash = "0x" + "Ab".repeat(32);
        assertThat(InputValidator.requireTxHash(hash)).isEqualTo("0x" + "ab".repeat(32));
        assertThatThrownBy(() -> InputValidator.requireTxHash("0x1234"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("hex data accepts null and even-length hex only")
    void hexData() {
        assertThat(InputValidator.requireHexDataOrNull(null)).isNull();
        assertThat(InputValidator.requireHexDataOrNull("0x")).isEqualTo("0x");
        assertThat(InputValidator.requireHexDataOrNull("0xA9059CBB")).isEqualTo("0xa9059cbb");
        assertThatThrownBy(() -> InputValidator.requireHexDataOrNull("0xabc"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> InputValidator.requireHexDataOrNull("a9059cbb"))
                .isInstanceOf(ValidationException.class);
    }
}
