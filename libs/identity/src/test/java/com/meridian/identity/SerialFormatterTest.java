package com.meridian.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.meridian.common.SignEncryptException;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SerialFormatter")
class SerialFormatterTest {

    @Test
    @DisplayName("formats a 20-byte serial as lowercase colon-separated hex")
    void directoryExample() throws Exception {
        var serial = new BigInteger("440E0D94F36966391117BC9F867D84F0C48CFCB7", 16);

        assertThat(SerialFormatter.format(serial))
                .isEqualTo("44:0e:0d:94:f3:69:66:39:11:17:bc:9f:86:7d:84:f0:c4:8c:fc:b7");
    }

    @Test
    @DisplayName("pads odd-length hex to whole bytes")
    void padsOddLength() throws Exception {
        assertThat(SerialFormatter.format(new BigInteger("ABC", 16))).isEqualTo("0a:bc");
        assertThat(SerialFormatter.format(BigInteger.ONE)).isEqualTo("01");
        assertThat(SerialFormatter.format(BigInteger.ZERO)).isEqualTo("00");
    }

    @Test
    @DisplayName("output is always two-character lowercase groups")
    void shape() throws Exception {
        for (int bits = 1; bits <= 160; bits += 7) {
            var serial = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.valueOf(bits));

            assertThat(SerialFormatter.format(serial)).matches("[0-9a-f]{2}(:[0-9a-f]{2})*");
        }
    }

    @Test
    @DisplayName("rejects a negative serial")
    void rejectsNegative() {
        assertThatThrownBy(() -> SerialFormatter.format(BigInteger.valueOf(-5)))
                .isInstanceOf(SignEncryptException.class)
                .hasMessageStartingWith("Unable to parse your certificate");
    }

    @Test
    @DisplayName("rejects a missing serial")
    void rejectsNull() {
        assertThatThrownBy(() -> SerialFormatter.format((BigInteger) null))
                .isInstanceOf(SignEncryptException.class);
    }
}
