package io.tunnelcontrol.core.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tunnelcontrol.core.error.CertificateEncodingException;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PEM armoring")
class PemTest {

    @Test
    @DisplayName("Body lines are at most 64 characters between BEGIN/END markers")
    void wrapsAt64() {
        byte[] der = new byte[1000];
        new Random(7).nextBytes(der);

        String pem = Pem.encode(Pem.CERTIFICATE, der);

        String[] lines = pem.split("\n");
        assertThat(lines[0]).isEqualTo("-----BEGIN CERTIFICATE-----");
        assertThat(lines[lines.length - 1]).isEqualTo("-----END CERTIFICATE-----");
        for (int i = 1; i < lines.length - 1; i++) {
            assertThat(lines[i].length()).isLessThanOrEqualTo(Pem.LINE_LENGTH);
        }
        assertThat(lines[1]).hasSize(Pem.LINE_LENGTH);
    }

    @Test
    @DisplayName("Decode returns the encoded bytes, ignoring surrounding text and CRLF")
    void decodes() {
        byte[] der = {0x30, 0x03, 0x02, 0x01, 0x05};
        String pem = "preamble\r\n" + Pem.encode(Pem.PRIVATE_KEY, der).replace("\n", "\r\n");

        assertThat(Pem.decode(pem, Pem.PRIVATE_KEY)).containsExactly(der);
    }

    @Test
    @DisplayName("Wrong label → CertificateEncodingException")
    void wrongLabel() {
        String pem = Pem.encode(Pem.CERTIFICATE, new byte[] {1, 2, 3});

        assertThatThrownBy(() -> Pem.decode(pem, Pem.PRIVATE_KEY))
                .isInstanceOf(CertificateEncodingException.class)
                .hasMessageContaining("PRIVATE KEY");
    }

    @Test
    @DisplayName("Missing END marker → CertificateEncodingException")
    void truncated() {
        String pem = "-----BEGIN CERTIFICATE-----\nMAMCAQU=\n";

        assertThatThrownBy(() -> Pem.decode(pem, Pem.CERTIFICATE)).isInstanceOf(CertificateEncodingException.class);
    }
}
