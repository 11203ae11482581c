package io.tunnelcontrol.core.identity;

import io.tunnelcontrol.core.error.CertificateEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** PEM armoring: base64 body wrapped at 64 characters between BEGIN/END lines. */
public final class Pem {

    public static final String CERTIFICATE = "CERTIFICATE";
    public static final String PRIVATE_KEY = "PRIVATE KEY";

    static final int LINE_LENGTH = 64;

    private static final Base64.Encoder ENCODER =
            Base64.getMimeEncoder(LINE_LENGTH, "\n".getBytes(StandardCharsets.US_ASCII));

    private Pem() {
        // utility class
    }

    public static String encode(String label, byte[] der) {
        return "-----BEGIN " + label + "-----\n"
                + ENCODER.encodeToString(der)
                + "\n-----END " + label + "-----\n";
    }

    /**
     * Extracts and decodes the body of the first block with the given label.
     *
     * @throws CertificateEncodingException if the block is absent or not valid base64
     */
    public static byte[] decode(String pem, String label) {
        String begin = "-----BEGIN " + label + "-----";
        String end = "-----END " + label + "-----";
        int start = pem.indexOf(begin);
        int stop = start < 0 ? -1 : pem.indexOf(end, start + begin.length());
        if (start < 0 || stop < 0) {
            throw new CertificateEncodingException("No " + label + " block found in PEM text");
        }
        String body = pem.substring(start + begin.length(), stop);
        try {
            return Base64.getMimeDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new CertificateEncodingException("Malformed base64 in " + label + " block", e);
        }
    }
}
