package io.tunnelcontrol.core.identity;

import io.tunnelcontrol.core.error.CertificateEncodingException;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Minimal ASN.1 DER encoder: just the universal and context-specific types an X.509v3
 * certificate and a PKCS#8 RSA key need.
 *
 * <p>
 * Every method returns a complete TLV (tag, definite length, content). Composite values are
 * built bottom-up by passing already-encoded children to {@link #sequence(byte[]...)},
 * {@link #set(byte[]...)} or {@link #explicit(int, byte[])}.
 */
public final class Der {

    static final int TAG_INTEGER = 0x02;
    static final int TAG_BIT_STRING = 0x03;
    static final int TAG_OCTET_STRING = 0x04;
    static final int TAG_NULL = 0x05;
    static final int TAG_OID = 0x06;
    static final int TAG_UTF8_STRING = 0x0C;
    static final int TAG_PRINTABLE_STRING = 0x13;
    static final int TAG_IA5_STRING = 0x16;
    static final int TAG_UTC_TIME = 0x17;
    static final int TAG_GENERALIZED_TIME = 0x18;
    static final int TAG_SEQUENCE = 0x30;
    static final int TAG_SET = 0x31;

    /** First year that must be written as GeneralizedTime (RFC 5280 section 4.1.2.5). */
    static final int GENERALIZED_TIME_FROM_YEAR = 2050;

    private static final DateTimeFormatter UTC_TIME = DateTimeFormatter.ofPattern("yyMMddHHmmss'Z'");
    private static final DateTimeFormatter GENERALIZED_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss'Z'");

    private Der() {
        // utility class
    }

    /** Encodes a definite length: short form below 128, long form with minimal octets otherwise. */
    public static byte[] length(int length) {
        if (length < 0) {
            throw new CertificateEncodingException("Negative DER length: " + length);
        }
        if (length < 0x80) {
            return new byte[] {(byte) length};
        }
        int octets = 0;
        for (int remaining = length; remaining > 0; remaining >>>= 8) {
            octets++;
        }
        byte[] out = new byte[octets + 1];
        out[0] = (byte) (0x80 | octets);
        for (int i = octets; i > 0; i--) {
            out[i] = (byte) (length & 0xFF);
            length >>>= 8;
        }
        return out;
    }

    /** Wraps {@code content} in a TLV with the given single-octet tag. */
    public static byte[] tlv(int tag, byte[] content) {
        byte[] len = length(content.length);
        byte[] out = new byte[1 + len.length + content.length];
        out[0] = (byte) tag;
        System.arraycopy(len, 0, out, 1, len.length);
        System.arraycopy(content, 0, out, 1 + len.length, content.length);
        return out;
    }

    public static byte[] sequence(byte[]... elements) {
        return tlv(TAG_SEQUENCE, concat(elements));
    }

    public static byte[] set(byte[]... elements) {
        return tlv(TAG_SET, concat(elements));
    }

    /** Two's complement, minimal octets; a leading zero is kept when the high bit is set. */
    public static byte[] integer(BigInteger value) {
        return tlv(TAG_INTEGER, value.toByteArray());
    }

    public static byte[] integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public static byte[] nullValue() {
        return new byte[] {TAG_NULL, 0x00};
    }

    /**
     * Encodes a dotted object identifier. The first two arcs share one octet ({@code 40 * a + b});
     * the rest are base-128 with the continuation bit on all but the last octet.
     */
    public static byte[] oid(String dotted) {
        String[] parts = dotted.split("\\.");
        if (parts.length < 2) {
            throw new CertificateEncodingException("OID needs at least two arcs: " + dotted);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            long first = Long.parseLong(parts[0]);
            long second = Long.parseLong(parts[1]);
            if (first > 2 || (first < 2 && second > 39)) {
                throw new CertificateEncodingException("Invalid leading OID arcs: " + dotted);
            }
            writeBase128(out, first * 40 + second);
            for (int i = 2; i < parts.length; i++) {
                writeBase128(out, Long.parseLong(parts[i]));
            }
        } catch (NumberFormatException e) {
            throw new CertificateEncodingException("Invalid OID: " + dotted, e);
        }
        return tlv(TAG_OID, out.toByteArray());
    }

    /** BIT STRING with zero unused bits. */
    public static byte[] bitString(byte[] bits) {
        byte[] content = new byte[bits.length + 1];
        System.arraycopy(bits, 0, content, 1, bits.length);
        return tlv(TAG_BIT_STRING, content);
    }

    public static byte[] octetString(byte[] content) {
        return tlv(TAG_OCTET_STRING, content);
    }

    public static byte[] printableString(String value) {
        if (!isPrintable(value)) {
            throw new CertificateEncodingException("Not a PrintableString: " + value);
        }
        return tlv(TAG_PRINTABLE_STRING, value.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] utf8String(String value) {
        return tlv(TAG_UTF8_STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] ia5String(String value) {
        return tlv(TAG_IA5_STRING, ia5Content(value));
    }

    /** Content octets of an IA5String, for use under an implicit tag. */
    public static byte[] ia5Content(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0x7F) {
                throw new CertificateEncodingException("Not an IA5String: " + value);
            }
        }
        return value.getBytes(StandardCharsets.US_ASCII);
    }

    /** PrintableString when every character allows it, UTF8String otherwise. */
    public static byte[] directoryString(String value) {
        return isPrintable(value) ? printableString(value) : utf8String(value);
    }

    /** UTCTime up to 2049, GeneralizedTime from 2050 on; seconds precision, always Zulu. */
    public static byte[] time(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        if (utc.getYear() >= GENERALIZED_TIME_FROM_YEAR) {
            return tlv(TAG_GENERALIZED_TIME, GENERALIZED_TIME.format(utc).getBytes(StandardCharsets.US_ASCII));
        }
        return tlv(TAG_UTC_TIME, UTC_TIME.format(utc).getBytes(StandardCharsets.US_ASCII));
    }

    /** Constructed context-specific tag {@code [n]} (EXPLICIT tagging). */
    public static byte[] explicit(int tagNumber, byte[] encoded) {
        return tlv(0xA0 | checkTagNumber(tagNumber), encoded);
    }

    /** Primitive context-specific tag {@code [n]} (IMPLICIT tagging of a primitive value). */
    public static byte[] implicit(int tagNumber, byte[] content) {
        return tlv(0x80 | checkTagNumber(tagNumber), content);
    }

    /** PrintableString alphabet from X.680: letters, digits, space and {@code '()+,-./:=?}. */
    public static boolean isPrintable(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean ok = (c >= 'A' && c <= 'Z')
                    || (c >= 'a' && c <= 'z')
                    || (c >= '0' && c <= '9')
                    || " '()+,-./:=?".indexOf(c) >= 0;
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] part : parts) {
            total += part.length;
        }
        byte[] out = new byte[total];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, offset, part.length);
            offset += part.length;
        }
        return out;
    }

    private static void writeBase128(ByteArrayOutputStream out, long value) {
        if (value < 0) {
            throw new CertificateEncodingException("Negative OID arc: " + value);
        }
        int groups = 1;
        for (long v = value >>> 7; v > 0; v >>>= 7) {
            groups++;
        }
        for (int g = groups - 1; g >= 0; g--) {
            int septet = (int) ((value >>> (7 * g)) & 0x7F);
            out.write(g == 0 ? septet : septet | 0x80);
        }
    }

    private static int checkTagNumber(int tagNumber) {
        if (tagNumber < 0 || tagNumber > 30) {
            throw new CertificateEncodingException("Context tag out of range: " + tagNumber);
        }
        return tagNumber;
    }
}
