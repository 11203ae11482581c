package io.tunnelcontrol.core.routing;

import java.util.OptionalLong;

/**
 * Dotted-quad IPv4 helpers. Addresses are carried as unsigned values in a {@code long}
 * ({@code 0 .. 2^32 - 1}) so that ordering and range arithmetic need no sign handling.
 */
public final class Ipv4 {

    public static final long MAX_ADDRESS = 0xFFFF_FFFFL;

    private Ipv4() {
        // utility class
    }

    /**
     * Parses a strict dotted quad: four decimal octets, each 0-255, nothing else. Host names,
     * IPv6 literals and partial forms yield an empty result.
     */
    public static OptionalLong parse(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        String[] parts = text.split("\\.", -1);
        if (parts.length != 4) {
            return OptionalLong.empty();
        }
        long value = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3) {
                return OptionalLong.empty();
            }
            int octet = 0;
            for (int i = 0; i < part.length(); i++) {
                char c = part.charAt(i);
                if (c < '0' || c > '9') {
                    return OptionalLong.empty();
                }
                octet = octet * 10 + (c - '0');
            }
            if (octet > 255) {
                return OptionalLong.empty();
            }
            value = (value << 8) | octet;
        }
        return OptionalLong.of(value);
    }

    public static boolean isDottedQuad(String text) {
        return parse(text).isPresent();
    }

    /**
     * Parses a dotted quad or fails.
     *
     * @throws IllegalArgumentException if {@code text} is not a dotted quad
     */
    public static long require(String text) {
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Not an IPv4 address: " + text));
    }

    public static String format(long address) {
        checkRange(address);
        return ((address >>> 24) & 0xFF) + "." + ((address >>> 16) & 0xFF) + "." + ((address >>> 8) & 0xFF) + "."
                + (address & 0xFF);
    }

    /** Network-order octets, as used in an X.509 {@code iPAddress} general name. */
    public static byte[] toBytes(long address) {
        checkRange(address);
        return new byte[] {
            (byte) (address >>> 24), (byte) (address >>> 16), (byte) (address >>> 8), (byte) address
        };
    }

    private static void checkRange(long address) {
        if (address < 0 || address > MAX_ADDRESS) {
            throw new IllegalArgumentException("IPv4 address out of range: " + address);
        }
    }
}
