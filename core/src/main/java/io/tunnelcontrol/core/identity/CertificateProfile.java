package io.tunnelcontrol.core.identity;

import io.tunnelcontrol.core.routing.Ipv4;
import java.util.List;

/**
 * What to put into a generated self-signed certificate.
 *
 * @param commonName   subject and issuer CN
 * @param validityDays lifetime counted from generation time
 * @param dnsNames     {@code dNSName} entries of the Subject Alternative Name extension
 * @param ipAddresses  dotted-quad {@code iPAddress} entries of the same extension
 */
public record CertificateProfile(String commonName, int validityDays, List<String> dnsNames, List<String> ipAddresses) {

    public static final String DEFAULT_COMMON_NAME = "Tunnel Control Local API";
    public static final int DEFAULT_VALIDITY_DAYS = 3650;
    public static final List<String> DEFAULT_DNS_NAMES = List.of("localhost");
    public static final List<String> DEFAULT_IP_ADDRESSES = List.of("127.0.0.1", "10.0.0.1");

    public CertificateProfile {
        if (commonName == null || commonName.isBlank()) {
            throw new IllegalArgumentException("commonName must not be blank");
        }
        if (validityDays <= 0) {
            throw new IllegalArgumentException("validityDays must be positive, got " + validityDays);
        }
        dnsNames = dnsNames == null ? List.of() : List.copyOf(dnsNames);
        ipAddresses = ipAddresses == null ? List.of() : List.copyOf(ipAddresses);
        for (String ip : ipAddresses) {
            Ipv4.require(ip);
        }
    }

    public static CertificateProfile defaults() {
        return new CertificateProfile(
                DEFAULT_COMMON_NAME, DEFAULT_VALIDITY_DAYS, DEFAULT_DNS_NAMES, DEFAULT_IP_ADDRESSES);
    }

    public CertificateProfile withCommonName(String name) {
        return new CertificateProfile(name, validityDays, dnsNames, ipAddresses);
    }

    public CertificateProfile withValidityDays(int days) {
        return new CertificateProfile(commonName, days, dnsNames, ipAddresses);
    }
}
