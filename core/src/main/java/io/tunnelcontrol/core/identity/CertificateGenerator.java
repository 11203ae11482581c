package io.tunnelcontrol.core.identity;

import io.tunnelcontrol.core.error.CertificateEncodingException;
import io.tunnelcontrol.core.routing.Ipv4;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAKeyGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import javax.crypto.Cipher;

/**
 * Produces a self-signed X.509v3 certificate and its PKCS#8 RSA key from raw primitives.
 *
 * <p>
 * The TBSCertificate is assembled with {@link Der}, hashed with SHA-256, prefixed with the
 * SHA-256 {@code DigestInfo} header and signed with raw RSA using PKCS#1 v1.5 block type 1
 * padding. No certificate-authority tooling or provider-specific builder classes are involved.
 */
public final class CertificateGenerator {

    public static final int KEY_SIZE = 2048;

    static final String OID_SHA256_WITH_RSA = "1.2.840.113549.1.1.11";
    static final String OID_RSA_ENCRYPTION = "1.2.840.113549.1.1.1";
    static final String OID_COMMON_NAME = "2.5.4.3";
    static final String OID_SUBJECT_ALT_NAME = "2.5.29.17";

    /** DER prefix of {@code DigestInfo{AlgorithmIdentifier(sha256, NULL), OCTET STRING(32)}}. */
    static final byte[] SHA256_DIGEST_INFO_PREFIX = HexFormat.of().parseHex("3031300d060960864801650304020105000420");

    private static final int SAN_DNS_NAME = 2;
    private static final int SAN_IP_ADDRESS = 7;

    private final SecureRandom random;
    private final Clock clock;

    public CertificateGenerator() {
        this(new SecureRandom(), Clock.systemUTC());
    }

    public CertificateGenerator(SecureRandom random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    /** Generates a fresh RSA-2048 key pair and a certificate for it. */
    public CertificateMaterial generate(CertificateProfile profile) {
        KeyPair keyPair = generateKeyPair();
        RSAPublicKey publicKey = (RSAPublicKey) keyPair.getPublic();
        RSAPrivateCrtKey privateKey = (RSAPrivateCrtKey) keyPair.getPrivate();

        Instant notBefore = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant notAfter = notBefore.plus(Duration.ofDays(profile.validityDays()));
        BigInteger serial = BigInteger.valueOf(1L + random.nextInt(Integer.MAX_VALUE - 1));

        byte[] tbs = tbsCertificate(profile, serial, notBefore, notAfter, publicKey);
        byte[] certificate = Der.sequence(tbs, signatureAlgorithm(), Der.bitString(sign(tbs, privateKey)));

        return new CertificateMaterial(
                Pem.encode(Pem.PRIVATE_KEY, pkcs8(privateKey)),
                Pem.encode(Pem.CERTIFICATE, certificate),
                fingerprint(certificate));
    }

    /** SHA-256 over the DER certificate as colon-separated upper-case hex pairs. */
    public static String fingerprint(byte[] certificateDer) {
        return HexFormat.ofDelimiter(":").withUpperCase().formatHex(sha256(certificateDer));
    }

    /**
     * PKCS#8 {@code PrivateKeyInfo} wrapping a PKCS#1 {@code RSAPrivateKey}. The CRT components are
     * derived from {@code d}, {@code p} and {@code q} rather than copied from the key object.
     */
    static byte[] pkcs8(RSAPrivateCrtKey key) {
        BigInteger p = key.getPrimeP();
        BigInteger q = key.getPrimeQ();
        BigInteger d = key.getPrivateExponent();
        byte[] rsaPrivateKey = Der.sequence(
                Der.integer(0),
                Der.integer(key.getModulus()),
                Der.integer(key.getPublicExponent()),
                Der.integer(d),
                Der.integer(p),
                Der.integer(q),
                Der.integer(d.mod(p.subtract(BigInteger.ONE))),
                Der.integer(d.mod(q.subtract(BigInteger.ONE))),
                Der.integer(q.modInverse(p)));
        return Der.sequence(
                Der.integer(0),
                Der.sequence(Der.oid(OID_RSA_ENCRYPTION), Der.nullValue()),
                Der.octetString(rsaPrivateKey));
    }

    static byte[] tbsCertificate(
            CertificateProfile profile, BigInteger serial, Instant notBefore, Instant notAfter, RSAPublicKey key) {
        byte[] name = distinguishedName(profile.commonName());
        byte[] body = Der.concat(
                Der.explicit(0, Der.integer(2)),
                Der.integer(serial),
                signatureAlgorithm(),
                name,
                Der.sequence(Der.time(notBefore), Der.time(notAfter)),
                name,
                subjectPublicKeyInfo(key));
        // An empty GeneralNames is not allowed, so the extension block is left out entirely.
        if (profile.dnsNames().isEmpty() && profile.ipAddresses().isEmpty()) {
            return Der.tlv(Der.TAG_SEQUENCE, body);
        }
        return Der.tlv(Der.TAG_SEQUENCE, Der.concat(body, Der.explicit(3, Der.sequence(subjectAltName(profile)))));
    }

    static byte[] signatureAlgorithm() {
        return Der.sequence(Der.oid(OID_SHA256_WITH_RSA), Der.nullValue());
    }

    static byte[] distinguishedName(String commonName) {
        return Der.sequence(Der.set(Der.sequence(Der.oid(OID_COMMON_NAME), Der.directoryString(commonName))));
    }

    static byte[] subjectPublicKeyInfo(RSAPublicKey key) {
        byte[] rsaPublicKey = Der.sequence(Der.integer(key.getModulus()), Der.integer(key.getPublicExponent()));
        return Der.sequence(
                Der.sequence(Der.oid(OID_RSA_ENCRYPTION), Der.nullValue()), Der.bitString(rsaPublicKey));
    }

    static byte[] subjectAltName(CertificateProfile profile) {
        List<byte[]> names = new ArrayList<>();
        for (String dns : profile.dnsNames()) {
            names.add(Der.implicit(SAN_DNS_NAME, Der.ia5Content(dns)));
        }
        for (String ip : profile.ipAddresses()) {
            names.add(Der.implicit(SAN_IP_ADDRESS, Ipv4.toBytes(Ipv4.require(ip))));
        }
        byte[] generalNames = Der.sequence(names.toArray(new byte[0][]));
        return Der.sequence(Der.oid(OID_SUBJECT_ALT_NAME), Der.octetString(generalNames));
    }

    private KeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(new RSAKeyGenParameterSpec(KEY_SIZE, RSAKeyGenParameterSpec.F4), random);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new CertificateEncodingException("RSA key generation unavailable", e);
        }
    }

    /** RSASSA-PKCS1-v1_5 over {@code DigestInfo(SHA-256(data))}. */
    private byte[] sign(byte[] data, RSAPrivateCrtKey key) {
        try {
            byte[] digestInfo = Der.concat(SHA256_DIGEST_INFO_PREFIX, sha256(data));
            // A private-key "encryption" in the JDK RSA cipher applies block type 1 padding.
            Cipher rsa = Cipher.getInstance("RSA/ECB/PKCS1Padding");
            rsa.init(Cipher.ENCRYPT_MODE, key, random);
            return rsa.doFinal(digestInfo);
        } catch (GeneralSecurityException e) {
            throw new CertificateEncodingException("RSA signing failed", e);
        }
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new CertificateEncodingException("SHA-256 unavailable", e);
        }
    }
}
