package com.fleetgate.channel.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Webhook authenticity checks. All comparisons are constant-time.
 */
public final class WebhookSignatures {

    /** Accepted clock skew for timestamped deliveries. */
    public static final long MAX_SKEW_SECONDS = 300;

    // SubjectPublicKeyInfo header for a raw 32-byte Ed25519 key.
    private static final byte[] ED25519_SPKI_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private WebhookSignatures() {
    }

    /**
     * Result of a timestamped signature check.
     */
    public enum Verdict {
        VALID,
        INVALID,
        STALE
    }

    public static boolean safeEqual(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    public static String hmacSha256Hex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /**
     * Slack v0 scheme: {@code v0=hex(hmac(secret, "v0:" + ts + ":" + body))}.
     */
    public static Verdict verifySlack(String signingSecret, String timestamp, String body, String signature,
            Clock clock) {
        if (signingSecret == null || timestamp == null || signature == null) {
            return Verdict.INVALID;
        }
        if (!withinSkew(timestamp, clock)) {
            return Verdict.STALE;
        }
        String expected = "v0=" + hmacSha256Hex(signingSecret, "v0:" + timestamp + ":" + body);
        return safeEqual(expected, signature) ? Verdict.VALID : Verdict.INVALID;
    }

    /**
     * GitHub {@code X-Hub-Signature-256}: {@code sha256=hex(hmac(secret, body))}.
     */
    public static boolean verifyGitHub(String secret, String body, String signature) {
        if (secret == null || signature == null) {
            return false;
        }
        return safeEqual("sha256=" + hmacSha256Hex(secret, body), signature);
    }

    /**
     * Discord interactions: Ed25519 over {@code timestamp + body} with the application public key (hex).
     */
    public static Verdict verifyDiscord(String publicKeyHex, String timestamp, String body, String signatureHex,
            Clock clock) {
        if (publicKeyHex == null || timestamp == null || signatureHex == null) {
            return Verdict.INVALID;
        }
        if (!withinSkew(timestamp, clock)) {
            return Verdict.STALE;
        }
        try {
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(ed25519PublicKey(publicKeyHex));
            verifier.update((timestamp + body).getBytes(StandardCharsets.UTF_8));
            return verifier.verify(HexFormat.of().parseHex(signatureHex)) ? Verdict.VALID : Verdict.INVALID;
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            return Verdict.INVALID;
        }
    }

    /**
     * Telegram sends the configured secret verbatim in {@code X-Telegram-Bot-Api-Secret-Token}.
     */
    public static boolean verifyTelegram(String expectedSecret, String headerValue) {
        return expectedSecret != null && !expectedSecret.isEmpty() && safeEqual(expectedSecret, headerValue);
    }

    static PublicKey ed25519PublicKey(String publicKeyHex) throws GeneralSecurityException {
        byte[] raw = HexFormat.of().parseHex(publicKeyHex.trim());
        if (raw.length != 32) {
            throw new IllegalArgumentException("Ed25519 public key must be 32 bytes");
        }
        byte[] spki = new byte[ED25519_SPKI_PREFIX.length + raw.length];
        System.arraycopy(ED25519_SPKI_PREFIX, 0, spki, 0, ED25519_SPKI_PREFIX.length);
        System.arraycopy(raw, 0, spki, ED25519_SPKI_PREFIX.length, raw.length);
        return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(spki));
    }

    private static boolean withinSkew(String timestamp, Clock clock) {
        long ts;
        try {
            ts = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            return false;
        }
        long now = clock.instant().getEpochSecond();
        return Math.abs(now - ts) <= MAX_SKEW_SECONDS;
    }
}
