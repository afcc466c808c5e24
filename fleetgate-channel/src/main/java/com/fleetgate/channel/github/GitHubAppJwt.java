package com.fleetgate.channel.github;

import com.fleetgate.common.error.ConfigurationException;
import com.fleetgate.common.json.JsonMapper;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RS256 JSON Web Token identifying a GitHub App.
 */
public final class GitHubAppJwt {

    /** Backdated to absorb clock drift against GitHub. */
    static final long ISSUED_AT_OFFSET_SECONDS = 60;
    /** GitHub caps app JWTs at ten minutes. */
    static final long EXPIRY_OFFSET_SECONDS = 540;

    // AlgorithmIdentifier for rsaEncryption with NULL parameters.
    private static final byte[] RSA_ALGORITHM_ID = {
            0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86,
            (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private GitHubAppJwt() {
    }

    public static String create(String appId, String privateKeyPem, Instant now) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "RS256");
        header.put("typ", "JWT");
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iat", now.getEpochSecond() - ISSUED_AT_OFFSET_SECONDS);
        claims.put("exp", now.getEpochSecond() + EXPIRY_OFFSET_SECONDS);
        claims.put("iss", appId);

        String signingInput = encode(JsonMapper.write(header)) + "." + encode(JsonMapper.write(claims));
        try {
            Signature signer = Signature.getInstance("SHA256withRSA");
            signer.initSign(parsePrivateKey(privateKeyPem));
            signer.update(signingInput.getBytes(StandardCharsets.US_ASCII));
            return signingInput + "." + URL_ENCODER.encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("GitHub App private key is unusable: " + e.getMessage(), e);
        }
    }

    /**
     * Parse a PEM RSA key. PKCS#1 ({@code RSA PRIVATE KEY}) input is wrapped into PKCS#8.
     */
    static PrivateKey parsePrivateKey(String pem) throws GeneralSecurityException {
        if (pem == null || pem.isBlank()) {
            throw new ConfigurationException("GitHub App private key is not configured");
        }
        boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
        String base64 = pem.replaceAll("-----(BEGIN|END)[A-Z ]+-----", "")
                .replace("\\n", "")
                .replaceAll("\\s", "");
        byte[] der;
        try {
            der = Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("GitHub App private key is not valid PEM", e);
        }
        if (pkcs1) {
            der = wrapPkcs1(der);
        }
        return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
    }

    static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.write(0x02);
        body.write(0x01);
        body.write(0x00);
        body.writeBytes(RSA_ALGORITHM_ID);
        body.write(0x04);
        body.writeBytes(derLength(pkcs1.length));
        body.writeBytes(pkcs1);

        byte[] content = body.toByteArray();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x30);
        out.writeBytes(derLength(content.length));
        out.writeBytes(content);
        return out.toByteArray();
    }

    private static byte[] derLength(int length) {
        if (length < 0x80) {
            return new byte[]{(byte) length};
        }
        if (length <= 0xff) {
            return new byte[]{(byte) 0x81, (byte) length};
        }
        if (length <= 0xffff) {
            return new byte[]{(byte) 0x82, (byte) (length >> 8), (byte) length};
        }
        return new byte[]{(byte) 0x83, (byte) (length >> 16), (byte) (length >> 8), (byte) length};
    }

    private static String encode(String json) {
        return URL_ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
