package com.tierstore.store.managed;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.tierstore.store.http.RequestAuthenticator;

import okhttp3.Request;

/**
 * HMAC-SHA256 request signing with an access-key / secret-key pair scoped to a region.
 */
public final class SigningAuthenticator implements RequestAuthenticator {
    static final String DATE_HEADER = "X-Date";
    static final String REGION_HEADER = "X-Region";
    static final String CONTENT_HASH_HEADER = "X-Content-Sha256";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
            .withZone(ZoneOffset.UTC);

    private final String accessKey;
    private final String secretKey;
    private final String region;
    private final Clock clock;

    public SigningAuthenticator(String accessKey, String secretKey, String region, Clock clock) {
        this.accessKey = accessKey;
        this.secretKey = secretKey;
        this.region = region;
        this.clock = clock;
    }

    @Override
    public void authenticate(Request.Builder request, String path, byte[] body) {
        String timestamp = TIMESTAMP.format(clock.instant());
        String contentHash = sha256Hex(body);
        String signature = sign(stringToSign("POST", path, timestamp, contentHash));
        request.header(DATE_HEADER, timestamp)
                .header(REGION_HEADER, region)
                .header(CONTENT_HASH_HEADER, contentHash)
                .header("Authorization", "HMAC-SHA256 Credential=" + accessKey + "/" + timestamp.substring(0, 8)
                        + "/" + region + ", Signature=" + signature);
    }

    static String stringToSign(String method, String path, String timestamp, String contentHash) {
        return method + "\n" + path + "\n" + timestamp + "\n" + contentHash;
    }

    String sign(String stringToSign) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(stringToSign.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    static String sha256Hex(byte[] body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public String toString() {
        return "SigningAuthenticator{accessKey=" + accessKey + ", region=" + region + '}';
    }
}
