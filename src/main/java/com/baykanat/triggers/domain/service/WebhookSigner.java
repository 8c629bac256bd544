package com.baykanat.triggers.domain.service;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Webhook imzası: "v1=" + hex(HMAC_SHA256(secret, timestamp + "." + body)).
 * Alıcılar 5 dakikadan eski timestamp'leri reddetmelidir.
 */
@Slf4j
public final class WebhookSigner {

    public static final String SIGNATURE_VERSION = "v1=";
    public static final long TIMESTAMP_TOLERANCE_SECONDS = 300;

    private static final String HMAC_SHA256 = "HmacSHA256";

    private WebhookSigner() {
    }

    public static String sign(String secret, long timestampSeconds, String body) {
        return SIGNATURE_VERSION + computeHmacSha256(timestampSeconds + "." + body, secret);
    }

    /** Alıcı tarafı doğrulama; timestamp toleransı ve sabit zamanlı karşılaştırma. */
    public static boolean verify(String secret, String signatureHeader, long timestampSeconds, String body, long nowSeconds) {
        if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_VERSION)) {
            return false;
        }
        if (Math.abs(nowSeconds - timestampSeconds) > TIMESTAMP_TOLERANCE_SECONDS) {
            log.warn("Signature timestamp outside tolerance: timestamp={}, current={}", timestampSeconds, nowSeconds);
            return false;
        }
        String expected = sign(secret, timestampSeconds, body);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signatureHeader.getBytes(StandardCharsets.UTF_8));
    }

    private static String computeHmacSha256(String data, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }
}
