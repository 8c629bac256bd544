package com.baykanat.triggers.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for WebhookSigner.
 *
 * <p>The signed string is {@code timestamp + "." + body}; the header value is {@code v1=<hex>}.
 */
class WebhookSignerTest {

    private static final String SECRET = "whsec_test";
    private static final String BODY = "{\"id\":\"evt_1\"}";

    @Test
    @DisplayName("Signature is v1= + hex HMAC-SHA256 of timestamp.body")
    void signatureFormat() throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        String expected = "v1=" + HexFormat.of().formatHex(
                mac.doFinal(("1700000000." + BODY).getBytes(StandardCharsets.UTF_8)));

        assertThat(WebhookSigner.sign(SECRET, 1700000000L, BODY)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Verify accepts a fresh signature and rejects a tampered body")
    void verifyDetectsTampering() {
        String signature = WebhookSigner.sign(SECRET, 1700000000L, BODY);

        assertThat(WebhookSigner.verify(SECRET, signature, 1700000000L, BODY, 1700000010L)).isTrue();
        assertThat(WebhookSigner.verify(SECRET, signature, 1700000000L, BODY + " ", 1700000010L)).isFalse();
        assertThat(WebhookSigner.verify("other", signature, 1700000000L, BODY, 1700000010L)).isFalse();
    }

    @Test
    @DisplayName("Verify rejects timestamps older than five minutes")
    void verifyRejectsStaleTimestamp() {
        String signature = WebhookSigner.sign(SECRET, 1700000000L, BODY);

        assertThat(WebhookSigner.verify(SECRET, signature, 1700000000L, BODY, 1700000301L)).isFalse();
        assertThat(WebhookSigner.verify(SECRET, null, 1700000000L, BODY, 1700000000L)).isFalse();
    }
}
