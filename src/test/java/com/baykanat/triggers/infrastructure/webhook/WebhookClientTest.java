package com.baykanat.triggers.infrastructure.webhook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for response body capture in WebhookClient.
 */
class WebhookClientTest {

    @Test
    @DisplayName("Multibyte body is cut on a character boundary, never mid-sequence")
    void multibyteBodyIsCutOnCharacterBoundary() throws Exception {
        String body = "ğüşıöç".repeat(10);

        String captured = WebhookClient.readBody(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)), 7);

        assertThat(captured).isEqualTo("ğüşıöçğ");
        assertThat(captured).doesNotContain("\uFFFD");
    }

    @Test
    @DisplayName("Surrogate pair at the limit is dropped whole")
    void surrogatePairIsNotSplit() throws Exception {
        String body = "ab😀cd";

        String captured = WebhookClient.readBody(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)), 3);

        assertThat(captured).isEqualTo("ab");
    }

    @Test
    @DisplayName("Short body and missing body pass through")
    void shortAndMissingBodies() throws Exception {
        assertThat(WebhookClient.readBody(new ByteArrayInputStream("ok".getBytes(StandardCharsets.UTF_8)), 10000))
                .isEqualTo("ok");
        assertThat(WebhookClient.readBody(null, 10000)).isNull();
    }
}
