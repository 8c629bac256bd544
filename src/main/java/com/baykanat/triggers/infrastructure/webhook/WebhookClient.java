package com.baykanat.triggers.infrastructure.webhook;

import com.baykanat.triggers.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Subscriber URL'ine POST. Hiçbir durumda exception fırlatmaz; sonuç WebhookResponse içinde sınıflandırılır. */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookClient {

    private final RestClient webhookRestClient;
    private final AppProperties appProperties;

    public WebhookResponse post(String url, Map<String, String> headers, String body) {
        int bodyLimit = appProperties.getDelivery().getResponseBodyLimit();
        long start = System.nanoTime();
        try {
            WebhookResponse response = webhookRestClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> headers.forEach(h::set))
                    .body(body)
                    .exchange((request, clientResponse) -> {
                        int status = clientResponse.getStatusCode().value();
                        String responseBody = readBody(clientResponse.getBody(), bodyLimit);
                        boolean success = clientResponse.getStatusCode().is2xxSuccessful();
                        return WebhookResponse.builder()
                                .success(success)
                                .statusCode(status)
                                .body(responseBody)
                                .errorType(success ? null : WebhookResponse.HTTP_ERROR)
                                .errorMessage(success ? null : "HTTP " + status)
                                .build();
                    });
            response.setLatencyMs(elapsedMs(start));
            return response;
        } catch (RestClientException e) {
            String errorType = classify(e);
            log.debug("Webhook call to {} failed ({}): {}", url, errorType, e.getMessage());
            return WebhookResponse.builder()
                    .success(false)
                    .errorType(errorType)
                    .errorMessage(e.getMostSpecificCause().getMessage())
                    .latencyMs(elapsedMs(start))
                    .build();
        } catch (RuntimeException e) {
            log.warn("Unexpected webhook failure for {}: {}", url, e.getMessage());
            return WebhookResponse.builder()
                    .success(false)
                    .errorType(WebhookResponse.UNKNOWN_ERROR)
                    .errorMessage(e.getMessage())
                    .latencyMs(elapsedMs(start))
                    .build();
        }
    }

    /** En fazla limit karakter; UTF-8 çözülmeden byte'tan kesilmez. */
    static String readBody(InputStream stream, int limit) throws IOException {
        if (stream == null) {
            return null;
        }
        // bir karakter en fazla 4 byte
        byte[] bytes = stream.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, (long) limit * 4));
        return truncate(new String(bytes, StandardCharsets.UTF_8), limit);
    }

    static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        int end = Character.isHighSurrogate(text.charAt(limit - 1)) ? limit - 1 : limit;
        return text.substring(0, end);
    }

    private static String classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HttpTimeoutException || current instanceof SocketTimeoutException) {
                return WebhookResponse.TIMEOUT;
            }
            if (current instanceof ConnectException || current instanceof UnknownHostException) {
                return WebhookResponse.CONNECTION_ERROR;
            }
            current = current.getCause();
        }
        return WebhookResponse.UNKNOWN_ERROR;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
