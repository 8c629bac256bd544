package com.baykanat.triggers.infrastructure.webhook;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Tek webhook çağrısının sonucu; transport hatasında statusCode null. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponse {

    public static final String HTTP_ERROR = "http_error";
    public static final String TIMEOUT = "timeout";
    public static final String CONNECTION_ERROR = "connection_error";
    public static final String UNKNOWN_ERROR = "unknown_error";

    private boolean success;
    private Integer statusCode;
    private String body;
    private String errorType;
    private String errorMessage;
    private long latencyMs;

    /** DLQ ve attempt kaydı için kısa hata açıklaması. */
    public String failureReason() {
        if (success) {
            return null;
        }
        if (statusCode != null) {
            return "HTTP " + statusCode;
        }
        return errorType + ": " + errorMessage;
    }
}
