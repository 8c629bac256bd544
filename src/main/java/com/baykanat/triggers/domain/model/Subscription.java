package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Webhook aboneliği; bu serviste salt okunur (yönetim yüzeyi dışarıda). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    private String id;
    private String accountId;
    private String url;
    private List<String> eventTypes;
    private List<String> sources;
    private RetryPolicy retryPolicy;
    private String signingSecret;
    private Map<String, String> customHeaders;
    private SubscriptionStatus status;

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }
}
