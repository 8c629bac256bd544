package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.model.DeliveryAttempt;
import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.model.DeliveryTaskStatus;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.RetryPolicy;
import com.baykanat.triggers.domain.model.Subscription;
import com.baykanat.triggers.domain.model.SubscriptionStatus;
import com.baykanat.triggers.infrastructure.persistence.DeliveryTaskJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.SubscriptionJdbcRepository;
import com.baykanat.triggers.infrastructure.webhook.WebhookClient;
import com.baykanat.triggers.infrastructure.webhook.WebhookResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Kiralanmış tek bir delivery task'ı işler: imzalı POST, sonuca göre başarı, gecikmeli retry veya DLQ.
 * Worker hiçbir zaman beklemez; retry gecikmesi task'ın visible_at alanıyla uygulanır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryService {

    public static final String HEADER_SIGNATURE = "X-Signature";
    public static final String HEADER_TIMESTAMP = "X-Timestamp";
    public static final String HEADER_EVENT_ID = "X-Event-Id";
    public static final String HEADER_EVENT_TYPE = "X-Event-Type";
    public static final String HEADER_WEBHOOK_ID = "X-Webhook-Id";
    public static final String HEADER_ATTEMPT = "X-Webhook-Attempt";

    private final EventJdbcRepository eventRepository;
    private final SubscriptionJdbcRepository subscriptionRepository;
    private final DeliveryTaskJdbcRepository deliveryTaskRepository;
    private final DeliveryOutcomeRecorder outcomeRecorder;
    private final WebhookClient webhookClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final Clock clock;

    public void deliver(DeliveryTask task) {
        MDC.put("eventId", task.getEventId());
        MDC.put("taskId", task.getId());
        try {
            process(task);
        } catch (Exception e) {
            // lease süresi dolunca task tekrar görünür olur
            log.error("Delivery task {} failed unexpectedly, will be reclaimed after lease expiry", task.getId(), e);
        } finally {
            MDC.remove("eventId");
            MDC.remove("taskId");
        }
    }

    private void process(DeliveryTask task) throws JsonProcessingException {
        if (task.getStatus() != DeliveryTaskStatus.IN_FLIGHT || task.getLeaseToken() == null) {
            log.debug("Task {} is not leased, skipping", task.getId());
            return;
        }

        Optional<Event> foundEvent = eventRepository.findById(task.getEventId());
        if (foundEvent.isEmpty()) {
            outcomeRecorder.recordCancelled(task, "event not found");
            log.warn("Task {} cancelled, event {} not found", task.getId(), task.getEventId());
            return;
        }
        Event event = foundEvent.get();

        Optional<Subscription> foundSubscription = subscriptionRepository.findById(task.getSubscriptionId());
        if (foundSubscription.isEmpty() || foundSubscription.get().getStatus() == SubscriptionStatus.DISABLED) {
            outcomeRecorder.recordCancelled(task, "subscription disabled or deleted");
            log.info("Task {} cancelled, subscription {} disabled or deleted", task.getId(), task.getSubscriptionId());
            return;
        }
        Subscription subscription = foundSubscription.get();

        AppProperties.DeliveryProperties delivery = appProperties.getDelivery();
        if (subscription.getStatus() == SubscriptionStatus.PAUSED) {
            deferPaused(task, delivery.getPausedRetryDelayMs());
            return;
        }

        // iptal edilmiş task (ör. DLQ dismiss) burada durur
        long leaseMs = delivery.getHttpTimeoutMs() + delivery.getLeaseMarginMs();
        if (!deliveryTaskRepository.renewLease(task.getId(), task.getLeaseToken(), leaseMs)) {
            log.info("Task {} lease lost or cancelled before delivery", task.getId());
            return;
        }

        int attemptNumber = task.getAttemptNumber() + 1;
        String body = buildPayload(event, task);
        Map<String, String> headers = buildHeaders(subscription, event, task, attemptNumber, body);

        Instant attemptedAt = clock.instant();
        WebhookResponse response = webhookClient.post(subscription.getUrl(), headers, body);
        DeliveryAttempt attempt = DeliveryAttempt.builder()
                .eventId(event.getId())
                .subscriptionId(subscription.getId())
                .taskId(task.getId())
                .attemptNumber(attemptNumber)
                .success(response.isSuccess())
                .statusCode(response.getStatusCode())
                .errorType(response.getErrorType())
                .errorMessage(response.failureReason())
                .responseBody(response.getBody())
                .latencyMs(response.getLatencyMs())
                .attemptedAt(attemptedAt)
                .build();

        if (response.isSuccess()) {
            outcomeRecorder.recordSuccess(task, attempt);
            log.info("Delivered event {} to subscription {} on attempt {} ({} ms)",
                    event.getId(), subscription.getId(), attemptNumber, response.getLatencyMs());
            return;
        }

        RetryPolicy policy = resolveRetryPolicy(subscription);
        if (attemptNumber >= policy.getMaxAttempts()) {
            outcomeRecorder.recordExhausted(task, attempt, event);
            log.warn("Delivery of event {} to subscription {} exhausted after {} attempts: {}",
                    event.getId(), subscription.getId(), attemptNumber, response.failureReason());
            return;
        }

        long delayMs = BackoffCalculator.computeDelayMs(
                policy, attemptNumber, delivery.getJitterRatio(), ThreadLocalRandom.current());
        outcomeRecorder.recordRetry(task, attempt, delayMs);
        log.info("Delivery of event {} to subscription {} failed on attempt {} ({}), retrying in {} ms",
                event.getId(), subscription.getId(), attemptNumber, response.failureReason(), delayMs);
    }

    /** Subscription'da tanımlı değilse varsayılan politika. */
    public RetryPolicy resolveRetryPolicy(Subscription subscription) {
        RetryPolicy configured = subscription.getRetryPolicy();
        AppProperties.DeliveryProperties delivery = appProperties.getDelivery();
        if (configured == null) {
            return RetryPolicy.builder()
                    .maxAttempts(delivery.getDefaultMaxAttempts())
                    .initialDelayMs(delivery.getDefaultInitialDelayMs())
                    .maxDelayMs(delivery.getDefaultMaxDelayMs())
                    .multiplier(delivery.getDefaultMultiplier())
                    .build();
        }
        return RetryPolicy.builder()
                .maxAttempts(configured.getMaxAttempts() > 0 ? configured.getMaxAttempts() : delivery.getDefaultMaxAttempts())
                .initialDelayMs(configured.getInitialDelayMs() > 0 ? configured.getInitialDelayMs() : delivery.getDefaultInitialDelayMs())
                .maxDelayMs(configured.getMaxDelayMs() > 0 ? configured.getMaxDelayMs() : delivery.getDefaultMaxDelayMs())
                .multiplier(configured.getMultiplier() >= 1.0 ? configured.getMultiplier() : delivery.getDefaultMultiplier())
                .build();
    }

    String buildPayload(Event event, DeliveryTask task) throws JsonProcessingException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("id", event.getId());
        payload.put("type", event.getType());
        payload.put("source", event.getSource());
        payload.set("data", withOverride(event.getData(), task.getDataOverride()));
        JsonNode metadata = withOverride(event.getMetadata(), task.getMetadataOverride());
        if (metadata != null) {
            payload.set("metadata", metadata);
        }
        payload.put("created_at", event.getCreatedAt() != null ? event.getCreatedAt().toString() : null);
        if (task.isReplay()) {
            payload.put("causation_id", task.getCausationId());
        }
        return objectMapper.writeValueAsString(payload);
    }

    private JsonNode withOverride(String json, String overrideJson) throws JsonProcessingException {
        JsonNode base = json != null ? objectMapper.readTree(json) : null;
        if (overrideJson == null) {
            return base;
        }
        return deepMerge(base, objectMapper.readTree(overrideJson));
    }

    /** Nesneler alan alan birleşir; diğer tüm durumlarda override kazanır. */
    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null || !base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(field ->
                merged.set(field.getKey(), deepMerge(merged.get(field.getKey()), field.getValue())));
        return merged;
    }

    private Map<String, String> buildHeaders(Subscription subscription, Event event, DeliveryTask task,
                                             int attemptNumber, String body) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (subscription.getCustomHeaders() != null) {
            headers.putAll(subscription.getCustomHeaders());
        }
        long timestamp = clock.instant().getEpochSecond();
        headers.put("User-Agent", appProperties.getDelivery().getUserAgent());
        headers.put(HEADER_WEBHOOK_ID, task.getId());
        headers.put(HEADER_EVENT_ID, event.getId());
        headers.put(HEADER_EVENT_TYPE, event.getType());
        headers.put(HEADER_ATTEMPT, String.valueOf(attemptNumber));
        headers.put(HEADER_TIMESTAMP, String.valueOf(timestamp));
        if (subscription.getSigningSecret() != null && !subscription.getSigningSecret().isEmpty()) {
            headers.put(HEADER_SIGNATURE, WebhookSigner.sign(subscription.getSigningSecret(), timestamp, body));
        }
        return headers;
    }

    private void deferPaused(DeliveryTask task, long delayMs) {
        if (deliveryTaskRepository.release(task.getId(), task.getLeaseToken(), delayMs)) {
            log.debug("Subscription {} paused, task {} deferred {} ms", task.getSubscriptionId(), task.getId(), delayMs);
        }
    }
}
