package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.BatchEventRequest;
import com.baykanat.triggers.api.dto.BatchEventResponse;
import com.baykanat.triggers.api.dto.BatchItemResult;
import com.baykanat.triggers.api.dto.EventRequest;
import com.baykanat.triggers.api.filter.CorrelationIdFilter;
import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.exception.EventValidationException;
import com.baykanat.triggers.domain.exception.RateLimitExceededException;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventEnvelope;
import com.baykanat.triggers.domain.model.IngestionResult;
import com.baykanat.triggers.domain.model.RateLimitDecision;
import com.baykanat.triggers.infrastructure.kafka.EventKafkaProducer;
import com.baykanat.triggers.infrastructure.stream.StreamPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * HTTP tarafı ingestion: doğrulama → idempotency → rate limit → kalıcı yazım → kuyruk + stream.
 * Kuyruğa yazılamayan event pending kalır, recovery scheduler yeniden kuyruklar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventIngestionService {

    private final EventValidator eventValidator;
    private final IdempotencyService idempotencyService;
    private final RateLimiterService rateLimiterService;
    private final EventStore eventStore;
    private final EventKafkaProducer kafkaProducer;
    private final StreamPublisher streamPublisher;
    private final EventMapper eventMapper;
    private final IdGenerator idGenerator;
    private final AppProperties appProperties;
    private final Clock clock;

    /** Tek event. Aynı key ile tekrar gelen istek mevcut event'i created=false ile döner. */
    public IngestionResult ingest(ApiCredential credential, EventRequest request) {
        eventValidator.validate(request);

        String accountId = credential.getAccountId();
        Optional<Event> existing = idempotencyService.findExisting(accountId, request.getIdempotencyKey());
        if (existing.isPresent()) {
            log.debug("Idempotent replay for key={}, event_id={}", request.getIdempotencyKey(), existing.get().getId());
            return IngestionResult.builder().event(existing.get()).created(false).build();
        }

        RateLimitDecision decision = rateLimiterService.check(credential);
        if (!decision.isAllowed()) {
            throw new RateLimitExceededException(decision);
        }

        Event event = eventMapper.toEvent(request, idGenerator.newEventId(), accountId, Instant.now(clock));
        if (event.getCorrelationId() == null) {
            event.setCorrelationId(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
        }

        IngestionResult result = eventStore.persist(event).toBuilder().rateLimit(decision).build();
        if (!result.isCreated()) {
            return result;
        }

        enqueue(result.getEvent());
        streamPublisher.publish(result.getEvent());

        log.info("Accepted event id={}, type={}, source={}, account={}",
                event.getId(), event.getType(), event.getSource(), accountId);
        return result;
    }

    /** Her öğe tek event yolundan geçer; bir öğenin hatası diğerlerini etkilemez. */
    public BatchEventResponse ingestBatch(ApiCredential credential, BatchEventRequest batch) {
        List<EventRequest> events = batch.getEvents();
        if (events == null || events.isEmpty()) {
            throw new EventValidationException("events", "events list must not be empty");
        }
        if (events.size() > appProperties.getIngestion().getMaxBatchSize()) {
            throw new EventValidationException("events",
                    "Maximum " + appProperties.getIngestion().getMaxBatchSize() + " events per batch request");
        }
        eventValidator.validateBatchSize(batch);

        List<BatchItemResult> results = new ArrayList<>(events.size());
        RateLimitDecision lastDecision = null;
        int successful = 0;
        int failed = 0;
        int skipped = 0;
        boolean skipRest = false;

        for (int i = 0; i < events.size(); i++) {
            EventRequest request = events.get(i);
            String referenceId = request != null ? request.getReferenceId() : null;

            if (skipRest) {
                results.add(BatchItemResult.builder()
                        .index(i)
                        .referenceId(referenceId)
                        .success(false)
                        .outcome(BatchItemResult.SKIPPED)
                        .build());
                skipped++;
                continue;
            }

            BatchItemResult.ItemError error = null;
            try {
                IngestionResult result = ingest(credential, request);
                if (result.getRateLimit() != null) {
                    lastDecision = result.getRateLimit();
                }
                results.add(BatchItemResult.builder()
                        .index(i)
                        .referenceId(referenceId)
                        .success(true)
                        .outcome(result.isCreated() ? BatchItemResult.CREATED : BatchItemResult.REPLAYED)
                        .event(eventMapper.toResponse(result.getEvent()))
                        .build());
                successful++;
            } catch (EventValidationException e) {
                error = new BatchItemResult.ItemError("validation_error", e.getMessage(), e.getField());
            } catch (RateLimitExceededException e) {
                lastDecision = e.getDecision();
                error = new BatchItemResult.ItemError("rate_limited", e.getMessage(), null);
            } catch (Exception e) {
                log.error("Batch entry {} failed: {}", i, e.getMessage(), e);
                error = new BatchItemResult.ItemError("internal_error", "Failed to ingest event", null);
            }

            if (error != null) {
                results.add(BatchItemResult.builder()
                        .index(i)
                        .referenceId(referenceId)
                        .success(false)
                        .outcome(BatchItemResult.FAILED)
                        .error(error)
                        .build());
                failed++;
                skipRest = batch.isFailFast();
            }
        }

        log.info("Processed batch: {} successful, {} failed, {} skipped", successful, failed, skipped);
        return BatchEventResponse.builder()
                .results(results)
                .summary(new BatchEventResponse.Summary(events.size(), successful, failed, skipped))
                .rateLimit(lastDecision)
                .build();
    }

    /** Kuyruğa yazım hatası isteği düşürmez; event pending kalır ve recovery job tarafından tekrar denenir. */
    private void enqueue(Event event) {
        EventEnvelope envelope = EventEnvelope.builder()
                .eventId(event.getId())
                .accountId(event.getAccountId())
                .correlationId(event.getCorrelationId())
                .build();
        try {
            if (!kafkaProducer.send(envelope)) {
                log.warn("Event {} not queued; recovery scheduler will re-enqueue it", event.getId());
            }
        } catch (Exception e) {
            log.warn("Event {} not queued ({}); recovery scheduler will re-enqueue it", event.getId(), e.getMessage());
        }
    }
}
