package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.BatchEventRequest;
import com.baykanat.triggers.api.dto.BatchEventResponse;
import com.baykanat.triggers.api.dto.BatchItemResult;
import com.baykanat.triggers.api.dto.EventRequest;
import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.exception.EventValidationException;
import com.baykanat.triggers.domain.exception.RateLimitExceededException;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventStatus;
import com.baykanat.triggers.domain.model.IngestionResult;
import com.baykanat.triggers.domain.model.RateLimitDecision;
import com.baykanat.triggers.infrastructure.kafka.EventKafkaProducer;
import com.baykanat.triggers.infrastructure.stream.StreamPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EventIngestionService.
 *
 * <p>Storage, rate limiting and the queue are mocked; validation and mapping are real:
 * <ul>
 *   <li>Idempotent replay returns the original event without re-enqueueing</li>
 *   <li>Requests without a key always create new events</li>
 *   <li>Rate limit denial surfaces as an exception before anything is written</li>
 *   <li>Batch items fail independently; fail_fast skips the rest</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class EventIngestionServiceTest {

    private static final ValidatorFactory VALIDATOR_FACTORY = Validation.buildDefaultValidatorFactory();

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private RateLimiterService rateLimiterService;

    @Mock
    private EventStore eventStore;

    @Mock
    private EventKafkaProducer kafkaProducer;

    @Mock
    private StreamPublisher streamPublisher;

    private final ApiCredential credential = ApiCredential.builder()
            .keyId("key_1")
            .accountId("acc_1")
            .scopes(Set.of(ApiCredential.SCOPE_EVENTS_WRITE))
            .tier("standard")
            .build();

    private EventIngestionService service;

    @AfterAll
    static void closeValidator() {
        VALIDATOR_FACTORY.close();
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        AppProperties appProperties = new AppProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        EventValidator validator = new EventValidator(VALIDATOR_FACTORY.getValidator(), objectMapper, appProperties);
        EventMapper eventMapper = Mappers.getMapper(EventMapper.class);

        service = new EventIngestionService(validator, idempotencyService, rateLimiterService, eventStore,
                kafkaProducer, streamPublisher, eventMapper, new IdGenerator(clock), appProperties, clock);

        lenient().when(rateLimiterService.check(any())).thenReturn(allowed());
        lenient().when(eventStore.persist(any())).thenAnswer(invocation -> IngestionResult.builder()
                .event(invocation.getArgument(0))
                .created(true)
                .build());
    }

    @Test
    @DisplayName("Same idempotency key twice returns the same event id, created once")
    void idempotentReplayReturnsSameEvent() throws Exception {
        EventRequest request = orderCreated(Map.of(EventRequest.IDEMPOTENCY_KEY, "k1"));

        IngestionResult first = service.ingest(credential, request);
        when(idempotencyService.findExisting("acc_1", "k1")).thenReturn(Optional.of(first.getEvent()));
        IngestionResult second = service.ingest(credential, request);

        assertThat(first.isCreated()).isTrue();
        assertThat(second.isCreated()).isFalse();
        assertThat(second.getEvent().getId()).isEqualTo(first.getEvent().getId());
        verify(eventStore, times(1)).persist(any());
        verify(kafkaProducer, times(1)).send(any());
        verify(rateLimiterService, times(1)).check(any());
    }

    @Test
    @DisplayName("Without an idempotency key two identical requests create two events")
    void noKeyCreatesDistinctEvents() {
        EventRequest request = orderCreated(null);

        IngestionResult first = service.ingest(credential, request);
        IngestionResult second = service.ingest(credential, request);

        assertThat(first.getEvent().getId()).startsWith("evt_");
        assertThat(second.getEvent().getId()).isNotEqualTo(first.getEvent().getId());
        assertThat(first.getEvent().getStatus()).isEqualTo(EventStatus.PENDING);
        assertThat(first.getEvent().getAccountId()).isEqualTo("acc_1");
        verify(idempotencyService, times(2)).findExisting(eq("acc_1"), isNull());
        verify(streamPublisher, times(2)).publish(any(Event.class));
    }

    @Test
    @DisplayName("Exhausted bucket rejects before persisting")
    void rateLimitedRequestIsRejected() {
        RateLimitDecision denied = RateLimitDecision.builder()
                .allowed(false).limit(100).remaining(0).resetAt(1735689660L).retryAfterSeconds(1).build();
        when(rateLimiterService.check(any())).thenReturn(denied);

        assertThatThrownBy(() -> service.ingest(credential, orderCreated(null)))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(e -> assertThat(((RateLimitExceededException) e).getDecision()).isSameAs(denied));
        verifyNoInteractions(eventStore, kafkaProducer, streamPublisher);
    }

    @Test
    @DisplayName("Invalid type is rejected with the offending field")
    void invalidTypeIsRejected() {
        EventRequest request = orderCreated(null);
        request.setType("order created!");

        assertThatThrownBy(() -> service.ingest(credential, request))
                .isInstanceOf(EventValidationException.class)
                .satisfies(e -> assertThat(((EventValidationException) e).getField()).isEqualTo("type"));
        verifyNoInteractions(eventStore);
    }

    @Test
    @DisplayName("Batch - one invalid entry does not abort the others")
    void batchPartialFailure() {
        EventRequest invalid = orderCreated(null);
        invalid.setType(null);
        invalid.setReferenceId("line-2");

        BatchEventResponse response = service.ingestBatch(credential, BatchEventRequest.builder()
                .events(List.of(orderCreated(null), invalid, orderCreated(null)))
                .build());

        assertThat(response.getSummary().getTotal()).isEqualTo(3);
        assertThat(response.getSummary().getSuccessful()).isEqualTo(2);
        assertThat(response.getSummary().getFailed()).isEqualTo(1);
        BatchItemResult failed = response.getResults().get(1);
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getReferenceId()).isEqualTo("line-2");
        assertThat(failed.getError().getCode()).isEqualTo("validation_error");
        assertThat(failed.getError().getField()).isEqualTo("type");
        assertThat(response.getResults().get(2).getOutcome()).isEqualTo(BatchItemResult.CREATED);
        assertThat(response.getRateLimit()).isNotNull();
    }

    @Test
    @DisplayName("Batch - fail_fast skips entries after the first failure")
    void batchFailFast() {
        EventRequest invalid = orderCreated(null);
        invalid.setSource("");

        BatchEventResponse response = service.ingestBatch(credential, BatchEventRequest.builder()
                .events(List.of(invalid, orderCreated(null), orderCreated(null)))
                .failFast(true)
                .build());

        assertThat(response.getSummary().getFailed()).isEqualTo(1);
        assertThat(response.getSummary().getSkipped()).isEqualTo(2);
        assertThat(response.getResults()).extracting(BatchItemResult::getOutcome)
                .containsExactly(BatchItemResult.FAILED, BatchItemResult.SKIPPED, BatchItemResult.SKIPPED);
        verifyNoInteractions(eventStore);
    }

    @Test
    @DisplayName("Batch - more than 100 entries rejects the whole request")
    void batchTooLarge() {
        List<EventRequest> events = new java.util.ArrayList<>();
        for (int i = 0; i < 101; i++) {
            events.add(orderCreated(null));
        }

        assertThatThrownBy(() -> service.ingestBatch(credential, BatchEventRequest.builder().events(events).build()))
                .isInstanceOf(EventValidationException.class);
        verify(idempotencyService, never()).findExisting(anyString(), any());
    }

    private static EventRequest orderCreated(Map<String, Object> metadata) {
        return EventRequest.builder()
                .type("order.created")
                .source("shop")
                .data(new HashMap<>(Map.of("id", "42")))
                .metadata(metadata != null ? new HashMap<>(metadata) : null)
                .build();
    }

    private static RateLimitDecision allowed() {
        return RateLimitDecision.builder()
                .allowed(true).limit(100).remaining(99).resetAt(1735689601L).retryAfterSeconds(0).build();
    }
}
