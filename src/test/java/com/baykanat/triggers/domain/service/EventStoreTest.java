package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventStatus;
import com.baykanat.triggers.domain.model.IngestionResult;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for EventStore: idempotency reservation and the lost-race branch.
 */
@ExtendWith(MockitoExtension.class)
class EventStoreTest {

    @Mock
    private EventJdbcRepository eventRepository;

    @Mock
    private IdempotencyService idempotencyService;

    @InjectMocks
    private EventStore eventStore;

    @Test
    @DisplayName("Event without idempotency key is inserted without reservation")
    void persistWithoutKey() {
        Event event = event("evt_1", null);

        IngestionResult result = eventStore.persist(event);

        assertThat(result.isCreated()).isTrue();
        assertThat(result.getEvent()).isSameAs(event);
        verify(eventRepository).insert(event);
        verifyNoInteractions(idempotencyService);
    }

    @Test
    @DisplayName("Won reservation inserts the event")
    void persistWithReservedKey() {
        Event event = event("evt_1", "order-42");
        when(idempotencyService.reserve("acc_1", "order-42", "evt_1")).thenReturn(true);

        IngestionResult result = eventStore.persist(event);

        assertThat(result.isCreated()).isTrue();
        verify(eventRepository).insert(event);
    }

    @Test
    @DisplayName("Lost reservation returns the winner's event and writes nothing")
    void lostRaceReturnsWinner() {
        Event event = event("evt_loser", "order-42");
        Event winner = event("evt_winner", "order-42");
        when(idempotencyService.reserve("acc_1", "order-42", "evt_loser")).thenReturn(false);
        when(idempotencyService.findExisting("acc_1", "order-42")).thenReturn(Optional.of(winner));

        IngestionResult result = eventStore.persist(event);

        assertThat(result.isCreated()).isFalse();
        assertThat(result.getEvent().getId()).isEqualTo("evt_winner");
        verify(eventRepository, never()).insert(any());
    }

    @Test
    @DisplayName("Reserved key without a stored event is reported as an inconsistency")
    void lostRaceWithoutWinnerFails() {
        Event event = event("evt_loser", "order-42");
        when(idempotencyService.reserve("acc_1", "order-42", "evt_loser")).thenReturn(false);
        when(idempotencyService.findExisting("acc_1", "order-42")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> eventStore.persist(event))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("order-42");
        verify(eventRepository, never()).insert(any());
    }

    private static Event event(String id, String idempotencyKey) {
        return Event.builder()
                .id(id)
                .accountId("acc_1")
                .type("order.created")
                .source("shop")
                .data("{}")
                .idempotencyKey(idempotencyKey)
                .status(EventStatus.PENDING)
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }
}
