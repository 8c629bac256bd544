package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.IdempotencyJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for IdempotencyService.
 *
 * <p>The index is scoped per account: the same key under two accounts maps to two different events.
 * Repositories are mocked, so no database is needed.
 */
@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    @Mock
    private IdempotencyJdbcRepository idempotencyRepository;

    @Mock
    private EventJdbcRepository eventRepository;

    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        idempotencyService = new IdempotencyService(idempotencyRepository, eventRepository, new AppProperties());
    }

    @Test
    @DisplayName("Active key returns the event it is bound to")
    void activeKeyReturnsBoundEvent() {
        Event event = Event.builder().id("evt_1").accountId("acc_1").build();
        when(idempotencyRepository.findActiveEventId("acc_1", "order-1")).thenReturn(Optional.of("evt_1"));
        when(eventRepository.findById("evt_1")).thenReturn(Optional.of(event));

        assertThat(idempotencyService.findExisting("acc_1", "order-1")).contains(event);
    }

    @Test
    @DisplayName("Same key under another account is not a duplicate")
    void keyIsScopedPerAccount() {
        when(idempotencyRepository.findActiveEventId("acc_2", "order-1")).thenReturn(Optional.empty());

        assertThat(idempotencyService.findExisting("acc_2", "order-1")).isEmpty();
        verify(eventRepository, never()).findById(anyString());
    }

    @Test
    @DisplayName("Missing key never hits the index")
    void missingKeySkipsLookup() {
        assertThat(idempotencyService.findExisting("acc_1", null)).isEmpty();
        verifyNoInteractions(idempotencyRepository, eventRepository);
    }

    @Test
    @DisplayName("Reserve uses the configured 24h TTL and reports a lost race")
    void reserveUsesConfiguredTtl() {
        when(idempotencyRepository.reserve("acc_1", "order-1", "evt_1", 86400L)).thenReturn(true);
        when(idempotencyRepository.reserve("acc_1", "order-1", "evt_2", 86400L)).thenReturn(false);

        assertThat(idempotencyService.reserve("acc_1", "order-1", "evt_1")).isTrue();
        assertThat(idempotencyService.reserve("acc_1", "order-1", "evt_2")).isFalse();
    }
}
