package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.model.DeliveryTaskStatus;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventStatus;
import com.baykanat.triggers.domain.model.Subscription;
import com.baykanat.triggers.domain.model.SubscriptionStatus;
import com.baykanat.triggers.infrastructure.persistence.DeliveryTaskJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.SubscriptionJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DispatcherService fan-out.
 */
@ExtendWith(MockitoExtension.class)
class DispatcherServiceTest {

    @Mock
    private EventJdbcRepository eventRepository;

    @Mock
    private SubscriptionJdbcRepository subscriptionRepository;

    @Mock
    private DeliveryTaskJdbcRepository deliveryTaskRepository;

    private DispatcherService dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new DispatcherService(eventRepository, subscriptionRepository, deliveryTaskRepository,
                new IdGenerator(Clock.systemUTC()));
    }

    @Test
    @DisplayName("Zero matching subscriptions marks the event delivered with no tasks")
    void zeroMatchesMarksDelivered() {
        when(eventRepository.findById("evt_1")).thenReturn(Optional.of(pendingEvent()));
        when(subscriptionRepository.findActiveByAccount("acc_1")).thenReturn(List.of(subscription("sub_1", "invoice.*")));

        int created = dispatcher.dispatch("evt_1");

        assertThat(created).isZero();
        verify(eventRepository).markDispatched("evt_1", 0, EventStatus.DELIVERED);
        verifyNoInteractions(deliveryTaskRepository);
    }

    @Test
    @DisplayName("One task per matching subscription, event moves to processing")
    void createsTaskPerMatch() {
        when(eventRepository.findById("evt_1")).thenReturn(Optional.of(pendingEvent()));
        when(subscriptionRepository.findActiveByAccount("acc_1")).thenReturn(List.of(
                subscription("sub_1", "order.*"),
                subscription("sub_2", "invoice.*"),
                subscription("sub_3", "*")));
        when(eventRepository.markDispatched("evt_1", 2, EventStatus.PROCESSING)).thenReturn(1);

        int created = dispatcher.dispatch("evt_1");

        assertThat(created).isEqualTo(2);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DeliveryTask>> captor = ArgumentCaptor.forClass(List.class);
        verify(deliveryTaskRepository).batchInsert(captor.capture());
        assertThat(captor.getValue()).extracting(DeliveryTask::getSubscriptionId).containsExactly("sub_1", "sub_3");
        assertThat(captor.getValue()).allSatisfy(task -> {
            assertThat(task.getStatus()).isEqualTo(DeliveryTaskStatus.PENDING);
            assertThat(task.getAttemptNumber()).isZero();
            assertThat(task.isReplay()).isFalse();
        });
    }

    @Test
    @DisplayName("Already dispatched event is skipped on redelivery of the queue message")
    void nonPendingEventIsSkipped() {
        Event event = pendingEvent();
        event.setStatus(EventStatus.PROCESSING);
        when(eventRepository.findById("evt_1")).thenReturn(Optional.of(event));

        assertThat(dispatcher.dispatch("evt_1")).isZero();
        verifyNoInteractions(subscriptionRepository, deliveryTaskRepository);
        verify(eventRepository, never()).markDispatched(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("Replay tasks carry the causation id")
    void replayTasksCarryCausation() {
        int created = dispatcher.enqueueReplay(pendingEvent(), List.of(subscription("sub_1", "*")),
                "{\"status\":\"fixed\"}", null);

        assertThat(created).isEqualTo(1);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DeliveryTask>> captor = ArgumentCaptor.forClass(List.class);
        verify(deliveryTaskRepository).batchInsert(captor.capture());
        assertThat(captor.getValue().get(0).getCausationId()).isEqualTo("evt_1");
        assertThat(captor.getValue().get(0).getDataOverride()).isEqualTo("{\"status\":\"fixed\"}");
        assertThat(captor.getValue().get(0).getMetadataOverride()).isNull();
        verify(eventRepository, never()).markDispatched(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("Replay with no targets writes nothing")
    void replayWithoutTargets() {
        assertThat(dispatcher.enqueueReplay(pendingEvent(), List.of(), null, null)).isZero();
        verify(deliveryTaskRepository, never()).batchInsert(anyList());
    }

    private static Event pendingEvent() {
        return Event.builder()
                .id("evt_1")
                .accountId("acc_1")
                .type("order.created")
                .source("shop")
                .data("{\"id\":\"42\"}")
                .status(EventStatus.PENDING)
                .build();
    }

    private static Subscription subscription(String id, String typePattern) {
        return Subscription.builder()
                .id(id)
                .accountId("acc_1")
                .url("https://example.test/" + id)
                .eventTypes(List.of(typePattern))
                .status(SubscriptionStatus.ACTIVE)
                .build();
    }
}
