package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.DlqActionResponse;
import com.baykanat.triggers.api.dto.DlqItemResponse;
import com.baykanat.triggers.api.dto.DlqListResponse;
import com.baykanat.triggers.domain.exception.ResourceNotFoundException;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.model.DeliveryTaskStatus;
import com.baykanat.triggers.domain.model.DlqItem;
import com.baykanat.triggers.infrastructure.persistence.DeliveryTaskJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.DlqJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DlqService operator actions.
 * Verifies that retry re-queues the task and reopens the event counters
 * only for original deliveries, and that dismiss cancels open tasks.
 */
@ExtendWith(MockitoExtension.class)
class DlqServiceTest {

    @Mock
    private DlqJdbcRepository dlqRepository;

    @Mock
    private DeliveryTaskJdbcRepository deliveryTaskRepository;

    @Mock
    private EventJdbcRepository eventRepository;

    private DlqService dlqService;

    private final ApiCredential admin = ApiCredential.builder()
            .keyId("key_admin")
            .accountId("acc_1")
            .scopes(Set.of(ApiCredential.SCOPE_ADMIN))
            .build();

    @BeforeEach
    void setUp() {
        dlqService = new DlqService(dlqRepository, deliveryTaskRepository, eventRepository,
                Mappers.getMapper(EventMapper.class));
    }

    @Test
    @DisplayName("Retry resets the task, removes the DLQ item and reopens the event")
    void retryReopensOriginalDelivery() {
        when(dlqRepository.findByEvent("acc_1", "evt_1", null)).thenReturn(List.of(item("sub_1", "tsk_1")));
        when(deliveryTaskRepository.findById("tsk_1")).thenReturn(Optional.of(task("tsk_1", null)));
        when(deliveryTaskRepository.resetForRetry("tsk_1")).thenReturn(true);

        DlqActionResponse response = dlqService.retry(admin, "evt_1", null);

        assertThat(response.getAction()).isEqualTo(DlqService.ACTION_RETRIED);
        assertThat(response.getSubscriptionIds()).containsExactly("sub_1");
        verify(dlqRepository).delete("tsk_1");
        verify(eventRepository).reopenFailedDelivery("evt_1");
    }

    @Test
    @DisplayName("Retry of a replay task leaves event counters untouched")
    void retryOfReplayTaskDoesNotReopen() {
        when(dlqRepository.findByEvent("acc_1", "evt_1", "sub_1")).thenReturn(List.of(item("sub_1", "tsk_2")));
        when(deliveryTaskRepository.findById("tsk_2")).thenReturn(Optional.of(task("tsk_2", "evt_1")));
        when(deliveryTaskRepository.resetForRetry("tsk_2")).thenReturn(true);

        dlqService.retry(admin, "evt_1", "sub_1");

        verify(dlqRepository).delete("tsk_2");
        verify(eventRepository, never()).reopenFailedDelivery(anyString());
    }

    @Test
    @DisplayName("Retry skips items whose task is no longer dead-lettered")
    void retrySkipsStaleItems() {
        when(dlqRepository.findByEvent("acc_1", "evt_1", null)).thenReturn(List.of(item("sub_1", "tsk_1")));
        when(deliveryTaskRepository.findById("tsk_1")).thenReturn(Optional.of(task("tsk_1", null)));
        when(deliveryTaskRepository.resetForRetry("tsk_1")).thenReturn(false);

        DlqActionResponse response = dlqService.retry(admin, "evt_1", null);

        assertThat(response.getSubscriptionIds()).isEmpty();
        verify(dlqRepository, never()).delete(anyString());
        verify(eventRepository, never()).reopenFailedDelivery(anyString());
    }

    @Test
    @DisplayName("Original and replay failures of one pair are separate items, retry re-queues both and reopens once")
    void retryOfOriginalAndReplayItemsReopensOnce() {
        when(dlqRepository.findByEvent("acc_1", "evt_1", "sub_1"))
                .thenReturn(List.of(item("sub_1", "tsk_orig"), item("sub_1", "tsk_replay")));
        when(deliveryTaskRepository.findById("tsk_orig")).thenReturn(Optional.of(task("tsk_orig", null)));
        when(deliveryTaskRepository.findById("tsk_replay")).thenReturn(Optional.of(task("tsk_replay", "evt_1")));
        when(deliveryTaskRepository.resetForRetry(anyString())).thenReturn(true);

        DlqActionResponse response = dlqService.retry(admin, "evt_1", "sub_1");

        assertThat(response.getSubscriptionIds()).containsExactly("sub_1");
        verify(deliveryTaskRepository).resetForRetry("tsk_orig");
        verify(deliveryTaskRepository).resetForRetry("tsk_replay");
        verify(dlqRepository).delete("tsk_orig");
        verify(dlqRepository).delete("tsk_replay");
        verify(eventRepository, times(1)).reopenFailedDelivery("evt_1");
    }

    @Test
    @DisplayName("Dismiss removes the items and cancels open replay tasks once per pair")
    void dismissCancelsOpenReplayTasks() {
        when(dlqRepository.findByEvent("acc_1", "evt_1", null))
                .thenReturn(List.of(item("sub_1", "tsk_1"), item("sub_1", "tsk_3"), item("sub_2", "tsk_2")));
        when(dlqRepository.delete(anyString())).thenReturn(true);

        DlqActionResponse response = dlqService.dismiss(admin, "evt_1", null);

        assertThat(response.getAction()).isEqualTo(DlqService.ACTION_DISMISSED);
        assertThat(response.getSubscriptionIds()).containsExactly("sub_1", "sub_2");
        verify(dlqRepository).delete("tsk_1");
        verify(dlqRepository).delete("tsk_3");
        verify(dlqRepository).delete("tsk_2");
        verify(deliveryTaskRepository, times(1)).cancelOpenReplayTasks(eq("evt_1"), eq("sub_1"), anyString());
        verify(deliveryTaskRepository, times(1)).cancelOpenReplayTasks(eq("evt_1"), eq("sub_2"), anyString());
        verifyNoInteractions(eventRepository);
    }

    @Test
    @DisplayName("Items of one event are returned with their task ids")
    void getItemsMapsTaskIds() {
        when(dlqRepository.findByEvent("acc_1", "evt_1", null))
                .thenReturn(List.of(item("sub_1", "tsk_orig"), item("sub_1", "tsk_replay")));

        List<DlqItemResponse> items = dlqService.getItems("acc_1", "evt_1");

        assertThat(items).extracting(DlqItemResponse::getTaskId).containsExactly("tsk_orig", "tsk_replay");
        assertThat(items).extracting(DlqItemResponse::getSubscriptionId).containsOnly("sub_1");
    }

    @Test
    @DisplayName("Unknown DLQ item is 404")
    void unknownItemIsNotFound() {
        when(dlqRepository.findByEvent("acc_1", "evt_404", null)).thenReturn(List.of());

        assertThatThrownBy(() -> dlqService.retry(admin, "evt_404", null))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> dlqService.dismiss(admin, "evt_404", null))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> dlqService.getItems("acc_1", "evt_404"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("List clamps the page size to 100")
    void listClampsPageSize() {
        when(dlqRepository.list("acc_1", null, null, 100, 0)).thenReturn(List.of(item("sub_1", "tsk_1")));
        when(dlqRepository.count("acc_1")).thenReturn(1);

        DlqListResponse response = dlqService.list("acc_1", null, null, 5000, -3);

        assertThat(response.getLimit()).isEqualTo(100);
        assertThat(response.getOffset()).isZero();
        assertThat(response.getItems()).hasSize(1);
        assertThat(response.getTotal()).isEqualTo(1);
    }

    private static DlqItem item(String subscriptionId, String taskId) {
        return DlqItem.builder()
                .eventId("evt_1")
                .subscriptionId(subscriptionId)
                .taskId(taskId)
                .accountId("acc_1")
                .eventType("order.created")
                .failureReason("HTTP 500")
                .build();
    }

    private static DeliveryTask task(String id, String causationId) {
        return DeliveryTask.builder()
                .id(id)
                .eventId("evt_1")
                .subscriptionId("sub_1")
                .status(DeliveryTaskStatus.DEAD_LETTERED)
                .attemptNumber(5)
                .causationId(causationId)
                .build();
    }
}
