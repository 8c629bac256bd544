package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.DlqActionResponse;
import com.baykanat.triggers.api.dto.DlqBatchResponse;
import com.baykanat.triggers.domain.exception.ResourceNotFoundException;
import com.baykanat.triggers.domain.model.ApiCredential;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DlqBatchService.
 * Each event id is handled on its own; a missing item or a storage error is reported per event.
 */
@ExtendWith(MockitoExtension.class)
class DlqBatchServiceTest {

    @Mock
    private DlqService dlqService;

    private DlqBatchService dlqBatchService;

    private final ApiCredential admin = ApiCredential.builder()
            .keyId("key_admin")
            .accountId("acc_1")
            .scopes(Set.of(ApiCredential.SCOPE_ADMIN))
            .build();

    @BeforeEach
    void setUp() {
        dlqBatchService = new DlqBatchService(dlqService);
    }

    @Test
    @DisplayName("Retry batch reports success and not-found per event")
    void retryBatchMixedResults() {
        when(dlqService.retry(admin, "evt_1", null)).thenReturn(action("evt_1", "sub_1"));
        when(dlqService.retry(admin, "evt_404", null)).thenThrow(new ResourceNotFoundException("DLQ item", "evt_404"));

        DlqBatchResponse response = dlqBatchService.retryBatch(admin, List.of("evt_1", "evt_404"));

        assertThat(response.getTotal()).isEqualTo(2);
        assertThat(response.getSuccessful()).isEqualTo(1);
        assertThat(response.getFailed()).isEqualTo(1);
        assertThat(response.getResults().get(0).getSubscriptionIds()).containsExactly("sub_1");
        assertThat(response.getResults().get(1).isSuccess()).isFalse();
        assertThat(response.getResults().get(1).getError()).isEqualTo(DlqBatchService.ERROR_NOT_FOUND);
    }

    @Test
    @DisplayName("Dismiss batch keeps going after a storage error and processes duplicates once")
    void dismissBatchContinuesAfterFailure() {
        when(dlqService.dismiss(admin, "evt_1", null)).thenThrow(new DataAccessResourceFailureException("down"));
        when(dlqService.dismiss(admin, "evt_2", null)).thenReturn(action("evt_2", "sub_2"));

        DlqBatchResponse response = dlqBatchService.dismissBatch(admin, List.of("evt_1", "evt_2", "evt_2"));

        assertThat(response.getTotal()).isEqualTo(2);
        assertThat(response.getSuccessful()).isEqualTo(1);
        assertThat(response.getResults().get(0).getError()).isEqualTo("Storage error");
        verify(dlqService, times(1)).dismiss(admin, "evt_2", null);
    }

    private static DlqActionResponse action(String eventId, String subscriptionId) {
        return DlqActionResponse.builder()
                .eventId(eventId)
                .subscriptionIds(List.of(subscriptionId))
                .build();
    }
}
