package com.baykanat.triggers.api.controller;

import com.baykanat.triggers.api.dto.DlqActionResponse;
import com.baykanat.triggers.api.dto.DlqBatchResponse;
import com.baykanat.triggers.api.dto.DlqItemResponse;
import com.baykanat.triggers.api.dto.DlqStatsResponse;
import com.baykanat.triggers.domain.exception.ResourceNotFoundException;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.service.ApiKeyService;
import com.baykanat.triggers.domain.service.DlqBatchService;
import com.baykanat.triggers.domain.service.DlqService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for DlqController: admin scope enforcement and operator actions.
 */
@WebMvcTest(DlqController.class)
class DlqControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DlqService dlqService;

    @MockitoBean
    private DlqBatchService dlqBatchService;

    @MockitoBean
    private ApiKeyService apiKeyService;

    private final ApiCredential admin = ApiCredential.builder()
            .keyId("key_admin").accountId("acc_1").scopes(Set.of(ApiCredential.SCOPE_ADMIN)).build();

    @BeforeEach
    void setUp() {
        when(apiKeyService.authenticate("tk_admin")).thenReturn(admin);
        when(apiKeyService.authenticate("tk_writer")).thenReturn(ApiCredential.builder()
                .keyId("key_w").accountId("acc_1").scopes(Set.of(ApiCredential.SCOPE_EVENTS_WRITE)).build());
    }

    @Test
    @DisplayName("GET /dlq/stats - admin key gets counts by event type")
    void statsForAdmin() throws Exception {
        when(dlqService.stats("acc_1"))
                .thenReturn(DlqStatsResponse.builder().total(3).byEventType(Map.of("order.created", 3)).build());

        mockMvc.perform(get("/dlq/stats").header("X-API-Key", "tk_admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.by_event_type['order.created']").value(3));
    }

    @Test
    @DisplayName("DLQ endpoints require the admin scope")
    void nonAdminIsForbidden() throws Exception {
        mockMvc.perform(get("/dlq").header("X-API-Key", "tk_writer"))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/dlq/evt_1/retry").header("X-API-Key", "tk_writer"))
                .andExpect(status().isForbidden());
        verifyNoInteractions(dlqService);
    }

    @Test
    @DisplayName("POST /dlq/{eventId}/retry - passes the optional subscription filter")
    void retryWithSubscription() throws Exception {
        when(dlqService.retry(eq(admin), eq("evt_1"), eq("sub_1"))).thenReturn(DlqActionResponse.builder()
                .eventId("evt_1").action(DlqService.ACTION_RETRIED).subscriptionIds(List.of("sub_1")).build());

        mockMvc.perform(post("/dlq/evt_1/retry").param("subscription_id", "sub_1").header("X-API-Key", "tk_admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("retried"));
    }

    @Test
    @DisplayName("DELETE /dlq/{eventId} - unknown item returns 404")
    void dismissUnknownReturns404() throws Exception {
        when(dlqService.dismiss(any(), eq("evt_404"), isNull()))
                .thenThrow(new ResourceNotFoundException("DLQ item", "evt_404"));

        mockMvc.perform(delete("/dlq/evt_404").header("X-API-Key", "tk_admin"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("DLQ item not found: evt_404"));
    }

    @Test
    @DisplayName("GET /dlq/{eventId} - lists original and replay items separately")
    void getItemsOfEvent() throws Exception {
        when(dlqService.getItems("acc_1", "evt_1")).thenReturn(List.of(
                DlqItemResponse.builder().eventId("evt_1").subscriptionId("sub_1").taskId("tsk_a").build(),
                DlqItemResponse.builder().eventId("evt_1").subscriptionId("sub_1").taskId("tsk_b").build()));

        mockMvc.perform(get("/dlq/evt_1").header("X-API-Key", "tk_admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].task_id").value("tsk_a"))
                .andExpect(jsonPath("$[1].task_id").value("tsk_b"));
    }

    @Test
    @DisplayName("POST /dlq/retry/batch - returns per-event results")
    void retryBatch() throws Exception {
        when(dlqBatchService.retryBatch(eq(admin), eq(List.of("evt_1", "evt_404")))).thenReturn(DlqBatchResponse.builder()
                .total(2).successful(1).failed(1)
                .results(List.of(
                        DlqBatchResponse.Result.builder().eventId("evt_1").success(true).subscriptionIds(List.of("sub_1")).build(),
                        DlqBatchResponse.Result.builder().eventId("evt_404").success(false).error("Item not found in DLQ").build()))
                .build());

        mockMvc.perform(post("/dlq/retry/batch")
                        .header("X-API-Key", "tk_admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_ids\":[\"evt_1\",\"evt_404\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successful").value(1))
                .andExpect(jsonPath("$.results[1].error").value("Item not found in DLQ"));
    }

    @Test
    @DisplayName("POST /dlq/dismiss/batch - empty event_ids is rejected")
    void dismissBatchRequiresIds() throws Exception {
        mockMvc.perform(post("/dlq/dismiss/batch")
                        .header("X-API-Key", "tk_admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_ids\":[]}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(dlqBatchService);
    }
}
