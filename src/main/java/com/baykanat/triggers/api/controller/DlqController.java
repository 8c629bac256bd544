package com.baykanat.triggers.api.controller;

import com.baykanat.triggers.api.dto.DlqActionResponse;
import com.baykanat.triggers.api.dto.DlqBatchRequest;
import com.baykanat.triggers.api.dto.DlqBatchResponse;
import com.baykanat.triggers.api.dto.DlqItemResponse;
import com.baykanat.triggers.api.dto.DlqListResponse;
import com.baykanat.triggers.api.dto.DlqStatsResponse;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.service.DlqBatchService;
import com.baykanat.triggers.domain.service.DlqService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Dead-letter yönetimi; admin scope gerekir. */
@RestController
@RequestMapping("/dlq")
@RequiredArgsConstructor
@Tag(name = "Dead Letter Queue", description = "Inspect, retry and dismiss exhausted deliveries")
public class DlqController {

    private final DlqService dlqService;
    private final DlqBatchService dlqBatchService;

    @GetMapping
    @Operation(summary = "List dead-lettered deliveries")
    public DlqListResponse list(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @RequestParam(name = "event_type", required = false) String eventType,
            @RequestParam(name = "subscription_id", required = false) String subscriptionId,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        credential.requireScope(ApiCredential.SCOPE_ADMIN);
        return dlqService.list(credential.getAccountId(), eventType, subscriptionId, limit, offset);
    }

    @GetMapping("/stats")
    @Operation(summary = "Dead-letter counts by event type")
    public DlqStatsResponse stats(@RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential) {
        credential.requireScope(ApiCredential.SCOPE_ADMIN);
        return dlqService.stats(credential.getAccountId());
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Dead-lettered deliveries of one event")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "DLQ items of the event"),
            @ApiResponse(responseCode = "404", description = "No DLQ item for the event")
    })
    public List<DlqItemResponse> get(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @PathVariable String eventId) {
        credential.requireScope(ApiCredential.SCOPE_ADMIN);
        return dlqService.getItems(credential.getAccountId(), eventId);
    }

    @PostMapping("/{eventId}/retry")
    @Operation(summary = "Retry dead-lettered deliveries", description = "Resets the task to attempt 0 and removes the DLQ item")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deliveries re-queued"),
            @ApiResponse(responseCode = "404", description = "No DLQ item for the event")
    })
    public DlqActionResponse retry(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @PathVariable String eventId,
            @RequestParam(name = "subscription_id", required = false) String subscriptionId) {
        credential.requireScope(ApiCredential.SCOPE_ADMIN);
        return dlqService.retry(credential, eventId, subscriptionId);
    }

    @DeleteMapping("/{eventId}")
    @Operation(summary = "Dismiss dead-lettered deliveries", description = "Removes the item and cancels pending tasks for the pair")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Dismissed"),
            @ApiResponse(responseCode = "404", description = "No DLQ item for the event")
    })
    public DlqActionResponse dismiss(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @PathVariable String eventId,
            @RequestParam(name = "subscription_id", required = false) String subscriptionId) {
        credential.requireScope(ApiCredential.SCOPE_ADMIN);
        return dlqService.dismiss(credential, eventId, subscriptionId);
    }

    @PostMapping("/retry/batch")
    @Operation(summary = "Retry the DLQ items of several events", description = "Each event is processed independently")
    public DlqBatchResponse retryBatch(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @Valid @RequestBody DlqBatchRequest request) {
        credential.requireScope(ApiCredential.SCOPE_ADMIN);
        return dlqBatchService.retryBatch(credential, request.getEventIds());
    }

    @PostMapping("/dismiss/batch")
    @Operation(summary = "Dismiss the DLQ items of several events", description = "Each event is processed independently")
    public DlqBatchResponse dismissBatch(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @Valid @RequestBody DlqBatchRequest request) {
        credential.requireScope(ApiCredential.SCOPE_ADMIN);
        return dlqBatchService.dismissBatch(credential, request.getEventIds());
    }
}
