package com.baykanat.triggers.api.controller;

import com.baykanat.triggers.api.dto.InboxAckRequest;
import com.baykanat.triggers.api.dto.InboxAckResponse;
import com.baykanat.triggers.api.dto.InboxListResponse;
import com.baykanat.triggers.api.dto.InboxStatsResponse;
import com.baykanat.triggers.api.dto.InboxVisibilityRequest;
import com.baykanat.triggers.api.dto.InboxVisibilityResponse;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.service.InboxService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/inbox")
@RequiredArgsConstructor
@Tag(name = "Inbox", description = "Pull-based consumption with visibility timeouts")
public class InboxController {

    private final InboxService inboxService;

    @GetMapping
    @Operation(summary = "Lease unacknowledged events",
            description = "Returned items are hidden for visibility_timeout seconds and must be acknowledged with their receipt handle")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Leased page"),
            @ApiResponse(responseCode = "400", description = "Malformed cursor"),
            @ApiResponse(responseCode = "403", description = "Missing inbox:read scope")
    })
    public InboxListResponse list(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @Parameter(description = "Page size, 1-100") @RequestParam(required = false) Integer limit,
            @Parameter(description = "Cursor from the previous page") @RequestParam(required = false) String cursor,
            @Parameter(description = "Lease duration in seconds, max 43200")
            @RequestParam(name = "visibility_timeout", required = false) Integer visibilityTimeout,
            @Parameter(description = "Only these event types, repeatable")
            @RequestParam(name = "event_types", required = false) List<String> eventTypes,
            @Parameter(description = "Only these sources, repeatable")
            @RequestParam(required = false) List<String> sources) {
        credential.requireScope(ApiCredential.SCOPE_INBOX_READ);
        return inboxService.list(credential.getAccountId(), cursor, limit, visibilityTimeout, eventTypes, sources);
    }

    @PostMapping("/ack")
    @Operation(summary = "Acknowledge leased events", description = "Unknown, expired or already acknowledged handles are ignored")
    public InboxAckResponse acknowledge(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @Valid @RequestBody InboxAckRequest request) {
        credential.requireScope(ApiCredential.SCOPE_INBOX_READ);
        return inboxService.acknowledge(credential.getAccountId(), request.getReceiptHandles());
    }

    @PostMapping("/visibility")
    @Operation(summary = "Change the lease of a leased event", description = "visibility_timeout 0 releases the event immediately")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lease changed"),
            @ApiResponse(responseCode = "404", description = "Unknown, expired or acknowledged receipt handle")
    })
    public InboxVisibilityResponse changeVisibility(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @Valid @RequestBody InboxVisibilityRequest request) {
        credential.requireScope(ApiCredential.SCOPE_INBOX_READ);
        return inboxService.changeVisibility(
                credential.getAccountId(), request.getReceiptHandle(), request.getVisibilityTimeout());
    }

    @GetMapping("/stats")
    @Operation(summary = "Inbox counts", description = "Visible, leased and total unacknowledged events with a per-type breakdown")
    public InboxStatsResponse stats(@RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential) {
        credential.requireScope(ApiCredential.SCOPE_INBOX_READ);
        return inboxService.stats(credential.getAccountId());
    }
}
