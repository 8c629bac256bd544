package com.baykanat.triggers.api.controller;

import com.baykanat.triggers.api.dto.BatchEventRequest;
import com.baykanat.triggers.api.dto.BatchEventResponse;
import com.baykanat.triggers.api.dto.EventDetailResponse;
import com.baykanat.triggers.api.dto.EventListResponse;
import com.baykanat.triggers.api.dto.EventRequest;
import com.baykanat.triggers.api.dto.EventResponse;
import com.baykanat.triggers.api.dto.ReplayRequest;
import com.baykanat.triggers.api.dto.ReplayResponse;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.model.IngestionResult;
import com.baykanat.triggers.domain.service.EventIngestionService;
import com.baykanat.triggers.domain.service.EventQueryService;
import com.baykanat.triggers.domain.service.ReplayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/** POST /events, POST /events/batch, GET /events, GET /events/{id}, POST /events/{id}/replay. */
@Slf4j
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Event ingestion, lookup and replay")
public class EventController {

    private final EventIngestionService ingestionService;
    private final EventQueryService queryService;
    private final ReplayService replayService;
    private final EventMapper eventMapper;

    /** Yeni event → 201, aynı metadata.idempotency_key ile tekrar → 200 ve aynı event. */
    @PostMapping
    @Operation(summary = "Ingest a single event",
            description = "Persists the event and queues it for delivery to matching subscriptions")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Event created"),
            @ApiResponse(responseCode = "200", description = "Idempotent replay, existing event returned"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid API key"),
            @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    })
    public ResponseEntity<EventResponse> ingestEvent(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @Valid @RequestBody EventRequest request) {
        credential.requireScope(ApiCredential.SCOPE_EVENTS_WRITE);
        log.debug("Received event: type={}, source={}", request.getType(), request.getSource());

        IngestionResult result = ingestionService.ingest(credential, request);
        return ResponseEntity.status(result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK)
                .headers(RateLimitHeaders.of(result.getRateLimit()))
                .body(eventMapper.toResponse(result.getEvent()));
    }

    /** En fazla 100 event; öğe bazlı sonuç döner, bir öğenin hatası diğerlerini etkilemez. */
    @PostMapping("/batch")
    @Operation(summary = "Ingest a batch of events", description = "Accepts up to 100 events; each item is processed independently")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Per-item results"),
            @ApiResponse(responseCode = "400", description = "Batch too large or malformed"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid API key")
    })
    public ResponseEntity<BatchEventResponse> ingestBatch(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @RequestBody BatchEventRequest batchRequest) {
        credential.requireScope(ApiCredential.SCOPE_EVENTS_WRITE);
        log.debug("Received batch request with {} events",
                batchRequest.getEvents() != null ? batchRequest.getEvents().size() : 0);

        BatchEventResponse response = ingestionService.ingestBatch(credential, batchRequest);
        return ResponseEntity.ok()
                .headers(RateLimitHeaders.of(response.getRateLimit()))
                .body(response);
    }

    @GetMapping
    @Operation(summary = "List events", description = "Newest first, filtered by type, source, status and creation time")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of events"),
            @ApiResponse(responseCode = "400", description = "Unknown status, bad timestamp or malformed cursor")
    })
    public EventListResponse listEvents(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @RequestParam(name = "event_type", required = false) String eventType,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String status,
            @Parameter(description = "ISO-8601, inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @Parameter(description = "ISO-8601, inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant until,
            @RequestParam(required = false) String cursor,
            @Parameter(description = "Page size, 1-100") @RequestParam(required = false) Integer limit) {
        credential.requireScope(ApiCredential.SCOPE_EVENTS_READ);
        return queryService.list(credential.getAccountId(), eventType, source, status, since, until, cursor, limit);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an event", description = "Returns the event with its per-subscription delivery summary and attempts")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event found"),
            @ApiResponse(responseCode = "404", description = "Unknown event")
    })
    public EventDetailResponse getEvent(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @PathVariable String id) {
        credential.requireScope(ApiCredential.SCOPE_EVENTS_READ);
        return queryService.getEvent(credential.getAccountId(), id);
    }

    @PostMapping("/{id}/replay")
    @Operation(summary = "Replay an event", description = "Re-delivers a stored event; dry_run only lists the targets")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Replay queued"),
            @ApiResponse(responseCode = "200", description = "Dry run result"),
            @ApiResponse(responseCode = "404", description = "Unknown event or target subscription"),
            @ApiResponse(responseCode = "409", description = "Replay limit reached")
    })
    public ResponseEntity<ReplayResponse> replay(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @PathVariable String id,
            @Valid @RequestBody(required = false) ReplayRequest request) {
        credential.requireScope(ApiCredential.SCOPE_EVENTS_WRITE);
        ReplayRequest replayRequest = request != null ? request : new ReplayRequest();

        ReplayResponse response = replayService.replay(credential.getAccountId(), id, replayRequest);
        return ResponseEntity.status(response.isDryRun() ? HttpStatus.OK : HttpStatus.ACCEPTED).body(response);
    }
}
