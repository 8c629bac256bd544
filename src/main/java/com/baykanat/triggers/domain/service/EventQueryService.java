package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.DeliveryAttemptResponse;
import com.baykanat.triggers.api.dto.DeliverySummaryResponse;
import com.baykanat.triggers.api.dto.EventDetailResponse;
import com.baykanat.triggers.api.dto.EventListResponse;
import com.baykanat.triggers.domain.exception.EventValidationException;
import com.baykanat.triggers.domain.exception.ResourceNotFoundException;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.DeliveryAttempt;
import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventFilter;
import com.baykanat.triggers.domain.model.EventStatus;
import com.baykanat.triggers.infrastructure.persistence.DeliveryAttemptJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.DeliveryTaskJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** GET /events ve GET /events/{id}: filtreli liste; event, task bazlı teslim özeti ve denemeler. */
@Service
@RequiredArgsConstructor
public class EventQueryService {

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 100;

    private final EventJdbcRepository eventRepository;
    private final DeliveryTaskJdbcRepository deliveryTaskRepository;
    private final DeliveryAttemptJdbcRepository attemptRepository;
    private final EventMapper eventMapper;

    public EventDetailResponse getEvent(String accountId, String eventId) {
        Event event = eventRepository.findByIdAndAccount(eventId, accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

        Map<String, List<DeliveryAttemptResponse>> attemptsByTask = attemptRepository.findByEventId(eventId).stream()
                .collect(Collectors.groupingBy(DeliveryAttempt::getTaskId,
                        Collectors.mapping(eventMapper::toAttemptResponse, Collectors.toList())));

        List<DeliverySummaryResponse> deliveries = deliveryTaskRepository.findByEventId(eventId).stream()
                .map(task -> toSummary(task, attemptsByTask.getOrDefault(task.getId(), List.of())))
                .toList();

        return EventDetailResponse.builder()
                .event(eventMapper.toResponse(event))
                .deliveries(deliveries)
                .build();
    }

    /** En yeni önce; cursor son görülen event id'sini taşır. Bilinmeyen status 400. */
    public EventListResponse list(String accountId, String type, String source, String status,
                                  Instant since, Instant until, String cursor, Integer limit) {
        int pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, limit != null ? limit : DEFAULT_PAGE_SIZE));
        EventFilter filter = EventFilter.builder()
                .type(type)
                .source(source)
                .status(parseStatus(status))
                .since(since)
                .until(until)
                .build();

        List<Event> rows = eventRepository.list(accountId, filter, InboxService.decodeCursor(cursor), pageSize + 1);
        boolean hasMore = rows.size() > pageSize;
        List<Event> page = hasMore ? rows.subList(0, pageSize) : rows;

        return EventListResponse.builder()
                .items(page.stream().map(eventMapper::toResponse).toList())
                .nextCursor(hasMore ? InboxService.encodeCursor(page.get(page.size() - 1).getId()) : null)
                .hasMore(hasMore)
                .build();
    }

    private static EventStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return EventStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new EventValidationException("status", e.getMessage());
        }
    }

    private static DeliverySummaryResponse toSummary(DeliveryTask task, List<DeliveryAttemptResponse> attempts) {
        return DeliverySummaryResponse.builder()
                .taskId(task.getId())
                .subscriptionId(task.getSubscriptionId())
                .status(task.getStatus().value())
                .attemptNumber(task.getAttemptNumber())
                .causationId(task.getCausationId())
                .lastError(task.getLastError())
                .attempts(attempts)
                .build();
    }
}
