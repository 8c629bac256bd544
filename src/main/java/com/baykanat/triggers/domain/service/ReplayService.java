package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.ReplayRequest;
import com.baykanat.triggers.api.dto.ReplayResponse;
import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.exception.EventValidationException;
import com.baykanat.triggers.domain.exception.ReplayLimitExceededException;
import com.baykanat.triggers.domain.exception.ResourceNotFoundException;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.Subscription;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.SubscriptionJdbcRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Saklanan event'i yeniden teslim eder; yeni task'lar causation_id = event id ve varsa payload/metadata override taşır. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReplayService {

    private final EventJdbcRepository eventRepository;
    private final SubscriptionJdbcRepository subscriptionRepository;
    private final DispatcherService dispatcherService;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    /** Dry run yan etkisizdir; aksi halde replay sayacı koşullu artar, sınır doluysa 409. */
    @Transactional
    public ReplayResponse replay(String accountId, String eventId, ReplayRequest request) {
        Event event = eventRepository.findByIdAndAccount(eventId, accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

        List<Subscription> targets = resolveTargets(event, request.getTargetSubscriptions());
        List<ReplayResponse.Target> targetViews = targets.stream()
                .map(s -> new ReplayResponse.Target(s.getId(), s.getUrl()))
                .toList();

        String dataOverride = toJson("payload_override", request.getPayloadOverride());
        String metadataOverride = toJson("metadata_override", request.getMetadataOverride());

        if (request.isDryRun()) {
            return ReplayResponse.builder()
                    .eventId(eventId)
                    .dryRun(true)
                    .payloadModified(dataOverride != null)
                    .metadataModified(metadataOverride != null)
                    .subscriptions(targetViews)
                    .build();
        }

        int maxReplays = appProperties.getReplay().getMaxReplays();
        if (!eventRepository.incrementReplayCount(eventId, maxReplays)) {
            throw new ReplayLimitExceededException(eventId, maxReplays);
        }

        int created = dispatcherService.enqueueReplay(event, targets, dataOverride, metadataOverride);
        log.info("Replay of event {} accepted ({}/{}), {} tasks", eventId, event.getReplayCount() + 1, maxReplays, created);
        return ReplayResponse.builder()
                .eventId(eventId)
                .dryRun(false)
                .causationId(eventId)
                .replayCount(event.getReplayCount() + 1)
                .tasksCreated(created)
                .payloadModified(dataOverride != null)
                .metadataModified(metadataOverride != null)
                .subscriptions(targetViews)
                .build();
    }

    /** Boş override yok sayılır. */
    private String toJson(String field, Map<String, Object> override) {
        if (override == null || override.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(override);
        } catch (JsonProcessingException e) {
            throw new EventValidationException(field, "Override is not serializable as JSON");
        }
    }

    /** Hedef verilmemişse eşleşen aktif subscription'lar; verilmişse hepsi mevcut, aktif ve hesaba ait olmalı. */
    private List<Subscription> resolveTargets(Event event, List<String> targetIds) {
        if (targetIds == null || targetIds.isEmpty()) {
            return dispatcherService.findMatchingSubscriptions(event);
        }

        Set<String> requested = new LinkedHashSet<>(targetIds);
        Map<String, Subscription> found = subscriptionRepository.findByIds(event.getAccountId(), requested).stream()
                .collect(Collectors.toMap(Subscription::getId, Function.identity()));
        for (String id : requested) {
            Subscription subscription = found.get(id);
            if (subscription == null || !subscription.isActive()) {
                throw new ResourceNotFoundException("Subscription", id);
            }
        }
        return requested.stream().map(found::get).toList();
    }
}
