package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.model.DeliveryTaskStatus;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventStatus;
import com.baykanat.triggers.domain.model.Subscription;
import com.baykanat.triggers.infrastructure.persistence.DeliveryTaskJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.SubscriptionJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/** Yeni event'i aktif subscription'larla eşler ve (event, subscription) başına bir delivery task kuyruklar. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatcherService {

    private final EventJdbcRepository eventRepository;
    private final SubscriptionJdbcRepository subscriptionRepository;
    private final DeliveryTaskJdbcRepository deliveryTaskRepository;
    private final IdGenerator idGenerator;

    /**
     * Pending olmayan event atlanır (tekrar tüketim). Eşleşme yoksa event delivered olur.
     * Oluşturulan task sayısını döner.
     */
    @Transactional
    public int dispatch(String eventId) {
        Optional<Event> found = eventRepository.findById(eventId);
        if (found.isEmpty()) {
            log.warn("Dispatch skipped, event {} not found", eventId);
            return 0;
        }

        Event event = found.get();
        if (event.getStatus() != EventStatus.PENDING) {
            log.debug("Dispatch skipped, event {} already {}", eventId, event.getStatus().value());
            return 0;
        }

        List<Subscription> matched = findMatchingSubscriptions(event);
        if (matched.isEmpty()) {
            eventRepository.markDispatched(eventId, 0, EventStatus.DELIVERED);
            log.info("Event {} has no matching subscriptions, marked delivered", eventId);
            return 0;
        }

        if (eventRepository.markDispatched(eventId, matched.size(), EventStatus.PROCESSING) == 0) {
            log.debug("Event {} dispatched concurrently, skipping", eventId);
            return 0;
        }

        List<DeliveryTask> tasks = matched.stream()
                .map(subscription -> newTask(eventId, subscription.getId(), null))
                .toList();
        deliveryTaskRepository.batchInsert(tasks);

        log.info("Event {} dispatched to {} subscriptions", eventId, tasks.size());
        return tasks.size();
    }

    /** Hesabın aktif ve filtresi eşleşen subscription'ları. */
    public List<Subscription> findMatchingSubscriptions(Event event) {
        return subscriptionRepository.findActiveByAccount(event.getAccountId()).stream()
                .filter(subscription -> EventFilterMatcher.matches(subscription, event.getType(), event.getSource()))
                .toList();
    }

    /** Replay yolu: causation_id ile işaretli yeni task seti; event durumuna dokunmaz. */
    @Transactional
    public int enqueueReplay(Event event, List<Subscription> subscriptions, String dataOverride, String metadataOverride) {
        List<DeliveryTask> tasks = subscriptions.stream()
                .map(subscription -> {
                    DeliveryTask task = newTask(event.getId(), subscription.getId(), event.getId());
                    task.setDataOverride(dataOverride);
                    task.setMetadataOverride(metadataOverride);
                    return task;
                })
                .toList();
        if (!tasks.isEmpty()) {
            deliveryTaskRepository.batchInsert(tasks);
        }
        log.info("Replay of event {} enqueued {} delivery tasks", event.getId(), tasks.size());
        return tasks.size();
    }

    private DeliveryTask newTask(String eventId, String subscriptionId, String causationId) {
        return DeliveryTask.builder()
                .id(idGenerator.newTaskId())
                .eventId(eventId)
                .subscriptionId(subscriptionId)
                .attemptNumber(0)
                .status(DeliveryTaskStatus.PENDING)
                .causationId(causationId)
                .build();
    }
}
