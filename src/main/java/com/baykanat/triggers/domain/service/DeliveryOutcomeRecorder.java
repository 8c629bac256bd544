package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.DeliveryAttempt;
import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.model.DlqItem;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.infrastructure.persistence.DeliveryAttemptJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.DeliveryTaskJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.DlqJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Teslim denemesinin sonucunu tek transaction'da yazar: attempt kaydı, task geçişi, event sayaçları.
 * Task geçişleri lease token'a bağlı; lease kaybedilmişse sayaçlara dokunulmaz.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryOutcomeRecorder {

    private final DeliveryAttemptJdbcRepository attemptRepository;
    private final DeliveryTaskJdbcRepository deliveryTaskRepository;
    private final EventJdbcRepository eventRepository;
    private final DlqJdbcRepository dlqRepository;

    @Transactional
    public boolean recordSuccess(DeliveryTask task, DeliveryAttempt attempt) {
        saveAttempt(attempt);
        if (!deliveryTaskRepository.markSucceeded(task.getId(), task.getLeaseToken(), attempt.getAttemptNumber())) {
            log.warn("Lease lost before success could be recorded: task={}", task.getId());
            return false;
        }
        if (!task.isReplay()) {
            eventRepository.recordOutcome(task.getEventId(), 1, 0);
        }
        return true;
    }

    @Transactional
    public boolean recordRetry(DeliveryTask task, DeliveryAttempt attempt, long delayMs) {
        saveAttempt(attempt);
        return deliveryTaskRepository.scheduleRetry(
                task.getId(), task.getLeaseToken(), attempt.getAttemptNumber(), delayMs, attempt.getErrorMessage());
    }

    /** Denemeler tükendi: task dead_lettered, DLQ kaydı ve başarısız teslim sayacı. */
    @Transactional
    public boolean recordExhausted(DeliveryTask task, DeliveryAttempt attempt, Event event) {
        saveAttempt(attempt);
        if (!deliveryTaskRepository.markDeadLettered(
                task.getId(), task.getLeaseToken(), attempt.getAttemptNumber(), attempt.getErrorMessage())) {
            log.warn("Lease lost before dead-lettering: task={}", task.getId());
            return false;
        }
        dlqRepository.upsert(DlqItem.builder()
                .eventId(task.getEventId())
                .subscriptionId(task.getSubscriptionId())
                .taskId(task.getId())
                .accountId(event.getAccountId())
                .eventType(event.getType())
                .failureReason(attempt.getErrorMessage())
                .retryCount(task.getManualRetries())
                .build());
        if (!task.isReplay()) {
            eventRepository.recordOutcome(task.getEventId(), 0, 1);
        }
        return true;
    }

    /** Subscription disabled veya silinmiş: HTTP çağrısı yapılmadan çift başarısız sayılır. */
    @Transactional
    public boolean recordCancelled(DeliveryTask task, String reason) {
        if (!deliveryTaskRepository.cancel(task.getId(), task.getLeaseToken(), reason)) {
            return false;
        }
        if (!task.isReplay()) {
            eventRepository.recordOutcome(task.getEventId(), 0, 1);
        }
        return true;
    }

    private void saveAttempt(DeliveryAttempt attempt) {
        attemptRepository.insert(attempt);
        eventRepository.incrementDeliveryAttempts(attempt.getEventId());
    }
}
