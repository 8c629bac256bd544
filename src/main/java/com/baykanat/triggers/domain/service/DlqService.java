package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.DlqActionResponse;
import com.baykanat.triggers.api.dto.DlqItemResponse;
import com.baykanat.triggers.api.dto.DlqListResponse;
import com.baykanat.triggers.api.dto.DlqStatsResponse;
import com.baykanat.triggers.domain.exception.ResourceNotFoundException;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.model.DlqItem;
import com.baykanat.triggers.infrastructure.persistence.DeliveryTaskJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.DlqJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Operatör işlemleri: DLQ listeleme, retry ve dismiss. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DlqService {

    public static final String ACTION_RETRIED = "retried";
    public static final String ACTION_DISMISSED = "dismissed";

    private static final int MAX_PAGE_SIZE = 100;

    private final DlqJdbcRepository dlqRepository;
    private final DeliveryTaskJdbcRepository deliveryTaskRepository;
    private final EventJdbcRepository eventRepository;
    private final EventMapper eventMapper;

    public DlqListResponse list(String accountId, String eventType, String subscriptionId, int limit, int offset) {
        int pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        int start = Math.max(0, offset);
        List<DlqItem> items = dlqRepository.list(accountId, eventType, subscriptionId, pageSize, start);
        return DlqListResponse.builder()
                .items(eventMapper.toDlqResponses(items))
                .total(dlqRepository.count(accountId))
                .limit(pageSize)
                .offset(start)
                .build();
    }

    public DlqStatsResponse stats(String accountId) {
        return DlqStatsResponse.builder()
                .total(dlqRepository.count(accountId))
                .byEventType(dlqRepository.countByEventType(accountId))
                .build();
    }

    /** Event'in DLQ kayıtları; orijinal ve replay task'ları ayrı satırlardır. */
    public List<DlqItemResponse> getItems(String accountId, String eventId) {
        return eventMapper.toDlqResponses(findItems(accountId, eventId, null));
    }

    /**
     * Task'ı sıfır denemeyle yeniden kuyruklar ve kaydı kaldırır. Orijinal task için çift event üzerinde yeniden açılır,
     * durum çözümlemede tekrar hesaplanır. subscriptionId null ise event'in tüm DLQ kayıtları.
     */
    @Transactional
    public DlqActionResponse retry(ApiCredential credential, String eventId, String subscriptionId) {
        List<DlqItem> items = findItems(credential.getAccountId(), eventId, subscriptionId);

        Set<String> retried = new LinkedHashSet<>();
        for (DlqItem item : items) {
            Optional<DeliveryTask> task = deliveryTaskRepository.findById(item.getTaskId());
            if (task.isEmpty() || !deliveryTaskRepository.resetForRetry(item.getTaskId())) {
                log.warn("DLQ retry skipped, task {} is no longer dead-lettered", item.getTaskId());
                continue;
            }
            dlqRepository.delete(item.getTaskId());
            if (!task.get().isReplay()) {
                eventRepository.reopenFailedDelivery(item.getEventId());
            }
            retried.add(item.getSubscriptionId());
        }

        log.info("DLQ retry by key {}: event={}, subscriptions={}", credential.getKeyId(), eventId, retried);
        return DlqActionResponse.builder()
                .eventId(eventId)
                .action(ACTION_RETRIED)
                .subscriptionIds(new ArrayList<>(retried))
                .build();
    }

    /** Kaydı kaldırır ve çift için açık replay task'larını iptal eder; event sayaçları değişmez. */
    @Transactional
    public DlqActionResponse dismiss(ApiCredential credential, String eventId, String subscriptionId) {
        List<DlqItem> items = findItems(credential.getAccountId(), eventId, subscriptionId);

        Set<String> dismissed = new LinkedHashSet<>();
        for (DlqItem item : items) {
            if (!dlqRepository.delete(item.getTaskId())) {
                continue;
            }
            int cancelled = dismissed.add(item.getSubscriptionId())
                    ? deliveryTaskRepository.cancelOpenReplayTasks(
                            item.getEventId(), item.getSubscriptionId(), "dismissed from DLQ")
                    : 0;
            log.info("AUDIT dlq.dismiss key={} account={} event={} subscription={} task={} reason=\"{}\" cancelled_tasks={}",
                    credential.getKeyId(), credential.getAccountId(), item.getEventId(), item.getSubscriptionId(),
                    item.getTaskId(), item.getFailureReason(), cancelled);
        }

        return DlqActionResponse.builder()
                .eventId(eventId)
                .action(ACTION_DISMISSED)
                .subscriptionIds(new ArrayList<>(dismissed))
                .build();
    }

    private List<DlqItem> findItems(String accountId, String eventId, String subscriptionId) {
        List<DlqItem> items = dlqRepository.findByEvent(accountId, eventId, subscriptionId);
        if (items.isEmpty()) {
            throw new ResourceNotFoundException("DLQ item",
                    subscriptionId == null ? eventId : eventId + "/" + subscriptionId);
        }
        return items;
    }
}
