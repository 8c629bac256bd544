package com.baykanat.triggers.scheduler;

import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventEnvelope;
import com.baykanat.triggers.infrastructure.kafka.EventKafkaProducer;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Eşikten uzun süre pending kalan event'leri dispatch kuyruğuna tekrar yazar.
 * Dispatch pending olmayan event'i atladığından tekrar gönderim zararsızdır.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingEventRecoveryScheduler {

    private final EventJdbcRepository eventRepository;
    private final EventKafkaProducer kafkaProducer;
    private final AppProperties appProperties;

    @Scheduled(
            fixedRateString = "${app.scheduler.pending-recovery-rate:60000}",
            initialDelayString = "30000"
    )
    public void requeueStalePendingEvents() {
        AppProperties.SchedulerProperties scheduler = appProperties.getScheduler();
        try {
            List<Event> stale = eventRepository.findStalePending(
                    scheduler.getPendingRecoveryThresholdMs(), scheduler.getPendingRecoveryBatchSize());
            if (stale.isEmpty()) {
                log.debug("Pending recovery: nothing to re-enqueue");
                return;
            }

            int requeued = 0;
            for (Event event : stale) {
                boolean sent = kafkaProducer.send(EventEnvelope.builder()
                        .eventId(event.getId())
                        .accountId(event.getAccountId())
                        .correlationId(event.getCorrelationId())
                        .build());
                if (!sent) {
                    log.warn("Pending recovery stopped, queue unavailable after {} of {} events", requeued, stale.size());
                    return;
                }
                requeued++;
            }
            log.info("Pending recovery: re-enqueued {} events", requeued);
        } catch (Exception e) {
            log.error("Failed to re-enqueue pending events: {}", e.getMessage(), e);
        }
    }
}
