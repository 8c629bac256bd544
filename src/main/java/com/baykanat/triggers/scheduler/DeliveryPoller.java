package com.baykanat.triggers.scheduler;

import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.service.DeliveryService;
import com.baykanat.triggers.domain.service.IdGenerator;
import com.baykanat.triggers.infrastructure.persistence.DeliveryTaskJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Vadesi gelen delivery task'ları kiralayıp worker havuzuna verir.
 * Havuzda yer kadar task kiralanır; reddedilen task lease süresi dolunca tekrar görünür olur.
 */
@Slf4j
@Component
public class DeliveryPoller {

    private final DeliveryTaskJdbcRepository deliveryTaskRepository;
    private final DeliveryService deliveryService;
    private final IdGenerator idGenerator;
    private final ThreadPoolTaskExecutor deliveryExecutor;
    private final AppProperties appProperties;

    public DeliveryPoller(DeliveryTaskJdbcRepository deliveryTaskRepository,
                          DeliveryService deliveryService,
                          IdGenerator idGenerator,
                          @Qualifier("deliveryExecutor") ThreadPoolTaskExecutor deliveryExecutor,
                          AppProperties appProperties) {
        this.deliveryTaskRepository = deliveryTaskRepository;
        this.deliveryService = deliveryService;
        this.idGenerator = idGenerator;
        this.deliveryExecutor = deliveryExecutor;
        this.appProperties = appProperties;
    }

    @Scheduled(fixedDelayString = "${app.delivery.poll-rate:500}", initialDelayString = "5000")
    public void poll() {
        try {
            int capacity = freeCapacity();
            if (capacity <= 0) {
                log.debug("Delivery pool saturated, skipping poll");
                return;
            }

            AppProperties.DeliveryProperties delivery = appProperties.getDelivery();
            List<DeliveryTask> claimed = deliveryTaskRepository.claimDue(
                    Math.min(capacity, delivery.getClaimBatchSize()),
                    delivery.getVisibilityTimeoutMs(),
                    idGenerator.newLeaseToken());
            if (claimed.isEmpty()) {
                return;
            }

            log.debug("Claimed {} delivery tasks", claimed.size());
            for (DeliveryTask task : claimed) {
                try {
                    deliveryExecutor.execute(() -> deliveryService.deliver(task));
                } catch (TaskRejectedException e) {
                    log.warn("Delivery task {} rejected by worker pool, will be reclaimed after lease expiry", task.getId());
                }
            }
        } catch (Exception e) {
            log.error("Delivery poll failed: {}", e.getMessage(), e);
        }
    }

    private int freeCapacity() {
        AppProperties.DeliveryProperties delivery = appProperties.getDelivery();
        int busy = deliveryExecutor.getActiveCount() + deliveryExecutor.getQueueSize();
        return delivery.getWorkerThreads() + delivery.getWorkerQueueCapacity() - busy;
    }
}
