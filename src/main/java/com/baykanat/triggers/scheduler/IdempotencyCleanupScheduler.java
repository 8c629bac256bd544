package com.baykanat.triggers.scheduler;

import com.baykanat.triggers.domain.service.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Süresi dolmuş idempotency kayıtlarını periyodik siler (varsayılan saatte bir). */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyCleanupScheduler {

    private final IdempotencyService idempotencyService;

    @Scheduled(
            fixedRateString = "${app.scheduler.idempotency-cleanup-rate:3600000}",
            initialDelayString = "60000"
    )
    public void purgeExpiredKeys() {
        try {
            int deleted = idempotencyService.purgeExpired();
            if (deleted > 0) {
                log.info("Idempotency cleanup: deleted {} expired keys", deleted);
            } else {
                log.debug("Idempotency cleanup: no expired keys");
            }
        } catch (Exception e) {
            log.error("Failed to purge idempotency keys: {}", e.getMessage(), e);
        }
    }
}
