package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import com.baykanat.triggers.infrastructure.persistence.IdempotencyJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/** Hesap kapsamlı idempotency index: (account, key) → event, TTL süresince. */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final IdempotencyJdbcRepository idempotencyRepository;
    private final EventJdbcRepository eventRepository;
    private final AppProperties appProperties;

    /** Süresi dolmamış kayıt varsa bağlı event'i döner. */
    public Optional<Event> findExisting(String accountId, String key) {
        if (key == null) {
            return Optional.empty();
        }
        return idempotencyRepository.findActiveEventId(accountId, key)
                .flatMap(eventRepository::findById);
    }

    /** Key'i event'e bağlar; eşzamanlı başka bir istek kazandıysa false. Çağıranın transaction'ında çalışır. */
    public boolean reserve(String accountId, String key, String eventId) {
        long ttlSeconds = appProperties.getIngestion().getIdempotencyTtlSeconds();
        return idempotencyRepository.reserve(accountId, key, eventId, ttlSeconds);
    }

    /** Süresi dolan kayıtları temizler. */
    public int purgeExpired() {
        return idempotencyRepository.deleteExpired();
    }
}
