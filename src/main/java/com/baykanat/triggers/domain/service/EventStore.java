package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.IngestionResult;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Event + idempotency kaydını tek transaction'da yazar. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventStore {

    private final EventJdbcRepository eventRepository;
    private final IdempotencyService idempotencyService;

    /**
     * Key varsa önce rezerve eder; eşzamanlı istek kazandıysa onun event'ini döner ve hiçbir şey yazmaz.
     * Unique index üzerindeki bekleme, kazanan transaction commit olana kadar sürer.
     */
    @Transactional
    public IngestionResult persist(Event event) {
        String key = event.getIdempotencyKey();
        if (key != null && !idempotencyService.reserve(event.getAccountId(), key, event.getId())) {
            Event winner = idempotencyService.findExisting(event.getAccountId(), key)
                    .orElseThrow(() -> new IllegalStateException(
                            "Idempotency key " + key + " is reserved but its event is missing"));
            log.debug("Idempotency race lost for key={}, returning event {}", key, winner.getId());
            return IngestionResult.builder().event(winner).created(false).build();
        }

        eventRepository.insert(event);
        return IngestionResult.builder().event(event).created(true).build();
    }
}
