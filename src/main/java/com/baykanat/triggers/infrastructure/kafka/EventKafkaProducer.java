package com.baykanat.triggers.infrastructure.kafka;

import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.model.EventEnvelope;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Event id'lerini ingestion topic'ine yazar; Retry + Circuit Breaker.
 * Partition key account_id: aynı hesabın event'leri aynı partition'da sıralı tüketilir.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventKafkaProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;

    /** Ack beklenir (acks=all). Başarılıysa true; fallback'ler false döner. */
    @Retry(name = "kafkaProducer")
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleCircuitBreakerOpen")
    public boolean send(EventEnvelope envelope) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getEventsIngestion());
        String key = Objects.requireNonNull(envelope.getAccountId(), "accountId");
        kafkaTemplate.send(topic, key, envelope).get(1, TimeUnit.SECONDS);
        return true;
    }

    /** Circuit breaker açık; event DB'de pending kalır. */
    @SuppressWarnings("unused")
    private boolean handleCircuitBreakerOpen(EventEnvelope envelope, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Leaving event_id={} pending", envelope.getEventId());
        return false;
    }

    /** Tüm retry'lar tükendikten sonra fallback. */
    @SuppressWarnings("unused")
    private boolean handleCircuitBreakerOpen(EventEnvelope envelope, Exception ex) {
        log.error("Kafka produce failed after all retries for event_id={}: {}", envelope.getEventId(), ex.getMessage());
        return false;
    }
}
