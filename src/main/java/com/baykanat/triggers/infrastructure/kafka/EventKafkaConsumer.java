package com.baykanat.triggers.infrastructure.kafka;

import com.baykanat.triggers.api.filter.CorrelationIdFilter;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.EventEnvelope;
import com.baykanat.triggers.domain.service.DispatcherService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Headers;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.BatchListenerFailedException;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * events-ingestion topic'ten batch tüketir ve her event'i Dispatcher'a verir.
 * Deserialize hataları doğrudan DLT'ye; dispatch hataları DefaultErrorHandler ile retry ve ardından DLT.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventKafkaConsumer {

    /** ErrorHandlingDeserializer hata durumunda bu header'ı set eder; value null olur. */
    private static final String VALUE_DESERIALIZATION_EXCEPTION_HEADER =
            "springDeserializationValueException";

    private final DispatcherService dispatcherService;
    private final EventMapper eventMapper;
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${app.kafka.topic.events-ingestion}")
    private String eventsIngestionTopic;

    /** Batch alır, kayıt kayıt dispatch eder. Hata olan kaydın index'i error handler'a bildirilir. */
    @KafkaListener(
            topics = "${app.kafka.topic.events-ingestion}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, Object>> records, Acknowledgment acknowledgment) {
        log.debug("Received batch of {} records from events-ingestion topic", records.size());

        int dispatched = 0;
        int dltCount = 0;

        for (int i = 0; i < records.size(); i++) {
            ConsumerRecord<String, Object> record = records.get(i);

            // Kafka deserialize hatası → value null, hata header'da
            if (hasDeserializationError(record)) {
                log.error("Kafka deserialization failed for record at offset={}, partition={}",
                        record.offset(), record.partition());
                publishToDlt(record, "Kafka-level deserialization failure");
                dltCount++;
                continue;
            }

            EventEnvelope envelope;
            try {
                envelope = eventMapper.fromRecordValue(record.value());
            } catch (Exception e) {
                log.error("Failed to deserialize record at offset={}, partition={}: {}",
                        record.offset(), record.partition(), e.getMessage());
                publishToDlt(record, e.getMessage());
                dltCount++;
                continue;
            }

            if (envelope == null || envelope.getEventId() == null) {
                publishToDlt(record, "Envelope without event_id");
                dltCount++;
                continue;
            }

            try {
                if (envelope.getCorrelationId() != null) {
                    MDC.put(CorrelationIdFilter.CORRELATION_ID_MDC_KEY, envelope.getCorrelationId());
                }
                dispatcherService.dispatch(envelope.getEventId());
                dispatched++;
            } catch (Exception e) {
                // Önceki kayıtlar commit edilir, bu kayıttan itibaren retry → DLT
                throw new BatchListenerFailedException("Dispatch failed for event " + envelope.getEventId(), e, i);
            } finally {
                MDC.remove(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
            }
        }

        if (dltCount > 0) {
            log.warn("Batch processed: {} records received, {} dispatched, {} sent to DLT",
                    records.size(), dispatched, dltCount);
        } else {
            log.debug("Batch processed: {} records dispatched", dispatched);
        }

        acknowledgment.acknowledge();
    }

    /** ErrorHandlingDeserializer hata header'ı var mı kontrol eder. */
    private boolean hasDeserializationError(ConsumerRecord<String, Object> record) {
        Headers headers = record.headers();
        return headers.lastHeader(VALUE_DESERIALIZATION_EXCEPTION_HEADER) != null;
    }

    /** Başarısız kaydı DLT topic'ine gönderir. DLT gönderimi hata verirse sadece log, batch devam eder. */
    private void publishToDlt(ConsumerRecord<String, Object> record, String reason) {
        String topic = Objects.requireNonNull(eventsIngestionTopic, "eventsIngestionTopic") + ".DLT";
        try {
            String key = Objects.requireNonNullElse(record.key(), "");
            kafkaTemplate.send(topic, key, record.value());
            log.warn("Sent failed record to DLT: topic={}, offset={}, partition={}, reason={}",
                    topic, record.offset(), record.partition(), Objects.requireNonNullElse(reason, ""));
        } catch (Exception dltEx) {
            log.error("Failed to publish record to DLT {}: {}", topic, dltEx.getMessage());
        }
    }
}
