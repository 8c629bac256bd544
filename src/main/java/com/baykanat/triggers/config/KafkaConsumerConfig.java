package com.baykanat.triggers.config;

import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/** Dispatch consumer hata işleme: exponential backoff retry, ardından DLT'ye gönderim. */
@Configuration
public class KafkaConsumerConfig {

    @Value("${app.kafka.topic.events-ingestion}")
    private String eventsIngestionTopic;

    @SuppressWarnings("null")
    @Bean
    public CommonErrorHandler kafkaErrorHandler(KafkaOperations<?, ?> kafkaOperations) {
        // dispatch edilemeyen envelope → topic.DLT; event pending kalır, recovery sweeper tekrar dener
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaOperations,
                (record, ex) -> new TopicPartition(eventsIngestionTopic + ".DLT", record.partition())
        );

        ExponentialBackOff backOff = new ExponentialBackOff(500L, 2.0);
        backOff.setMaxInterval(4000L);
        backOff.setMaxElapsedTime(8000L);

        return new DefaultErrorHandler(recoverer, backOff);
    }
}
