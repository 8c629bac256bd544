package com.baykanat.triggers.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.util.Objects;

/** Dispatch topic ve DLT bean'leri. Partition key account id olduğundan hesap içi sıra korunur. */
@Configuration
public class KafkaProducerConfig {

    @Value("${app.kafka.topic.events-ingestion}")
    private String eventsIngestionTopic;

    @Bean
    public NewTopic eventsIngestionTopic() {
        return TopicBuilder.name(Objects.requireNonNull(eventsIngestionTopic, "eventsIngestionTopic"))
                .partitions(6)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic eventsIngestionDlt() {
        return TopicBuilder.name(Objects.requireNonNull(eventsIngestionTopic, "eventsIngestionTopic") + ".DLT")
                .partitions(3)
                .replicas(1)
                .build();
    }
}
