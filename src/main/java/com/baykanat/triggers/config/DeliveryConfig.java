package com.baykanat.triggers.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/** Webhook HTTP client'ı, delivery worker havuzu ve saat. */
@Configuration
public class DeliveryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Redirect takip edilmez; 3xx başarısız deneme sayılır. */
    @Bean
    public RestClient webhookRestClient(AppProperties appProperties) {
        AppProperties.DeliveryProperties delivery = appProperties.getDelivery();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(delivery.getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(delivery.getHttpTimeoutMs()));
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }

    /** Sabit boyutlu havuz; kuyruk doluysa poller daha az task kiralar. */
    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor(AppProperties appProperties) {
        AppProperties.DeliveryProperties delivery = appProperties.getDelivery();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(delivery.getWorkerThreads());
        executor.setMaxPoolSize(delivery.getWorkerThreads());
        executor.setQueueCapacity(delivery.getWorkerQueueCapacity());
        executor.setThreadNamePrefix("delivery-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
