package com.baykanat.triggers.infrastructure.stream;

import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.Event;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hesap bazlı canlı event yayını (bu replica'daki bağlantılar).
 * Her abonenin sınırlı bir buffer'ı var; buffer dolarsa abone düşürülür, publish hiçbir zaman bloklanmaz.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamPublisher {

    public static final String EVENT_CONNECTED = "connected";
    public static final String EVENT_EVENT = "event";
    public static final String EVENT_HEARTBEAT = "heartbeat";

    private final Map<String, Set<StreamSubscriber>> subscribersByAccount = new ConcurrentHashMap<>();

    private final AppProperties appProperties;
    private final EventMapper eventMapper;
    private final ObjectMapper objectMapper;

    /** Yeni bağlantı; ilk frame "connected". Bağlantı kapanınca abone kaydı silinir. */
    public Flux<ServerSentEvent<String>> subscribe(String accountId, Collection<String> types, Collection<String> sources) {
        int bufferSize = appProperties.getStream().getBufferSize();
        StreamSubscriber subscriber = new StreamSubscriber(
                UUID.randomUUID().toString(),
                accountId,
                types == null ? List.of() : List.copyOf(types),
                sources == null ? List.of() : List.copyOf(sources),
                Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize)));

        // ekleme, boş set'i silen remove ile aynı map girdisi kilidi altında yapılır
        subscribersByAccount.compute(accountId, (key, current) -> {
            Set<StreamSubscriber> subscribers = current == null ? ConcurrentHashMap.newKeySet() : current;
            subscribers.add(subscriber);
            return subscribers;
        });
        log.info("Stream subscriber {} connected for account {}", subscriber.id(), accountId);

        ServerSentEvent<String> connected = ServerSentEvent.<String>builder()
                .event(EVENT_CONNECTED)
                .data(toJson(Map.of("subscriber_id", subscriber.id(), "timestamp", Instant.now().toString())))
                .build();
        return Flux.just(connected)
                .concatWith(subscriber.sink().asFlux())
                .doFinally(signal -> remove(subscriber, signal.toString()));
    }

    /** Eşleşen tüm abonelere event frame'i; ingestion yolundan çağrılır, hata yukarı taşınmaz. */
    public void publish(Event event) {
        Set<StreamSubscriber> subscribers = subscribersByAccount.get(event.getAccountId());
        if (subscribers == null || subscribers.isEmpty()) {
            return;
        }
        ServerSentEvent<String> frame;
        try {
            frame = ServerSentEvent.<String>builder()
                    .id(event.getId())
                    .event(EVENT_EVENT)
                    .data(objectMapper.writeValueAsString(eventMapper.toResponse(event)))
                    .build();
        } catch (JsonProcessingException e) {
            log.warn("Stream frame for event {} could not be serialized: {}", event.getId(), e.getMessage());
            return;
        }
        for (StreamSubscriber subscriber : subscribers) {
            if (subscriber.accepts(event)) {
                emit(subscriber, frame);
            }
        }
    }

    @Scheduled(fixedRateString = "${app.stream.heartbeat-interval:15000}")
    public void sendHeartbeats() {
        if (subscribersByAccount.isEmpty()) {
            return;
        }
        ServerSentEvent<String> heartbeat = ServerSentEvent.<String>builder()
                .event(EVENT_HEARTBEAT)
                .data(toJson(Map.of("timestamp", Instant.now().toString())))
                .build();
        subscribersByAccount.values().forEach(subscribers -> subscribers.forEach(s -> emit(s, heartbeat)));
    }

    public int activeSubscriberCount() {
        return subscribersByAccount.values().stream().mapToInt(Set::size).sum();
    }

    private void emit(StreamSubscriber subscriber, ServerSentEvent<String> frame) {
        Sinks.EmitResult result;
        // unicast sink eşzamanlı emit kabul etmez
        synchronized (subscriber) {
            result = subscriber.sink().tryEmitNext(frame);
        }
        if (result.isFailure()) {
            log.warn("Dropping stream subscriber {} for account {}: {}", subscriber.id(), subscriber.accountId(), result);
            remove(subscriber, "emit " + result);
            synchronized (subscriber) {
                subscriber.sink().tryEmitError(new SlowSubscriberException(subscriber.id()));
            }
        }
    }

    private void remove(StreamSubscriber subscriber, String reason) {
        AtomicBoolean removed = new AtomicBoolean();
        subscribersByAccount.computeIfPresent(subscriber.accountId(), (key, subscribers) -> {
            removed.set(subscribers.remove(subscriber));
            return subscribers.isEmpty() ? null : subscribers;
        });
        if (removed.get()) {
            log.info("Stream subscriber {} disconnected ({})", subscriber.id(), reason);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stream frame serialization failed", e);
        }
    }

    /** Buffer'ı dolan abone bağlantısını sonlandırır. */
    public static class SlowSubscriberException extends RuntimeException {
        public SlowSubscriberException(String subscriberId) {
            super("Stream subscriber " + subscriberId + " fell behind and was disconnected");
        }
    }
}
