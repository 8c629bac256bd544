package com.baykanat.triggers.infrastructure.stream;

import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.service.EventFilterMatcher;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Sinks;

import java.util.List;

/** Tek stream bağlantısı; type/source filtreleri boşsa her event kabul edilir. */
final class StreamSubscriber {

    private final String id;
    private final String accountId;
    private final List<String> types;
    private final List<String> sources;
    private final Sinks.Many<ServerSentEvent<String>> sink;

    StreamSubscriber(String id, String accountId, List<String> types, List<String> sources,
                     Sinks.Many<ServerSentEvent<String>> sink) {
        this.id = id;
        this.accountId = accountId;
        this.types = types;
        this.sources = sources;
        this.sink = sink;
    }

    String id() {
        return id;
    }

    String accountId() {
        return accountId;
    }

    Sinks.Many<ServerSentEvent<String>> sink() {
        return sink;
    }

    boolean accepts(Event event) {
        return EventFilterMatcher.matchesAnyOrEmpty(types, event.getType())
                && EventFilterMatcher.matchesAnyOrEmpty(sources, event.getSource());
    }
}
