package com.baykanat.triggers.api.controller;

import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.infrastructure.stream.StreamPublisher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;

/** GET /events/stream: hesabın yeni event'leri server-sent events olarak. */
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
@Tag(name = "Event Stream", description = "Live server-sent event feed")
public class EventStreamController {

    private final StreamPublisher streamPublisher;

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream new events",
            description = "Frames: connected, event, heartbeat. Slow consumers are disconnected; missed events are not replayed")
    public Flux<ServerSentEvent<String>> stream(
            @RequestAttribute(ApiCredential.REQUEST_ATTRIBUTE) ApiCredential credential,
            @Parameter(description = "Type globs, e.g. order.*")
            @RequestParam(required = false) List<String> types,
            @Parameter(description = "Source globs")
            @RequestParam(required = false) List<String> sources) {
        credential.requireScope(ApiCredential.SCOPE_EVENTS_READ);
        return streamPublisher.subscribe(credential.getAccountId(), types, sources);
    }
}
