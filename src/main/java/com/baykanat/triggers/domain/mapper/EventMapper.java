package com.baykanat.triggers.domain.mapper;

import com.baykanat.triggers.api.dto.DeliveryAttemptResponse;
import com.baykanat.triggers.api.dto.DlqItemResponse;
import com.baykanat.triggers.api.dto.EventRequest;
import com.baykanat.triggers.api.dto.EventResponse;
import com.baykanat.triggers.domain.model.DeliveryAttempt;
import com.baykanat.triggers.domain.model.DlqItem;
import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventEnvelope;
import com.baykanat.triggers.domain.model.EventStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;
import java.util.List;

/** EventRequest → Event, domain → API DTO ve Kafka record value → EventEnvelope dönüşümleri. MapStruct + JSONB için Jackson. */
@Mapper(componentModel = "spring")
public interface EventMapper {

    /** JSONB alanları için paylaşılan ObjectMapper. */
    ObjectMapper JSON_MAPPER = new ObjectMapper();

    /** EventRequest → Event (pending); data/metadata → JSON string. */
    @Mapping(target = "id", source = "id")
    @Mapping(target = "accountId", source = "accountId")
    @Mapping(target = "createdAt", source = "createdAt")
    @Mapping(target = "data", source = "request.data", qualifiedByName = "toJsonString")
    @Mapping(target = "metadata", source = "request.metadata", qualifiedByName = "toJsonString")
    @Mapping(target = "status", constant = "PENDING")
    @Mapping(target = "matchedSubscriptions", ignore = true)
    @Mapping(target = "deliveryAttempts", ignore = true)
    @Mapping(target = "successfulDeliveries", ignore = true)
    @Mapping(target = "failedDeliveries", ignore = true)
    @Mapping(target = "replayCount", ignore = true)
    @Mapping(target = "updatedAt", source = "createdAt")
    Event toEvent(EventRequest request, String id, String accountId, Instant createdAt);

    @Mapping(target = "status", source = "status", qualifiedByName = "statusValue")
    EventResponse toResponse(Event event);

    DlqItemResponse toDlqResponse(DlqItem item);

    List<DlqItemResponse> toDlqResponses(List<DlqItem> items);

    DeliveryAttemptResponse toAttemptResponse(DeliveryAttempt attempt);

    /** Kafka value EventEnvelope ise döner, değilse Map vb. üzerinden EventEnvelope'a çevirir. */
    default EventEnvelope fromRecordValue(Object value) {
        if (value instanceof EventEnvelope envelope) {
            return envelope;
        }
        return JSON_MAPPER.convertValue(value, EventEnvelope.class);
    }

    @Named("statusValue")
    default String statusValue(EventStatus status) {
        return status != null ? status.value() : null;
    }

    /** Map vb. → JSON string (data, metadata JSONB için). */
    @Named("toJsonString")
    default String toJsonString(Object obj) {
        if (obj == null) return null;
        try {
            return JSON_MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable to JSON: " + e.getOriginalMessage(), e);
        }
    }
}
