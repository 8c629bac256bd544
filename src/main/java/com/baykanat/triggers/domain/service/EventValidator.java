package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.EventRequest;
import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.exception.EventValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.Set;

/**
 * Bean Validation kuralları + annotation ile ifade edilemeyen boyut kuralları.
 * Batch öğeleri @Valid ile değil buradan doğrulanır ki tek hata tüm batch'i düşürmesin.
 */
@Component
@RequiredArgsConstructor
public class EventValidator {

    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private final Validator validator;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    /** İlk ihlalde EventValidationException fırlatır (alan adı JSON adıyla). */
    public void validate(EventRequest request) {
        if (request == null) {
            throw new EventValidationException(null, "event must not be null");
        }

        Set<ConstraintViolation<EventRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            ConstraintViolation<EventRequest> first = violations.stream()
                    .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .orElseThrow();
            throw new EventValidationException(toJsonField(first.getPropertyPath().toString()), first.getMessage());
        }

        int dataBytes = serializedSize(request.getData());
        if (dataBytes > appProperties.getIngestion().getMaxEventBytes()) {
            throw new EventValidationException("data",
                    "data must be at most " + appProperties.getIngestion().getMaxEventBytes() + " bytes, was " + dataBytes);
        }

        String idempotencyKey = request.getIdempotencyKey();
        if (idempotencyKey != null && (idempotencyKey.isBlank() || idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH)) {
            throw new EventValidationException("metadata.idempotency_key",
                    "idempotency_key must be 1-" + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
    }

    /** Batch gövdesinin toplam boyutu; sınır aşılırsa tüm istek reddedilir. */
    public void validateBatchSize(Object batch) {
        int bytes = serializedSize(batch);
        if (bytes > appProperties.getIngestion().getMaxBatchBytes()) {
            throw new EventValidationException("events",
                    "batch must be at most " + appProperties.getIngestion().getMaxBatchBytes() + " bytes, was " + bytes);
        }
    }

    private int serializedSize(Object value) {
        try {
            return objectMapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            throw new EventValidationException(null, "payload is not serializable: " + e.getOriginalMessage());
        }
    }

    private static String toJsonField(String property) {
        return "referenceId".equals(property) ? "reference_id" : property;
    }
}
