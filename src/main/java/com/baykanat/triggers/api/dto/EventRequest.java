package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Gelen event payload DTO; data alanı opak, şeması modellenmez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Event payload for ingestion")
public class EventRequest {

    public static final String IDEMPOTENCY_KEY = "idempotency_key";
    public static final String CORRELATION_ID = "correlation_id";

    @NotBlank(message = "type is required")
    @Size(max = 255, message = "type must be at most 255 characters")
    @Pattern(regexp = "^[a-zA-Z0-9_\\-]+(\\.[a-zA-Z0-9_\\-]+)*$",
            message = "type must be dot-separated segments of letters, digits, '_' or '-'")
    @JsonProperty("type")
    @Schema(description = "Dot-separated event type", example = "order.created")
    private String type;

    @NotBlank(message = "source is required")
    @Size(max = 255, message = "source must be at most 255 characters")
    @JsonProperty("source")
    @Schema(description = "Producer of the event", example = "shop")
    private String source;

    @NotNull(message = "data is required")
    @JsonProperty("data")
    @Schema(description = "Opaque event payload", example = "{\"id\": \"42\"}")
    private Map<String, Object> data;

    @JsonProperty("metadata")
    @Schema(description = "Optional metadata; idempotency_key and correlation_id are recognised",
            example = "{\"idempotency_key\": \"k1\"}")
    private Map<String, Object> metadata;

    @Size(max = 255, message = "reference_id must be at most 255 characters")
    @JsonProperty("reference_id")
    @Schema(description = "Client reference echoed back in batch results", example = "line-1")
    private String referenceId;

    @JsonIgnore
    public String getIdempotencyKey() {
        return metadataString(IDEMPOTENCY_KEY);
    }

    @JsonIgnore
    public String getCorrelationId() {
        return metadataString(CORRELATION_ID);
    }

    private String metadataString(String key) {
        if (metadata == null) {
            return null;
        }
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
