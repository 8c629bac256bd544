package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "New lease duration for a leased inbox item")
public class InboxVisibilityRequest {

    @NotBlank(message = "receipt_handle is required")
    @JsonProperty("receipt_handle")
    private String receiptHandle;

    @NotNull(message = "visibility_timeout is required")
    @Min(value = 0, message = "visibility_timeout must be >= 0")
    @Max(value = 43200, message = "visibility_timeout must be <= 43200")
    @JsonProperty("visibility_timeout")
    @Schema(description = "Seconds from now; 0 releases the item immediately", example = "120")
    private Integer visibilityTimeout;
}
