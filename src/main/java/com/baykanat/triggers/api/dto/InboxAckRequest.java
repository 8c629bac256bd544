package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Receipt handles to acknowledge")
public class InboxAckRequest {

    @NotEmpty(message = "receipt_handles must not be empty")
    @Size(max = 100, message = "Maximum 100 receipt handles per request")
    @JsonProperty("receipt_handles")
    private List<String> receiptHandles;
}
