package com.baykanat.triggers.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DlqListResponse {

    private List<DlqItemResponse> items;

    private int total;

    private int limit;

    private int offset;
}
