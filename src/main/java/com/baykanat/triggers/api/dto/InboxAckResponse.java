package com.baykanat.triggers.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** ignored: süresi dolmuş, bilinmeyen veya zaten onaylanmış handle sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboxAckResponse {

    private int acknowledged;

    private int ignored;
}
