package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** delivery_tasks kuyruğundaki tek (event, subscription) teslim işi. attemptNumber = yapılmış deneme sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryTask {

    private String id;
    private String eventId;
    private String subscriptionId;
    private int attemptNumber;
    private DeliveryTaskStatus status;
    private Instant visibleAt;
    private String leaseToken;
    private String causationId;
    /** Replay'de event data/metadata üzerine derin birleştirilen JSON; yoksa null. */
    private String dataOverride;
    private String metadataOverride;
    /** DLQ üzerinden elle yapılan retry sayısı. */
    private int manualRetries;
    private String lastError;
    private Instant createdAt;

    /** Replay ile oluşturulan task'lar orijinal event sayaçlarını değiştirmez. */
    public boolean isReplay() {
        return causationId != null;
    }
}
