package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.DlqActionResponse;
import com.baykanat.triggers.api.dto.DlqBatchResponse;
import com.baykanat.triggers.domain.exception.ResourceNotFoundException;
import com.baykanat.triggers.domain.model.ApiCredential;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Function;

/**
 * Toplu DLQ retry/dismiss. Her event DlqService üzerinden kendi transaction'ında işlenir,
 * bir event'in hatası diğerlerini geri almaz.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DlqBatchService {

    static final String ERROR_NOT_FOUND = "Item not found in DLQ";

    private final DlqService dlqService;

    public DlqBatchResponse retryBatch(ApiCredential credential, List<String> eventIds) {
        return process(eventIds, eventId -> dlqService.retry(credential, eventId, null));
    }

    public DlqBatchResponse dismissBatch(ApiCredential credential, List<String> eventIds) {
        return process(eventIds, eventId -> dlqService.dismiss(credential, eventId, null));
    }

    private DlqBatchResponse process(List<String> eventIds, Function<String, DlqActionResponse> action) {
        List<DlqBatchResponse.Result> results = new ArrayList<>();
        int successful = 0;
        for (String eventId : new LinkedHashSet<>(eventIds)) {
            try {
                DlqActionResponse response = action.apply(eventId);
                results.add(DlqBatchResponse.Result.builder()
                        .eventId(eventId)
                        .success(true)
                        .subscriptionIds(response.getSubscriptionIds())
                        .build());
                successful++;
            } catch (ResourceNotFoundException e) {
                results.add(failure(eventId, ERROR_NOT_FOUND));
            } catch (DataAccessException e) {
                log.error("DLQ batch operation failed for event {}", eventId, e);
                results.add(failure(eventId, "Storage error"));
            }
        }
        return DlqBatchResponse.builder()
                .total(results.size())
                .successful(successful)
                .failed(results.size() - successful)
                .results(results)
                .build();
    }

    private static DlqBatchResponse.Result failure(String eventId, String error) {
        return DlqBatchResponse.Result.builder()
                .eventId(eventId)
                .success(false)
                .error(error)
                .build();
    }
}
