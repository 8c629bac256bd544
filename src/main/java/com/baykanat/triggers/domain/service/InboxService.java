package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.api.dto.InboxAckResponse;
import com.baykanat.triggers.api.dto.InboxItemResponse;
import com.baykanat.triggers.api.dto.InboxListResponse;
import com.baykanat.triggers.api.dto.InboxStatsResponse;
import com.baykanat.triggers.api.dto.InboxVisibilityResponse;
import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.exception.EventValidationException;
import com.baykanat.triggers.domain.exception.ResourceNotFoundException;
import com.baykanat.triggers.domain.mapper.EventMapper;
import com.baykanat.triggers.domain.model.InboxItem;
import com.baykanat.triggers.domain.model.InboxStats;
import com.baykanat.triggers.infrastructure.persistence.EventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pull tabanlı tüketim: listelenen event'ler visibility timeout boyunca gizlenir, receipt handle ile onaylanır.
 * Onaylanmayan event süre dolunca yeni bir handle ile tekrar listelenir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboxService {

    static final String RECEIPT_PREFIX = "rcpt_";
    private static final String RECEIPT_SEPARATOR = ":";

    private final EventJdbcRepository eventRepository;
    private final EventMapper eventMapper;
    private final AppProperties appProperties;

    public InboxListResponse list(String accountId, String cursor, Integer limit, Integer visibilityTimeoutSeconds,
                                  List<String> types, List<String> sources) {
        AppProperties.InboxProperties inbox = appProperties.getInbox();
        int pageSize = clamp(limit != null ? limit : inbox.getDefaultLimit(), 1, inbox.getMaxLimit());
        int visibility = clamp(visibilityTimeoutSeconds != null ? visibilityTimeoutSeconds : inbox.getDefaultVisibilityTimeoutSeconds(),
                1, inbox.getMaxVisibilityTimeoutSeconds());

        List<InboxItem> leased = eventRepository.leaseInboxItems(
                accountId, decodeCursor(cursor), pageSize, visibility, types, sources);
        List<InboxItemResponse> items = leased.stream()
                .map(item -> InboxItemResponse.builder()
                        .receiptHandle(encodeReceipt(item.getEvent().getId(), item.getReceiptToken()))
                        .visibleUntil(item.getVisibleUntil())
                        .event(eventMapper.toResponse(item.getEvent()))
                        .build())
                .toList();

        String nextCursor = leased.size() == pageSize
                ? encodeCursor(leased.get(leased.size() - 1).getEvent().getId())
                : null;

        log.debug("Leased {} inbox items for account {} ({}s visibility)", items.size(), accountId, visibility);
        return InboxListResponse.builder()
                .items(items)
                .nextCursor(nextCursor)
                .visibilityTimeout(visibility)
                .build();
    }

    /** Çözülemeyen, süresi dolmuş veya zaten onaylanmış handle hata değil, ignored sayılır. */
    public InboxAckResponse acknowledge(String accountId, List<String> receiptHandles) {
        int acknowledged = 0;
        int ignored = 0;
        Set<String> unique = new LinkedHashSet<>(receiptHandles);
        ignored += receiptHandles.size() - unique.size();

        for (String handle : unique) {
            String[] decoded = decodeReceipt(handle);
            if (decoded != null && eventRepository.acknowledgeInboxItem(decoded[0], accountId, decoded[1])) {
                acknowledged++;
            } else {
                ignored++;
            }
        }

        log.info("Inbox ack for account {}: {} acknowledged, {} ignored", accountId, acknowledged, ignored);
        return InboxAckResponse.builder()
                .acknowledged(acknowledged)
                .ignored(ignored)
                .build();
    }

    /** Açık lease'i uzatır veya kısaltır; geçersiz, süresi dolmuş ya da onaylanmış handle 404. */
    public InboxVisibilityResponse changeVisibility(String accountId, String receiptHandle, int visibilityTimeoutSeconds) {
        int visibility = clamp(visibilityTimeoutSeconds, 0, appProperties.getInbox().getMaxVisibilityTimeoutSeconds());
        String[] decoded = decodeReceipt(receiptHandle);
        Instant visibleUntil = decoded == null ? null : eventRepository
                .changeInboxVisibility(decoded[0], accountId, decoded[1], visibility)
                .orElse(null);
        if (visibleUntil == null) {
            throw new ResourceNotFoundException("Receipt handle", receiptHandle);
        }
        log.debug("Inbox lease of event {} now visible at {}", decoded[0], visibleUntil);
        return InboxVisibilityResponse.builder()
                .receiptHandle(receiptHandle)
                .visibleUntil(visibleUntil)
                .build();
    }

    public InboxStatsResponse stats(String accountId) {
        InboxStats stats = eventRepository.inboxStats(accountId);
        return InboxStatsResponse.builder()
                .visible(stats.getVisible())
                .inFlight(stats.getInFlight())
                .total(stats.getTotal())
                .oldestEventAt(stats.getOldestEventAt())
                .byEventType(eventRepository.inboxCountByType(accountId))
                .build();
    }

    static String encodeReceipt(String eventId, String token) {
        return RECEIPT_PREFIX + Base64.getUrlEncoder().withoutPadding()
                .encodeToString((eventId + RECEIPT_SEPARATOR + token).getBytes(StandardCharsets.UTF_8));
    }

    /** [eventId, token] veya handle geçersizse null. */
    static String[] decodeReceipt(String handle) {
        if (handle == null || !handle.startsWith(RECEIPT_PREFIX)) {
            return null;
        }
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(handle.substring(RECEIPT_PREFIX.length())),
                    StandardCharsets.UTF_8);
            int separator = decoded.indexOf(RECEIPT_SEPARATOR);
            if (separator <= 0 || separator == decoded.length() - 1) {
                return null;
            }
            return new String[]{decoded.substring(0, separator), decoded.substring(separator + 1)};
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static String encodeCursor(String lastEventId) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(lastEventId.getBytes(StandardCharsets.UTF_8));
    }

    static String decodeCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return null;
        }
        try {
            return new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new EventValidationException("cursor", "Malformed cursor");
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
