package com.baykanat.triggers.infrastructure.persistence;

import com.baykanat.triggers.domain.model.RetryPolicy;
import com.baykanat.triggers.domain.model.Subscription;
import com.baykanat.triggers.domain.model.SubscriptionStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** subscriptions tablosu; bu servis için salt okunur. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SubscriptionJdbcRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<Subscription> subscriptionRowMapper = (rs, rowNum) -> mapSubscription(rs);

    public List<Subscription> findActiveByAccount(String accountId) {
        return jdbcTemplate.query(
                "SELECT * FROM subscriptions WHERE account_id = ? AND status = 'active' ORDER BY id",
                subscriptionRowMapper, accountId);
    }

    public Optional<Subscription> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM subscriptions WHERE id = ?", subscriptionRowMapper, id)
                .stream().findFirst();
    }

    /** Hesaba ait verilen id'lerdeki abonelikler (durumdan bağımsız). */
    public List<Subscription> findByIds(String accountId, Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(",", ids.stream().map(id -> "?").toList());
        String sql = "SELECT * FROM subscriptions WHERE account_id = ? AND id IN (" + placeholders + ") ORDER BY id";

        Object[] args = new Object[ids.size() + 1];
        args[0] = accountId;
        int i = 1;
        for (String id : ids) {
            args[i++] = id;
        }
        return jdbcTemplate.query(sql, subscriptionRowMapper, args);
    }

    private Subscription mapSubscription(ResultSet rs) throws SQLException {
        RetryPolicy retryPolicy = null;
        int maxAttempts = rs.getInt("max_attempts");
        if (!rs.wasNull()) {
            retryPolicy = RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .initialDelayMs(rs.getLong("initial_delay_ms"))
                    .maxDelayMs(rs.getLong("max_delay_ms"))
                    .multiplier(rs.getDouble("multiplier"))
                    .build();
        }

        return Subscription.builder()
                .id(rs.getString("id"))
                .accountId(rs.getString("account_id"))
                .url(rs.getString("url"))
                .eventTypes(readJson(rs.getString("event_types"), STRING_LIST, List.of("*")))
                .sources(readJson(rs.getString("sources"), STRING_LIST, List.of()))
                .retryPolicy(retryPolicy)
                .signingSecret(rs.getString("signing_secret"))
                .customHeaders(readJson(rs.getString("custom_headers"), STRING_MAP, Map.of()))
                .status(SubscriptionStatus.fromValue(rs.getString("status")))
                .build();
    }

    private <T> T readJson(String json, TypeReference<T> type, T fallback) {
        if (json == null) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON column in subscriptions: {}", e.getOriginalMessage());
            return fallback;
        }
    }
}
