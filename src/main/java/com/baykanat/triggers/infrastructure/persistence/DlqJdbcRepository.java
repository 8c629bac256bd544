package com.baykanat.triggers.infrastructure.persistence;

import com.baykanat.triggers.domain.model.DlqItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** dlq_items tablosu; tükenen her task için bir kayıt, orijinal ve replay task'ları ayrı tutulur. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DlqJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Aynı task manuel retry sonrası tekrar tükenirse kayıt son hatayla güncellenir. */
    private static final String UPSERT_SQL = """
            INSERT INTO dlq_items (event_id, subscription_id, task_id, account_id, event_type, failure_reason, retry_count)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (task_id) DO UPDATE
            SET failure_reason = EXCLUDED.failure_reason,
                retry_count = GREATEST(dlq_items.retry_count, EXCLUDED.retry_count),
                created_at = NOW()
            """;

    private final RowMapper<DlqItem> dlqRowMapper = (rs, rowNum) -> {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return DlqItem.builder()
                .eventId(rs.getString("event_id"))
                .subscriptionId(rs.getString("subscription_id"))
                .taskId(rs.getString("task_id"))
                .accountId(rs.getString("account_id"))
                .eventType(rs.getString("event_type"))
                .failureReason(rs.getString("failure_reason"))
                .retryCount(rs.getInt("retry_count"))
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .build();
    };

    public void upsert(DlqItem item) {
        jdbcTemplate.update(UPSERT_SQL,
                item.getEventId(), item.getSubscriptionId(), item.getTaskId(), item.getAccountId(),
                item.getEventType(), item.getFailureReason(), item.getRetryCount());
    }

    /** Event'e ait kayıtlar; subscriptionId null ise hepsi. */
    public List<DlqItem> findByEvent(String accountId, String eventId, String subscriptionId) {
        if (subscriptionId == null) {
            return jdbcTemplate.query(
                    "SELECT * FROM dlq_items WHERE account_id = ? AND event_id = ? ORDER BY subscription_id, created_at",
                    dlqRowMapper, accountId, eventId);
        }
        return jdbcTemplate.query(
                "SELECT * FROM dlq_items WHERE account_id = ? AND event_id = ? AND subscription_id = ? ORDER BY created_at",
                dlqRowMapper, accountId, eventId, subscriptionId);
    }

    /** Filtreli ve sayfalı liste; en eski önce. */
    public List<DlqItem> list(String accountId, String eventType, String subscriptionId, int limit, int offset) {
        StringBuilder sql = new StringBuilder("SELECT * FROM dlq_items WHERE account_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(accountId);
        if (eventType != null) {
            sql.append(" AND event_type = ?");
            args.add(eventType);
        }
        if (subscriptionId != null) {
            sql.append(" AND subscription_id = ?");
            args.add(subscriptionId);
        }
        sql.append(" ORDER BY created_at, event_id, subscription_id, task_id LIMIT ? OFFSET ?");
        args.add(limit);
        args.add(offset);
        return jdbcTemplate.query(sql.toString(), dlqRowMapper, args.toArray());
    }

    public int count(String accountId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM dlq_items WHERE account_id = ?", Integer.class, accountId);
        return count != null ? count : 0;
    }

    /** event_type → adet. */
    public Map<String, Integer> countByEventType(String accountId) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT event_type, COUNT(*) AS cnt FROM dlq_items WHERE account_id = ? GROUP BY event_type ORDER BY event_type",
                rs -> {
                    counts.put(rs.getString("event_type"), rs.getInt("cnt"));
                },
                accountId);
        return counts;
    }

    /** Kaydı siler; başka bir operatör önce davrandıysa false. */
    public boolean delete(String taskId) {
        return jdbcTemplate.update("DELETE FROM dlq_items WHERE task_id = ?", taskId) > 0;
    }
}
