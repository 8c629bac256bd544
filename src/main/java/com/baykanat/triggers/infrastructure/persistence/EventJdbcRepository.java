package com.baykanat.triggers.infrastructure.persistence;

import com.baykanat.triggers.domain.model.Event;
import com.baykanat.triggers.domain.model.EventFilter;
import com.baykanat.triggers.domain.model.EventStatus;
import com.baykanat.triggers.domain.model.InboxItem;
import com.baykanat.triggers.domain.model.InboxStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** events tablosu: insert, durum/sayaç geçişleri ve inbox lease işlemleri. Tüm geçişler koşullu UPDATE. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO events (id, account_id, type, source, data, metadata, idempotency_key, correlation_id, status, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            """;

    private static final String MARK_DISPATCHED_SQL = """
            UPDATE events
            SET status = ?, matched_subscriptions = ?, updated_at = NOW()
            WHERE id = ? AND status = 'pending'
            """;

    /**
     * Sayaçları artırır ve tüm teslimler çözüldüyse terminal durumu hesaplar.
     * SET ifadelerindeki sütunlar eski satır değerlerini okur.
     */
    private static final String RECORD_OUTCOME_SQL = """
            UPDATE events
            SET successful_deliveries = successful_deliveries + ?,
                failed_deliveries = failed_deliveries + ?,
                status = CASE
                    WHEN matched_subscriptions > 0
                         AND successful_deliveries + ? + failed_deliveries + ? >= matched_subscriptions THEN
                        CASE
                            WHEN failed_deliveries + ? = 0 THEN 'delivered'
                            WHEN successful_deliveries + ? = 0 THEN 'failed'
                            ELSE 'partially_delivered'
                        END
                    ELSE status
                END,
                updated_at = NOW()
            WHERE id = ?
            """;

    /** Inbox'a düşen event'ler: teslimi sürenler ve hiç subscription'a eşleşmeyenler. */
    private static final String INBOX_ELIGIBLE = """
            account_id = ?
              AND inbox_acked_at IS NULL
              AND (status IN ('pending', 'processing') OR matched_subscriptions = 0)
            """;

    private static final String LEASE_INBOX_SQL = """
            UPDATE events e
            SET inbox_receipt = gen_random_uuid()::text,
                inbox_visible_until = NOW() + INTERVAL '1 second' * ?
            WHERE e.id IN (
                SELECT id FROM events
                WHERE %s
                  AND (inbox_visible_until IS NULL OR inbox_visible_until <= NOW())
                  AND id > ?%s
                ORDER BY id
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            RETURNING e.*
            """;

    private static final String CHANGE_VISIBILITY_SQL = """
            UPDATE events
            SET inbox_visible_until = NOW() + INTERVAL '1 second' * ?
            WHERE id = ? AND account_id = ? AND inbox_receipt = ?
              AND inbox_acked_at IS NULL AND inbox_visible_until > NOW()
            RETURNING inbox_visible_until
            """;

    private static final String INBOX_STATS_SQL = """
            SELECT COUNT(*) FILTER (WHERE inbox_visible_until IS NULL OR inbox_visible_until <= NOW()) AS visible,
                   COUNT(*) FILTER (WHERE inbox_visible_until > NOW()) AS in_flight,
                   COUNT(*) AS total,
                   MIN(created_at) AS oldest
            FROM events
            WHERE %s
            """;

    private static final String ACK_INBOX_SQL = """
            UPDATE events
            SET inbox_acked_at = NOW()
            WHERE id = ? AND account_id = ? AND inbox_receipt = ?
              AND inbox_acked_at IS NULL AND inbox_visible_until > NOW()
            """;

    private final RowMapper<Event> eventRowMapper = (rs, rowNum) -> mapEvent(rs);

    /** Yeni event satırı yazar (status=pending). */
    public void insert(Event event) {
        Instant createdAt = event.getCreatedAt() != null ? event.getCreatedAt() : Instant.now();
        jdbcTemplate.update(INSERT_SQL, ps -> {
            ps.setString(1, event.getId());
            ps.setString(2, event.getAccountId());
            ps.setString(3, event.getType());
            ps.setString(4, event.getSource());
            ps.setString(5, event.getData());
            if (event.getMetadata() != null) {
                ps.setString(6, event.getMetadata());
            } else {
                ps.setNull(6, Types.OTHER);
            }
            ps.setString(7, event.getIdempotencyKey());
            ps.setString(8, event.getCorrelationId());
            ps.setString(9, EventStatus.PENDING.value());
            ps.setTimestamp(10, Timestamp.from(createdAt));
            ps.setTimestamp(11, Timestamp.from(createdAt));
        });
    }

    public Optional<Event> findById(String id) {
        List<Event> rows = jdbcTemplate.query("SELECT * FROM events WHERE id = ?", eventRowMapper, id);
        return rows.stream().findFirst();
    }

    /** Hesap kapsamında event arar; başka hesabın event'i yokmuş gibi davranır. */
    public Optional<Event> findByIdAndAccount(String id, String accountId) {
        List<Event> rows = jdbcTemplate.query(
                "SELECT * FROM events WHERE id = ? AND account_id = ?", eventRowMapper, id, accountId);
        return rows.stream().findFirst();
    }

    /** pending → processing/delivered. Event artık pending değilse 0 döner (tekrar tüketim). */
    public int markDispatched(String id, int matchedSubscriptions, EventStatus status) {
        return jdbcTemplate.update(MARK_DISPATCHED_SQL, status.value(), matchedSubscriptions, id);
    }

    /** Teslim sonucunu sayaçlara işler ve gerekiyorsa terminal durumu atomik hesaplar. */
    public int recordOutcome(String id, int successDelta, int failureDelta) {
        return jdbcTemplate.update(RECORD_OUTCOME_SQL,
                successDelta, failureDelta,
                successDelta, failureDelta,
                failureDelta, successDelta,
                id);
    }

    public void incrementDeliveryAttempts(String id) {
        jdbcTemplate.update("UPDATE events SET delivery_attempts = delivery_attempts + 1, updated_at = NOW() WHERE id = ?", id);
    }

    /** DLQ retry: başarısız sayılmış çifti yeniden açar; durum çözümlemede tekrar hesaplanır. */
    public int reopenFailedDelivery(String id) {
        return jdbcTemplate.update("""
                        UPDATE events
                        SET failed_deliveries = GREATEST(failed_deliveries - 1, 0), status = 'processing', updated_at = NOW()
                        WHERE id = ? AND matched_subscriptions > 0
                        """,
                id);
    }

    /** Replay sayacını sınır altındaysa artırır; sınır doluysa false. */
    public boolean incrementReplayCount(String id, int maxReplays) {
        int updated = jdbcTemplate.update(
                "UPDATE events SET replay_count = replay_count + 1, updated_at = NOW() WHERE id = ? AND replay_count < ?",
                id, maxReplays);
        return updated > 0;
    }

    /** Eşikten uzun süredir pending kalan event'ler (kuyruğa yazılamamış olabilir). */
    public List<Event> findStalePending(long olderThanMs, int limit) {
        return jdbcTemplate.query("""
                        SELECT * FROM events
                        WHERE status = 'pending' AND created_at < NOW() - INTERVAL '1 millisecond' * ?
                        ORDER BY created_at
                        LIMIT ?
                        """,
                eventRowMapper, olderThanMs, limit);
    }

    /**
     * Görünür ve onaylanmamış event'leri kiralar, yeni receipt token atar; id sırasına göre döner.
     * types/sources boş veya null ise filtre uygulanmaz.
     */
    public List<InboxItem> leaseInboxItems(String accountId, String afterId, int limit, int visibilityTimeoutSeconds,
                                           List<String> types, List<String> sources) {
        List<Object> args = new ArrayList<>();
        args.add(visibilityTimeoutSeconds);
        args.add(accountId);
        args.add(afterId != null ? afterId : "");
        StringBuilder filters = new StringBuilder();
        appendIn(filters, args, "type", types);
        appendIn(filters, args, "source", sources);
        args.add(limit);

        String sql = LEASE_INBOX_SQL.formatted(INBOX_ELIGIBLE, filters);
        List<InboxItem> items = jdbcTemplate.query(sql,
                (rs, rowNum) -> InboxItem.builder()
                        .event(mapEvent(rs))
                        .receiptToken(rs.getString("inbox_receipt"))
                        .visibleUntil(toInstant(rs.getTimestamp("inbox_visible_until")))
                        .build(),
                args.toArray());
        return items.stream()
                .sorted(Comparator.comparing(item -> item.getEvent().getId()))
                .toList();
    }

    /** Açık lease'in süresini değiştirir; 0 saniye event'i hemen serbest bırakır. Lease yoksa empty. */
    public Optional<Instant> changeInboxVisibility(String id, String accountId, String receiptToken, int visibilityTimeoutSeconds) {
        return jdbcTemplate.query(CHANGE_VISIBILITY_SQL,
                        (rs, rowNum) -> toInstant(rs.getTimestamp("inbox_visible_until")),
                        visibilityTimeoutSeconds, id, accountId, receiptToken)
                .stream().findFirst();
    }

    public InboxStats inboxStats(String accountId) {
        return jdbcTemplate.queryForObject(INBOX_STATS_SQL.formatted(INBOX_ELIGIBLE),
                (rs, rowNum) -> InboxStats.builder()
                        .visible(rs.getInt("visible"))
                        .inFlight(rs.getInt("in_flight"))
                        .total(rs.getInt("total"))
                        .oldestEventAt(toInstant(rs.getTimestamp("oldest")))
                        .build(),
                accountId);
    }

    /** Inbox'taki event'lerin type → adet dağılımı. */
    public Map<String, Integer> inboxCountByType(String accountId) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        jdbcTemplate.query("SELECT type, COUNT(*) AS cnt FROM events WHERE " + INBOX_ELIGIBLE + " GROUP BY type ORDER BY type",
                rs -> {
                    counts.put(rs.getString("type"), rs.getInt("cnt"));
                },
                accountId);
        return counts;
    }

    /** Filtreli liste, en yeni önce; beforeId verilirse ondan küçük id'ler. limit kadar satır döner. */
    public List<Event> list(String accountId, EventFilter filter, String beforeId, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM events WHERE account_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(accountId);
        if (filter.getType() != null) {
            sql.append(" AND type = ?");
            args.add(filter.getType());
        }
        if (filter.getSource() != null) {
            sql.append(" AND source = ?");
            args.add(filter.getSource());
        }
        if (filter.getStatus() != null) {
            sql.append(" AND status = ?");
            args.add(filter.getStatus().value());
        }
        if (filter.getSince() != null) {
            sql.append(" AND created_at >= ?");
            args.add(Timestamp.from(filter.getSince()));
        }
        if (filter.getUntil() != null) {
            sql.append(" AND created_at <= ?");
            args.add(Timestamp.from(filter.getUntil()));
        }
        if (beforeId != null) {
            sql.append(" AND id < ?");
            args.add(beforeId);
        }
        sql.append(" ORDER BY id DESC LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), eventRowMapper, args.toArray());
    }

    /** Lease hâlâ açık ve token eşleşiyorsa onaylar; aksi halde no-op (false). */
    public boolean acknowledgeInboxItem(String id, String accountId, String receiptToken) {
        return jdbcTemplate.update(ACK_INBOX_SQL, id, accountId, receiptToken) > 0;
    }

    private Event mapEvent(ResultSet rs) throws SQLException {
        return Event.builder()
                .id(rs.getString("id"))
                .accountId(rs.getString("account_id"))
                .type(rs.getString("type"))
                .source(rs.getString("source"))
                .data(rs.getString("data"))
                .metadata(rs.getString("metadata"))
                .idempotencyKey(rs.getString("idempotency_key"))
                .correlationId(rs.getString("correlation_id"))
                .status(EventStatus.fromValue(rs.getString("status")))
                .matchedSubscriptions(rs.getInt("matched_subscriptions"))
                .deliveryAttempts(rs.getInt("delivery_attempts"))
                .successfulDeliveries(rs.getInt("successful_deliveries"))
                .failedDeliveries(rs.getInt("failed_deliveries"))
                .replayCount(rs.getInt("replay_count"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static void appendIn(StringBuilder sql, List<Object> args, String column, List<String> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        sql.append(" AND ").append(column).append(" IN (")
                .append(String.join(", ", Collections.nCopies(values.size(), "?")))
                .append(')');
        args.addAll(values);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
