package com.baykanat.triggers.infrastructure.persistence;

import com.baykanat.triggers.domain.model.DeliveryTask;
import com.baykanat.triggers.domain.model.DeliveryTaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * delivery_tasks tablosu üzerinde visibility-timeout tabanlı kuyruk.
 * Claim edilen task lease süresince gizlenir; lease dolarsa tekrar claim edilebilir.
 * Worker tarafındaki tüm geçişler lease token ile koşullu.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DeliveryTaskJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO delivery_tasks (id, event_id, subscription_id, attempt_number, status, visible_at, causation_id,
                                        data_override, metadata_override)
            VALUES (?, ?, ?, 0, 'pending', NOW(), ?, ?::jsonb, ?::jsonb)
            ON CONFLICT DO NOTHING
            """;

    private static final String CLAIM_SQL = """
            UPDATE delivery_tasks t
            SET status = 'in_flight',
                lease_token = ?,
                visible_at = NOW() + INTERVAL '1 millisecond' * ?,
                updated_at = NOW()
            WHERE t.id IN (
                SELECT id FROM delivery_tasks
                WHERE status IN ('pending', 'in_flight') AND visible_at <= NOW()
                ORDER BY visible_at
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            RETURNING t.*
            """;

    private final RowMapper<DeliveryTask> taskRowMapper = (rs, rowNum) -> mapTask(rs);

    /** Task'ları toplu yazar; aynı (event, subscription) için ikinci orijinal task atlanır. */
    public int[][] batchInsert(List<DeliveryTask> tasks) {
        return jdbcTemplate.batchUpdate(INSERT_SQL, tasks, tasks.size(),
                (ps, task) -> {
                    ps.setString(1, task.getId());
                    ps.setString(2, task.getEventId());
                    ps.setString(3, task.getSubscriptionId());
                    ps.setString(4, task.getCausationId());
                    setJson(ps, 5, task.getDataOverride());
                    setJson(ps, 6, task.getMetadataOverride());
                });
    }

    /** Vadesi gelmiş task'ları kiralar (SKIP LOCKED ile replica'lar arası çakışmasız). */
    public List<DeliveryTask> claimDue(int limit, long visibilityTimeoutMs, String leaseToken) {
        return jdbcTemplate.query(CLAIM_SQL, taskRowMapper, leaseToken, visibilityTimeoutMs, limit);
    }

    public Optional<DeliveryTask> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM delivery_tasks WHERE id = ?", taskRowMapper, id)
                .stream().findFirst();
    }

    public List<DeliveryTask> findByEventId(String eventId) {
        return jdbcTemplate.query(
                "SELECT * FROM delivery_tasks WHERE event_id = ? ORDER BY created_at, id", taskRowMapper, eventId);
    }

    /** HTTP çağrısından hemen önce lease'i uzatır. İptal edilmiş veya lease'i kaybedilmiş task için false. */
    public boolean renewLease(String id, String leaseToken, long leaseMs) {
        return jdbcTemplate.update("""
                        UPDATE delivery_tasks
                        SET visible_at = NOW() + INTERVAL '1 millisecond' * ?, updated_at = NOW()
                        WHERE id = ? AND lease_token = ? AND status = 'in_flight'
                        """,
                leaseMs, id, leaseToken) > 0;
    }

    public boolean markSucceeded(String id, String leaseToken, int attemptNumber) {
        return jdbcTemplate.update("""
                        UPDATE delivery_tasks
                        SET status = 'succeeded', attempt_number = ?, lease_token = NULL, last_error = NULL, updated_at = NOW()
                        WHERE id = ? AND lease_token = ? AND status = 'in_flight'
                        """,
                attemptNumber, id, leaseToken) > 0;
    }

    /** Gecikmeli yeniden kuyruklama; worker beklemez, task visible_at'e kadar gizli kalır. */
    public boolean scheduleRetry(String id, String leaseToken, int attemptNumber, long delayMs, String error) {
        return jdbcTemplate.update("""
                        UPDATE delivery_tasks
                        SET status = 'pending', attempt_number = ?, lease_token = NULL, last_error = ?,
                            visible_at = NOW() + INTERVAL '1 millisecond' * ?, updated_at = NOW()
                        WHERE id = ? AND lease_token = ? AND status = 'in_flight'
                        """,
                attemptNumber, error, delayMs, id, leaseToken) > 0;
    }

    public boolean markDeadLettered(String id, String leaseToken, int attemptNumber, String error) {
        return jdbcTemplate.update("""
                        UPDATE delivery_tasks
                        SET status = 'dead_lettered', attempt_number = ?, lease_token = NULL, last_error = ?, updated_at = NOW()
                        WHERE id = ? AND lease_token = ? AND status = 'in_flight'
                        """,
                attemptNumber, error, id, leaseToken) > 0;
    }

    /** Worker tarafı iptal (subscription disabled / silinmiş). */
    public boolean cancel(String id, String leaseToken, String reason) {
        return jdbcTemplate.update("""
                        UPDATE delivery_tasks
                        SET status = 'cancelled', lease_token = NULL, last_error = ?, updated_at = NOW()
                        WHERE id = ? AND lease_token = ? AND status = 'in_flight'
                        """,
                reason, id, leaseToken) > 0;
    }

    /** Deneme harcamadan task'ı geri bırakır (paused subscription). */
    public boolean release(String id, String leaseToken, long delayMs) {
        return jdbcTemplate.update("""
                        UPDATE delivery_tasks
                        SET status = 'pending', lease_token = NULL,
                            visible_at = NOW() + INTERVAL '1 millisecond' * ?, updated_at = NOW()
                        WHERE id = ? AND lease_token = ? AND status = 'in_flight'
                        """,
                delayMs, id, leaseToken) > 0;
    }

    /** DLQ retry: dead_lettered task'ı sıfır denemeyle hemen görünür yapar. */
    public boolean resetForRetry(String id) {
        return jdbcTemplate.update("""
                        UPDATE delivery_tasks
                        SET status = 'pending', attempt_number = 0, manual_retries = manual_retries + 1, lease_token = NULL,
                            visible_at = NOW(), updated_at = NOW()
                        WHERE id = ? AND status = 'dead_lettered'
                        """,
                id) > 0;
    }

    /**
     * DLQ dismiss: çift için açık replay task'larını iptal eder; uçuştaki çağrı lease yenilemede durur.
     * Açık orijinal task'a dokunulmaz, iptali event'i çözümsüz bırakırdı.
     */
    public int cancelOpenReplayTasks(String eventId, String subscriptionId, String reason) {
        return jdbcTemplate.update("""
                        UPDATE delivery_tasks
                        SET status = 'cancelled', lease_token = NULL, last_error = ?, updated_at = NOW()
                        WHERE event_id = ? AND subscription_id = ? AND causation_id IS NOT NULL
                          AND status IN ('pending', 'in_flight')
                        """,
                reason, eventId, subscriptionId);
    }

    private static void setJson(PreparedStatement ps, int index, String json) throws SQLException {
        if (json != null) {
            ps.setString(index, json);
        } else {
            ps.setNull(index, Types.OTHER);
        }
    }

    private DeliveryTask mapTask(ResultSet rs) throws SQLException {
        return DeliveryTask.builder()
                .id(rs.getString("id"))
                .eventId(rs.getString("event_id"))
                .subscriptionId(rs.getString("subscription_id"))
                .attemptNumber(rs.getInt("attempt_number"))
                .status(DeliveryTaskStatus.fromValue(rs.getString("status")))
                .visibleAt(toInstant(rs.getTimestamp("visible_at")))
                .leaseToken(rs.getString("lease_token"))
                .causationId(rs.getString("causation_id"))
                .dataOverride(rs.getString("data_override"))
                .metadataOverride(rs.getString("metadata_override"))
                .manualRetries(rs.getInt("manual_retries"))
                .lastError(rs.getString("last_error"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
