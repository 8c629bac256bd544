package com.baykanat.triggers.infrastructure.persistence;

import com.baykanat.triggers.domain.model.DeliveryAttempt;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;

/** delivery_attempts: append-only audit, her HTTP çağrısı için tek satır. */
@Repository
@RequiredArgsConstructor
public class DeliveryAttemptJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO delivery_attempts (event_id, subscription_id, task_id, attempt_number, success, status_code,
                                           error_type, error_message, response_body, latency_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    public void insert(DeliveryAttempt attempt) {
        jdbcTemplate.update(INSERT_SQL, ps -> {
            ps.setString(1, attempt.getEventId());
            ps.setString(2, attempt.getSubscriptionId());
            ps.setString(3, attempt.getTaskId());
            ps.setInt(4, attempt.getAttemptNumber());
            ps.setBoolean(5, attempt.isSuccess());
            if (attempt.getStatusCode() != null) {
                ps.setInt(6, attempt.getStatusCode());
            } else {
                ps.setNull(6, Types.INTEGER);
            }
            ps.setString(7, attempt.getErrorType());
            ps.setString(8, attempt.getErrorMessage());
            ps.setString(9, attempt.getResponseBody());
            ps.setLong(10, attempt.getLatencyMs());
        });
    }

    public List<DeliveryAttempt> findByEventId(String eventId) {
        return jdbcTemplate.query("SELECT * FROM delivery_attempts WHERE event_id = ? ORDER BY attempted_at, id",
                (rs, rowNum) -> {
                    int statusCode = rs.getInt("status_code");
                    Integer status = rs.wasNull() ? null : statusCode;
                    Timestamp attemptedAt = rs.getTimestamp("attempted_at");
                    return DeliveryAttempt.builder()
                            .id(rs.getLong("id"))
                            .eventId(rs.getString("event_id"))
                            .subscriptionId(rs.getString("subscription_id"))
                            .taskId(rs.getString("task_id"))
                            .attemptNumber(rs.getInt("attempt_number"))
                            .success(rs.getBoolean("success"))
                            .statusCode(status)
                            .errorType(rs.getString("error_type"))
                            .errorMessage(rs.getString("error_message"))
                            .latencyMs(rs.getLong("latency_ms"))
                            .attemptedAt(attemptedAt != null ? attemptedAt.toInstant() : null)
                            .build();
                },
                eventId);
    }
}
