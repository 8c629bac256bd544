package com.baykanat.triggers.infrastructure.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/** idempotency_keys tablosu: (account, key) → event_id, TTL ile. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class IdempotencyJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Süresi dolmuş kayıt varsa üzerine yazar; canlı kayıt varsa dokunmaz. */
    private static final String RESERVE_SQL = """
            INSERT INTO idempotency_keys (account_id, idempotency_key, event_id, expires_at)
            VALUES (?, ?, ?, NOW() + INTERVAL '1 second' * ?)
            ON CONFLICT (account_id, idempotency_key) DO UPDATE
            SET event_id = EXCLUDED.event_id, expires_at = EXCLUDED.expires_at, created_at = NOW()
            WHERE idempotency_keys.expires_at <= NOW()
            """;

    /** Süresi dolmamış kayıt için event id döner. */
    public Optional<String> findActiveEventId(String accountId, String key) {
        List<String> rows = jdbcTemplate.queryForList(
                "SELECT event_id FROM idempotency_keys WHERE account_id = ? AND idempotency_key = ? AND expires_at > NOW()",
                String.class, accountId, key);
        return rows.stream().findFirst();
    }

    /** Key'i event'e bağlar. Canlı bir kayıt zaten varsa false (yarışı kaybeden taraf). */
    public boolean reserve(String accountId, String key, String eventId, long ttlSeconds) {
        return jdbcTemplate.update(RESERVE_SQL, accountId, key, eventId, ttlSeconds) > 0;
    }

    /** Süresi dolmuş kayıtları siler; silinen sayıyı döner. */
    public int deleteExpired() {
        return jdbcTemplate.update("DELETE FROM idempotency_keys WHERE expires_at <= NOW()");
    }
}
