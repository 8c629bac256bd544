package com.baykanat.triggers.infrastructure.persistence;

import com.baykanat.triggers.domain.model.ApiKey;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.stream.Collectors;

/** api_keys tablosu; lookup sadece SHA-256 hash ile. */
@Repository
@RequiredArgsConstructor
public class ApiKeyJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<ApiKey> findByHash(String keyHash) {
        return jdbcTemplate.query("SELECT * FROM api_keys WHERE key_hash = ?",
                (rs, rowNum) -> ApiKey.builder()
                        .id(rs.getString("id"))
                        .accountId(rs.getString("account_id"))
                        .keyHash(rs.getString("key_hash"))
                        .scopes(Arrays.stream(rs.getString("scopes").split(","))
                                .map(String::trim)
                                .filter(scope -> !scope.isEmpty())
                                .collect(Collectors.toCollection(LinkedHashSet::new)))
                        .tier(rs.getString("tier"))
                        .active(rs.getBoolean("active"))
                        .build(),
                keyHash).stream().findFirst();
    }
}
