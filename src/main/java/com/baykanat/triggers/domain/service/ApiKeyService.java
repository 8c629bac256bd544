package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.exception.AuthenticationFailedException;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.model.ApiKey;
import com.baykanat.triggers.infrastructure.persistence.ApiKeyJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Ham API key'i SHA-256 hash ile çözer; key'in kendisi hiçbir yerde saklanmaz. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private final ApiKeyJdbcRepository apiKeyRepository;

    /** Geçerli ve aktif key için credential döner; aksi halde 401. */
    public ApiCredential authenticate(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            throw new AuthenticationFailedException("Missing API key");
        }

        ApiKey apiKey = apiKeyRepository.findByHash(hashKey(rawKey.trim()))
                .orElseThrow(() -> new AuthenticationFailedException("Invalid API key"));
        if (!apiKey.isActive()) {
            log.warn("Rejected inactive API key id={}", apiKey.getId());
            throw new AuthenticationFailedException("API key is inactive");
        }

        return ApiCredential.builder()
                .keyId(apiKey.getId())
                .accountId(apiKey.getAccountId())
                .scopes(apiKey.getScopes())
                .tier(apiKey.getTier())
                .build();
    }

    /** Girdi string'in SHA-256 hash'ini hesaplar. */
    public static String hashKey(String rawKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(rawKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
