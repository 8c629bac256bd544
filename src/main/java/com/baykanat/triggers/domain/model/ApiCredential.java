package com.baykanat.triggers.domain.model;

import com.baykanat.triggers.domain.exception.InsufficientScopeException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/** Doğrulanmış istek kimliği; filter tarafından request attribute olarak taşınır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiCredential {

    public static final String REQUEST_ATTRIBUTE = "triggers.credential";

    public static final String SCOPE_EVENTS_WRITE = "events:write";
    public static final String SCOPE_EVENTS_READ = "events:read";
    public static final String SCOPE_INBOX_READ = "inbox:read";
    public static final String SCOPE_ADMIN = "admin";

    private String keyId;
    private String accountId;
    private Set<String> scopes;
    private String tier;

    /** admin tüm scope'ları kapsar. */
    public boolean hasScope(String scope) {
        return scopes != null && (scopes.contains(SCOPE_ADMIN) || scopes.contains(scope));
    }

    public void requireScope(String scope) {
        if (!hasScope(scope)) {
            throw new InsufficientScopeException(scope);
        }
    }

    /** Rate limit bucket anahtarı: credential başına. */
    public String rateLimitKey() {
        return "ratelimit:" + keyId;
    }
}
