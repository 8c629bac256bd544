package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/** api_keys satırı; ham key saklanmaz, sadece SHA-256 hash. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKey {

    private String id;
    private String accountId;
    private String keyHash;
    private Set<String> scopes;
    private String tier;
    private boolean active;
}
