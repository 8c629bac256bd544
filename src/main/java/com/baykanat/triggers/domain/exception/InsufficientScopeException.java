package com.baykanat.triggers.domain.exception;

/** Key geçerli ama gerekli scope yok → 403. */
public class InsufficientScopeException extends RuntimeException {

    public InsufficientScopeException(String requiredScope) {
        super("Missing required scope: " + requiredScope);
    }
}
