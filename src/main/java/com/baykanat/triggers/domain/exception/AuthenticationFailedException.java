package com.baykanat.triggers.domain.exception;

/** Eksik, bilinmeyen veya pasif API key → 401. */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
