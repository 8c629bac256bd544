package com.baykanat.triggers.domain.exception;

/** Event, subscription veya DLQ kaydı bulunamadı → 404. */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
    }
}
