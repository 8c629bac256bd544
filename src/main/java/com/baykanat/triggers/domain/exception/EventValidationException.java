package com.baykanat.triggers.domain.exception;

/** Girdi doğrulama hatası; GlobalExceptionHandler 400 döner, batch'te öğe bazlı hataya çevrilir. */
public class EventValidationException extends RuntimeException {

    private final String field;

    public EventValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
