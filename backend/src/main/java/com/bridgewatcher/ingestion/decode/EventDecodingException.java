package com.bridgewatcher.ingestion.decode;

/**
 * A raw log could not be turned into an EventRecord (missing or malformed field, wrong topic, removed log).
 * Affects only that log; the scan continues with the rest.
 */
public class EventDecodingException extends RuntimeException {

    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
