package com.bridgewatcher.attestation;

/**
 * No HTTP response was received: connection failure, timeout, or a reset mid-request.
 */
public class AttestationTransportException extends RuntimeException {

    public AttestationTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
