package com.bridgewatcher.attestation;

/**
 * One HTTP round trip to the attestation API. No retries here; {@link AttestationSink} owns the policy.
 */
public interface AttestationApiClient {

    /**
     * @return the response, whatever its status
     * @throws AttestationTransportException when no response was received
     */
    AttestationResponse post(AttestationPayload payload);
}
