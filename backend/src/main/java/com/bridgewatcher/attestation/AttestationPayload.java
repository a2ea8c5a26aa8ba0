package com.bridgewatcher.attestation;

import com.bridgewatcher.domain.EventRecord;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigInteger;

/**
 * JSON body POSTed to the attestation API. {@code amount} is a decimal string so 256-bit values survive
 * JSON parsers that read numbers as doubles.
 */
@JsonPropertyOrder({"from", "to", "token", "amount", "sourceChainId", "destinationChainId", "nonce",
        "transactionHash", "blockNumber"})
public record AttestationPayload(
        String from,
        String to,
        String token,
        String amount,
        long sourceChainId,
        long destinationChainId,
        BigInteger nonce,
        String transactionHash,
        long blockNumber
) {

    public static AttestationPayload from(EventRecord record) {
        return new AttestationPayload(
                record.fromAddress(),
                record.toAddress(),
                record.tokenAddress(),
                record.amount().toString(),
                record.sourceChainId(),
                record.destinationChainId(),
                record.nonce(),
                record.transactionHash(),
                record.blockNumber());
    }
}
