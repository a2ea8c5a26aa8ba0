package com.bridgewatcher.ingestion.decode;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Event topic0: Keccak-256 of the canonical event signature, e.g.
 * {@code Transfer(address,address,uint256)} → {@code 0xddf252ad…}.
 */
public final class EventSignature {

    public static final String BRIDGE_TRANSFER_INITIATED =
            "BridgeTransferInitiated(address,uint256,address,address,uint256,uint256)";

    private EventSignature() {
    }

    public static String topicOf(String signature) {
        Objects.requireNonNull(signature, "signature cannot be null");
        String canonical = signature.replace(" ", "");
        Keccak.Digest256 digest = new Keccak.Digest256();
        return "0x" + Hex.toHexString(digest.digest(canonical.getBytes(StandardCharsets.US_ASCII)));
    }

    /** Event name part of the signature ("BridgeTransferInitiated"). */
    public static String nameOf(String signature) {
        int paren = signature.indexOf('(');
        return paren > 0 ? signature.substring(0, paren).trim() : signature.trim();
    }
}
