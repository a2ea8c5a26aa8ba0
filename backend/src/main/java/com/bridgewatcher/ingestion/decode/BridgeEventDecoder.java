package com.bridgewatcher.ingestion.decode;

import com.bridgewatcher.common.AddressFormat;
import com.bridgewatcher.domain.EventRecord;
import com.bridgewatcher.ingestion.adapter.EventSelector;
import com.bridgewatcher.ingestion.adapter.RawLogEntry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Decodes {@code BridgeTransferInitiated} logs.
 *
 * <p>Layout:
 * <ul>
 *   <li>topics[0]: event selector</li>
 *   <li>topics[1]: sender (indexed address)</li>
 *   <li>topics[2]: destination chain id (indexed uint256)</li>
 *   <li>topics[3]: recipient (indexed address)</li>
 *   <li>data: token address, amount, nonce; one 32-byte word each</li>
 * </ul>
 * Any missing or malformed field fails the whole log with {@link EventDecodingException}; no partial records.
 */
@Component
public class BridgeEventDecoder {

    private static final int WORD_HEX_CHARS = 64;
    private static final String[] DATA_FIELDS = {"token", "amount", "nonce"};
    private static final BigInteger MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);

    public EventRecord decode(RawLogEntry log, EventSelector selector, long sourceChainId) {
        if (log.removed()) {
            throw new EventDecodingException("Log was removed by a chain reorganization: " + log.describe());
        }
        if (log.transactionHash() == null || log.transactionHash().isBlank()) {
            throw new EventDecodingException("Missing transactionHash: " + log.describe());
        }
        if (log.blockNumber() == null) {
            throw new EventDecodingException("Missing blockNumber: " + log.describe());
        }
        if (log.logIndex() == null) {
            throw new EventDecodingException("Missing logIndex: " + log.describe());
        }
        List<String> topics = log.topics();
        if (topics.isEmpty() || !selector.topic().equalsIgnoreCase(topics.get(0))) {
            throw new EventDecodingException("Selector mismatch, expected " + selector.topic() + ": " + log.describe());
        }
        if (log.address() != null && !log.address().equalsIgnoreCase(selector.contractAddress())) {
            throw new EventDecodingException("Log emitted by unexpected contract " + log.address() + ": " + log.describe());
        }
        if (topics.size() < 4) {
            throw new EventDecodingException("Expected 4 topics, got " + topics.size() + ": " + log.describe());
        }
        String[] words = splitData(log);

        try {
            String sender = AddressFormat.fromWord(topics.get(1));
            long destinationChainId = toLong("destinationChainId", wordToUint(topics.get(2)));
            String recipient = AddressFormat.fromWord(topics.get(3));
            String token = AddressFormat.fromWord(words[0]);
            BigInteger amount = wordToUint(words[1]);
            BigInteger nonce = wordToUint(words[2]);
            return new EventRecord(sender, recipient, token, amount, sourceChainId, destinationChainId, nonce,
                    log.transactionHash(), log.blockNumber(), log.logIndex());
        } catch (IllegalArgumentException e) {
            throw new EventDecodingException(e.getMessage() + ": " + log.describe(), e);
        }
    }

    private static String[] splitData(RawLogEntry log) {
        String data = log.data();
        if (data == null || !data.startsWith("0x")) {
            throw new EventDecodingException("Missing data: " + log.describe());
        }
        String hex = data.substring(2);
        int available = hex.length() / WORD_HEX_CHARS;
        if (available < DATA_FIELDS.length) {
            throw new EventDecodingException("Missing " + DATA_FIELDS[available] + " in data ("
                    + hex.length() / 2 + " bytes): " + log.describe());
        }
        String[] words = new String[DATA_FIELDS.length];
        for (int i = 0; i < words.length; i++) {
            words[i] = "0x" + hex.substring(i * WORD_HEX_CHARS, (i + 1) * WORD_HEX_CHARS);
        }
        return words;
    }

    private static BigInteger wordToUint(String word) {
        if (!AddressFormat.isWord(word)) {
            throw new IllegalArgumentException("Not a 32-byte word: " + word);
        }
        return new BigInteger(word.substring(2), 16);
    }

    private static long toLong(String field, BigInteger value) {
        if (value.compareTo(MAX_LONG) > 0) {
            throw new IllegalArgumentException(field + " out of range: " + value);
        }
        return value.longValueExact();
    }
}
