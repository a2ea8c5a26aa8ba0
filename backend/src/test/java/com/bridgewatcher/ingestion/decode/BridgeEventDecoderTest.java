package com.bridgewatcher.ingestion.decode;

import com.bridgewatcher.domain.EventRecord;
import com.bridgewatcher.ingestion.adapter.RawLogEntry;
import com.bridgewatcher.support.BridgeLogs;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.bridgewatcher.support.BridgeLogs.SELECTOR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BridgeEventDecoderTest {

    private final BridgeEventDecoder decoder = new BridgeEventDecoder();

    @Test
    void decode_wellFormedLog_extractsAllFields() {
        RawLogEntry log = BridgeLogs.transfer(105, 3, "0xabc", new BigInteger("1000000000000000000"), BigInteger.valueOf(42));

        EventRecord record = decoder.decode(log, SELECTOR, 11155111L);

        assertThat(record.fromAddress()).isEqualTo(BridgeLogs.SENDER);
        assertThat(record.toAddress()).isEqualTo(BridgeLogs.RECIPIENT);
        assertThat(record.tokenAddress()).isEqualTo(BridgeLogs.TOKEN);
        assertThat(record.amount()).isEqualTo(new BigInteger("1000000000000000000"));
        assertThat(record.nonce()).isEqualTo(BigInteger.valueOf(42));
        assertThat(record.sourceChainId()).isEqualTo(11155111L);
        assertThat(record.destinationChainId()).isEqualTo(137L);
        assertThat(record.transactionHash()).isEqualTo("0xabc");
        assertThat(record.blockNumber()).isEqualTo(105L);
        assertThat(record.logIndex()).isEqualTo(3L);
    }

    @Test
    void decode_amountAboveLongRange_keptExact() {
        BigInteger huge = BigInteger.TWO.pow(200).add(BigInteger.ONE);
        EventRecord record = decoder.decode(BridgeLogs.transfer(1, 0, huge, BigInteger.ONE), SELECTOR, 1L);
        assertThat(record.amount()).isEqualTo(huge);
    }

    @Test
    void decode_missingAmount_fails() {
        assertThatThrownBy(() -> decoder.decode(BridgeLogs.missingAmount(5, 0), SELECTOR, 1L))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("Missing amount");
    }

    @Test
    void decode_removedLog_fails() {
        RawLogEntry valid = BridgeLogs.transfer(5, 0, BigInteger.ONE, BigInteger.ONE);
        RawLogEntry removed = new RawLogEntry(valid.address(), valid.topics(), valid.data(), valid.transactionHash(),
                valid.blockNumber(), valid.logIndex(), true);

        assertThatThrownBy(() -> decoder.decode(removed, SELECTOR, 1L))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("reorganization");
    }

    @Test
    void decode_missingProvenance_fails() {
        RawLogEntry valid = BridgeLogs.transfer(5, 0, BigInteger.ONE, BigInteger.ONE);
        RawLogEntry noBlock = new RawLogEntry(valid.address(), valid.topics(), valid.data(), valid.transactionHash(),
                null, 0L, false);
        RawLogEntry noHash = new RawLogEntry(valid.address(), valid.topics(), valid.data(), null, 5L, 0L, false);

        assertThatThrownBy(() -> decoder.decode(noBlock, SELECTOR, 1L)).hasMessageContaining("blockNumber");
        assertThatThrownBy(() -> decoder.decode(noHash, SELECTOR, 1L)).hasMessageContaining("transactionHash");
    }

    @Test
    void decode_otherEventOrContract_fails() {
        RawLogEntry valid = BridgeLogs.transfer(5, 0, BigInteger.ONE, BigInteger.ONE);
        List<String> foreignTopics = List.of(EventSignature.topicOf("Transfer(address,address,uint256)"),
                valid.topics().get(1), valid.topics().get(2), valid.topics().get(3));
        RawLogEntry otherEvent = new RawLogEntry(valid.address(), foreignTopics, valid.data(),
                valid.transactionHash(), 5L, 0L, false);
        RawLogEntry otherContract = new RawLogEntry("0x9999999999999999999999999999999999999999", valid.topics(),
                valid.data(), valid.transactionHash(), 5L, 0L, false);

        assertThatThrownBy(() -> decoder.decode(otherEvent, SELECTOR, 1L)).hasMessageContaining("Selector mismatch");
        assertThatThrownBy(() -> decoder.decode(otherContract, SELECTOR, 1L)).hasMessageContaining("unexpected contract");
    }

    @Test
    void decode_missingIndexedTopic_fails() {
        RawLogEntry valid = BridgeLogs.transfer(5, 0, BigInteger.ONE, BigInteger.ONE);
        RawLogEntry threeTopics = new RawLogEntry(valid.address(), valid.topics().subList(0, 3), valid.data(),
                valid.transactionHash(), 5L, 0L, false);

        assertThatThrownBy(() -> decoder.decode(threeTopics, SELECTOR, 1L))
                .isInstanceOf(EventDecodingException.class)
                .hasMessageContaining("Expected 4 topics");
    }

    @Test
    void decode_addressTopicWithDirtyPadding_fails() {
        RawLogEntry valid = BridgeLogs.transfer(5, 0, BigInteger.ONE, BigInteger.ONE);
        String dirtySender = "0xff" + valid.topics().get(1).substring(4);
        RawLogEntry dirty = new RawLogEntry(valid.address(), List.of(valid.topics().get(0), dirtySender,
                valid.topics().get(2), valid.topics().get(3)), valid.data(), valid.transactionHash(), 5L, 0L, false);

        assertThatThrownBy(() -> decoder.decode(dirty, SELECTOR, 1L))
                .isInstanceOf(EventDecodingException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decode_destinationChainAboveLongRange_fails() {
        RawLogEntry valid = BridgeLogs.transfer(5, 0, BigInteger.ONE, BigInteger.ONE);
        String hugeChain = "0x" + BridgeLogs.word(BigInteger.TWO.pow(70));
        RawLogEntry log = new RawLogEntry(valid.address(), List.of(valid.topics().get(0), valid.topics().get(1),
                hugeChain, valid.topics().get(3)), valid.data(), valid.transactionHash(), 5L, 0L, false);

        assertThatThrownBy(() -> decoder.decode(log, SELECTOR, 1L)).hasMessageContaining("destinationChainId");
    }
}
