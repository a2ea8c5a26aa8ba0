package com.bridgewatcher.ingestion.adapter.evm;

import com.bridgewatcher.ingestion.adapter.LedgerFatalException;
import com.bridgewatcher.ingestion.adapter.LedgerUnavailableException;
import com.bridgewatcher.ingestion.adapter.RawLogEntry;
import com.bridgewatcher.ingestion.adapter.RpcEndpointRotator;
import com.bridgewatcher.support.BridgeLogs;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmLedgerClientTest {

    private static final String EMPTY_LOGS = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[]}";

    @Test
    void getLatestHeight_parsesHexQuantity() {
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) ->
                Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x70\"}"));

        assertThat(client(rpc, "https://a.rpc").getLatestHeight()).isEqualTo(112L);
        assertThat(rpc.calls).containsExactly("https://a.rpc eth_blockNumber");
    }

    @Test
    void getChainId_parsesHexQuantity() {
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) ->
                Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0xaa36a7\"}"));

        assertThat(client(rpc, "https://a.rpc").getChainId()).isEqualTo(11155111L);
    }

    @Test
    void getEvents_mapsLogFields() {
        String topics = String.join("\",\"", BridgeLogs.topics(137));
        String json = """
                {"jsonrpc":"2.0","id":1,"result":[
                  {"address":"%s","topics":["%s"],"data":"0x01","transactionHash":"0xabc",
                   "blockNumber":"0x69","logIndex":"0x3","removed":false}
                ]}
                """.formatted(BridgeLogs.CONTRACT, topics);
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) -> Mono.just(json));

        List<RawLogEntry> logs = client(rpc, "https://a.rpc").getEvents(101, 106, BridgeLogs.SELECTOR);

        assertThat(logs).hasSize(1);
        RawLogEntry log = logs.get(0);
        assertThat(log.address()).isEqualTo(BridgeLogs.CONTRACT);
        assertThat(log.topics()).containsExactlyElementsOf(BridgeLogs.topics(137));
        assertThat(log.transactionHash()).isEqualTo("0xabc");
        assertThat(log.blockNumber()).isEqualTo(105L);
        assertThat(log.logIndex()).isEqualTo(3L);
        assertThat(log.removed()).isFalse();
    }

    @Test
    void getEvents_sendsAddressAndTopicFilter() {
        List<Object> seenParams = new ArrayList<>();
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) -> {
            seenParams.add(params);
            return Mono.just(EMPTY_LOGS);
        });

        client(rpc, "https://a.rpc").getEvents(101, 106, BridgeLogs.SELECTOR);

        assertThat(seenParams).hasSize(1);
        Map<?, ?> filter = (Map<?, ?>) ((List<?>) seenParams.get(0)).get(0);
        assertThat(filter.get("fromBlock")).isEqualTo("0x65");
        assertThat(filter.get("toBlock")).isEqualTo("0x6a");
        assertThat(filter.get("address")).isEqualTo(BridgeLogs.CONTRACT);
        assertThat(filter.get("topics")).isEqualTo(List.of(BridgeLogs.SELECTOR.topic()));
    }

    @Test
    void getEvents_emptyRange_doesNotCallNode() {
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) -> Mono.just(EMPTY_LOGS));

        assertThat(client(rpc, "https://a.rpc").getEvents(10, 9, BridgeLogs.SELECTOR)).isEmpty();
        assertThat(rpc.calls).isEmpty();
    }

    @Test
    void getEvents_rangeTooWide_splitsInHalves() {
        List<String> ranges = new ArrayList<>();
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) -> {
            Map<?, ?> filter = (Map<?, ?>) ((List<?>) params).get(0);
            String from = (String) filter.get("fromBlock");
            String to = (String) filter.get("toBlock");
            ranges.add(from + "-" + to);
            if (from.equals("0x0") && to.equals("0x3")) {
                return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,"
                        + "\"message\":\"query returned more than 10000 results\"}}");
            }
            return Mono.just(EMPTY_LOGS);
        });

        assertThat(client(rpc, "https://a.rpc").getEvents(0, 3, BridgeLogs.SELECTOR)).isEmpty();
        assertThat(ranges).containsExactly("0x0-0x3", "0x0-0x1", "0x2-0x3");
    }

    @Test
    void unavailableEndpoint_failsOverToNext() {
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) -> endpoint.contains("down")
                ? Mono.error(new LedgerUnavailableException("HTTP 503"))
                : Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10\"}"));

        long height = client(rpc, "https://down.rpc", "https://up.rpc").getLatestHeight();

        assertThat(height).isEqualTo(16L);
        assertThat(rpc.calls).containsExactly("https://down.rpc eth_blockNumber", "https://up.rpc eth_blockNumber");
    }

    @Test
    void allEndpointsUnavailable_throwsUnavailable() {
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) ->
                Mono.error(new LedgerUnavailableException("connection refused")));

        assertThatThrownBy(() -> client(rpc, "https://a.rpc", "https://b.rpc").getLatestHeight())
                .isInstanceOf(LedgerUnavailableException.class)
                .hasMessageContaining("2 endpoint(s)")
                .hasMessageContaining("connection refused");
    }

    @Test
    void fatalError_isNotFailedOver() {
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) ->
                Mono.error(new LedgerFatalException("HTTP 401")));

        assertThatThrownBy(() -> client(rpc, "https://a.rpc", "https://b.rpc").getLatestHeight())
                .isInstanceOf(LedgerFatalException.class);
        assertThat(rpc.calls).hasSize(1);
    }

    @Test
    void invalidParamsError_isFatal() {
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) -> Mono.just(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,\"message\":\"invalid argument 0\"}}"));

        assertThatThrownBy(() -> client(rpc, "https://a.rpc").getEvents(1, 2, BridgeLogs.SELECTOR))
                .isInstanceOf(LedgerFatalException.class)
                .hasMessageContaining("-32602");
    }

    @Test
    void malformedJson_isUnavailable() {
        ScriptedRpcClient rpc = new ScriptedRpcClient((endpoint, method, params) -> Mono.just("<html>bad gateway"));

        assertThatThrownBy(() -> client(rpc, "https://a.rpc").getLatestHeight())
                .isInstanceOf(LedgerUnavailableException.class);
    }

    @Test
    void parseQuantityOrNull_rejectsNonHex() {
        assertThat(EvmLedgerClient.parseQuantityOrNull("0x1f")).isEqualTo(31L);
        assertThat(EvmLedgerClient.parseQuantityOrNull("31")).isNull();
        assertThat(EvmLedgerClient.parseQuantityOrNull("0x")).isNull();
        assertThat(EvmLedgerClient.parseQuantityOrNull("0xzz")).isNull();
        assertThat(EvmLedgerClient.toQuantity(255)).isEqualTo("0xff");
    }

    private static EvmLedgerClient client(EvmRpcClient rpc, String... endpoints) {
        return new EvmLedgerClient(rpc, new RpcEndpointRotator(List.of(endpoints)), fastLimiter(), new ObjectMapper());
    }

    private static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-ledger-fast-limiter", config);
    }

    @FunctionalInterface
    private interface Script {
        Mono<String> respond(String endpoint, String method, Object params);
    }

    private static class ScriptedRpcClient implements EvmRpcClient {
        private final Script script;
        private final List<String> calls = new ArrayList<>();

        ScriptedRpcClient(Script script) {
            this.script = script;
        }

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            calls.add(endpointUrl + " " + method);
            return script.respond(endpointUrl, method, params);
        }
    }
}
