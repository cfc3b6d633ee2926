package com.vrfradar.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vrfradar.domain.BlockRef;
import com.vrfradar.domain.EventKind;
import com.vrfradar.ingestion.adapter.LedgerUnavailableException;
import com.vrfradar.ingestion.adapter.RawLog;
import com.vrfradar.ingestion.adapter.RpcEndpointRotator;
import com.vrfradar.ingestion.decoder.CoordinatorEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmLedgerReaderTest {

    private static final String COORDINATOR = "0x5FbDB2315678afecb367f032d93F642f64180aa3";

    private MockEvmRpcClient mockRpc;
    private EvmLedgerReader reader;

    @BeforeEach
    void setUp() {
        mockRpc = new MockEvmRpcClient();
        reader = new EvmLedgerReader(mockRpc, new RpcEndpointRotator(List.of("https://a.rpc", "https://b.rpc")),
                new ObjectMapper(), COORDINATOR);
    }

    @Test
    void currentBlockHeight_parsesHexQuantity() {
        mockRpc.setResponse("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x3e8\"}");

        assertThat(reader.currentBlockHeight().block()).isEqualTo(1_000L);
        assertThat(mockRpc.calls.get(0).method()).isEqualTo("eth_blockNumber");
    }

    @Test
    @SuppressWarnings("unchecked")
    void getLogs_filtersByCoordinatorAndTopic_skipsRemovedLogs() {
        String topic0 = CoordinatorEvents.topic(EventKind.FULFILLED);
        mockRpc.setResponse("""
                {"jsonrpc":"2.0","id":1,"result":[
                  {"address":"0x5FBDB2315678AFECB367F032D93F642F64180AA3","topics":["%s","0x01"],"data":"0xAB",
                   "blockNumber":"0x64","transactionHash":"0xABC","logIndex":"0x2","blockTimestamp":"0x6553f100"},
                  {"address":"0x5fbdb2315678afecb367f032d93f642f64180aa3","topics":["%s","0x02"],"data":"0x",
                   "blockNumber":"0x65","transactionHash":"0xdef","logIndex":"0x0","removed":true}
                ]}
                """.formatted(topic0, topic0));

        List<RawLog> logs = reader.getLogs(EventKind.FULFILLED.signature(), 100, 200).block();

        assertThat(logs).hasSize(1);
        RawLog log = logs.get(0);
        assertThat(log.blockNumber()).isEqualTo(100);
        assertThat(log.logIndex()).isEqualTo(2);
        assertThat(log.blockTimestamp()).isEqualTo(0x6553f100L);
        assertThat(log.transactionHash()).isEqualTo("0xabc");
        assertThat(log.address()).isEqualTo(COORDINATOR.toLowerCase());

        MockEvmRpcClient.Call call = mockRpc.calls.get(0);
        assertThat(call.method()).isEqualTo("eth_getLogs");
        Map<String, Object> filter = (Map<String, Object>) ((List<Object>) call.params()).get(0);
        assertThat(filter).containsEntry("fromBlock", "0x64")
                .containsEntry("toBlock", "0xc8")
                .containsEntry("address", COORDINATOR.toLowerCase())
                .containsEntry("topics", List.of(topic0));
    }

    @Test
    void getLogs_malformedEntry_isSkippedWithoutFailingTheBatch() {
        String topic0 = CoordinatorEvents.topic(EventKind.REQUESTED);
        mockRpc.setResponse("""
                {"jsonrpc":"2.0","id":1,"result":[
                  {"address":"0x5fbdb2315678afecb367f032d93f642f64180aa3","topics":["%s"],"data":"0x",
                   "blockNumber":"0x64","transactionHash":"0xabc","logIndex":"0x1"},
                  {"address":"0x5fbdb2315678afecb367f032d93f642f64180aa3","topics":["%s"],"data":"0x",
                   "blockNumber":"0x65","transactionHash":"0xdef","logIndex":"zz"},
                  {"address":"0x5fbdb2315678afecb367f032d93f642f64180aa3","topics":["%s"],"data":"0x",
                   "blockNumber":"sixty","transactionHash":"0x123","logIndex":"0x0"}
                ]}
                """.formatted(topic0, topic0, topic0));

        List<RawLog> logs = reader.getLogs(EventKind.REQUESTED.signature(), 100, 200).block();

        assertThat(logs).extracting(RawLog::transactionHash).containsExactly("0xabc");
    }

    @Test
    void getLogs_emptyRange_doesNotCallRpc() {
        assertThat(reader.getLogs(EventKind.REQUESTED.signature(), 10, 9).block()).isEmpty();
        assertThat(mockRpc.calls).isEmpty();
    }

    @Test
    void rpcError_isLedgerUnavailable() {
        mockRpc.setResponse("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"limit exceeded\"}}");

        assertThatThrownBy(() -> reader.getLogs(EventKind.REQUESTED.signature(), 1, 2).block())
                .isInstanceOf(LedgerUnavailableException.class)
                .hasMessageContaining("limit exceeded");
    }

    @Test
    void getBlocks_batchesAndMapsResponsesById() {
        mockRpc.setBatchResponse("""
                [{"jsonrpc":"2.0","id":2,"result":{"number":"0x14","timestamp":"0x200"}},
                 {"jsonrpc":"2.0","id":1,"result":{"number":"0xa","timestamp":"0x100"}}]
                """);

        Map<Long, BlockRef> blocks = reader.getBlocks(List.of(20L, 10L, 20L)).block();

        assertThat(blocks).containsEntry(10L, new BlockRef(10, 0x100))
                .containsEntry(20L, new BlockRef(20, 0x200))
                .hasSize(2);
        assertThat(mockRpc.batches.get(0)).extracting(RpcRequest::method).containsOnly("eth_getBlockByNumber");
    }

    @Test
    void getBlock_missingResult_isLedgerUnavailable() {
        mockRpc.setResponse("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}");

        assertThatThrownBy(() -> reader.getBlock(5).block())
                .isInstanceOf(LedgerUnavailableException.class)
                .hasMessageContaining("block 5");
    }

    @Test
    void endpointsAreRotatedPerCall() {
        mockRpc.setResponse("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x1\"}");

        reader.currentBlockHeight().block();
        reader.currentBlockHeight().block();

        assertThat(mockRpc.calls).extracting(MockEvmRpcClient.Call::endpoint).containsExactly("https://a.rpc", "https://b.rpc");
    }

    static class MockEvmRpcClient implements EvmRpcClient {

        record Call(String endpoint, String method, Object params) {
        }

        final List<Call> calls = new ArrayList<>();
        final List<List<RpcRequest>> batches = new ArrayList<>();
        private String response = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}";
        private String batchResponse = "[]";

        void setResponse(String response) {
            this.response = response;
        }

        void setBatchResponse(String batchResponse) {
            this.batchResponse = batchResponse;
        }

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            calls.add(new Call(endpointUrl, method, params));
            return Mono.just(response);
        }

        @Override
        public Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests) {
            batches.add(requests);
            return Mono.just(batchResponse);
        }
    }
}
