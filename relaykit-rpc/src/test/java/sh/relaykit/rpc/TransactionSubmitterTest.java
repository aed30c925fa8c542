// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.relaykit.core.error.MalformedRelayResponseException;
import sh.relaykit.core.error.NoAddressAvailableException;
import sh.relaykit.core.error.RelayRejectedException;
import sh.relaykit.core.error.RelayTransportException;
import sh.relaykit.core.model.ProxyCall;
import sh.relaykit.core.model.SafeCall;
import sh.relaykit.core.model.TransactionRecord;
import sh.relaykit.core.types.Address;
import sh.relaykit.rpc.internal.RelayJson;

@ExtendWith(MockitoExtension.class)
class TransactionSubmitterTest {

    private static final Address CAFE = new Address("0x000000000000000000000000000000000000cafe");

    @Mock
    private RelayApi api;

    private TransactionSubmitter submitter;

    @BeforeEach
    void setUp() {
        submitter = new TransactionSubmitter(api);
    }

    private static CompletableFuture<JsonNode> reply(final String json) throws Exception {
        return CompletableFuture.completedFuture(RelayJson.MAPPER.readTree(json));
    }

    @Test
    void proxyBatchYieldsRecord() throws Exception {
        List<ProxyCall> calls = List.of(new ProxyCall(CAFE, "1", "0xdead", "0"));
        when(api.executeProxyTransactions(calls, null))
                .thenReturn(reply("{\"transactionID\":\"tx-1\",\"state\":\"STATE_NEW\"}"));

        TransactionRecord record = submitter.submitProxyBatch(calls, null).join();

        assertEquals("tx-1", record.id());
        assertEquals("STATE_NEW", record.state());
    }

    @Test
    void safeBatchAndDeployYieldRecords() throws Exception {
        List<SafeCall> calls = List.of(new SafeCall(CAFE, 0, "0x", "0"));
        when(api.executeSafeTransactions(calls, "m")).thenReturn(reply("{\"transactionId\":\"tx-2\"}"));
        when(api.deploySafe()).thenReturn(reply("{\"id\":\"tx-3\",\"state\":\"STATE_NEW\"}"));

        assertEquals("tx-2", submitter.submitSafeBatch(calls, "m").join().id());
        assertEquals("tx-3", submitter.deploySafeWallet().join().id());
    }

    @Test
    void emptyBatchIsRejectedBeforeTransport() {
        assertThrows(IllegalArgumentException.class, () -> submitter.submitProxyBatch(List.of(), null));
        assertThrows(IllegalArgumentException.class, () -> submitter.submitSafeBatch(List.of(), null));
        verifyNoInteractions(api);
    }

    @Test
    void relayErrorBecomesRejection() {
        RelayTransportException transport =
                new RelayTransportException(400, "invalid signature", "/submit", "{\"error\":\"invalid signature\"}", null);
        when(api.executeProxyTransactions(anyList(), any())).thenReturn(CompletableFuture.failedFuture(transport));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> submitter.submitProxyBatch(List.of(ProxyCall.call(CAFE, "0x")), null).join());

        RelayRejectedException rejected = assertInstanceOf(RelayRejectedException.class, ex.getCause());
        assertEquals("execute proxy transactions", rejected.operation());
        assertEquals("invalid signature", rejected.relayMessage());
        assertEquals("Failed to execute proxy transactions: invalid signature", rejected.getMessage());
        assertSame(transport, rejected.getCause());
    }

    @Test
    void deployFailureNamesOperation() {
        when(api.deploySafe()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        CompletionException ex = assertThrows(CompletionException.class, () -> submitter.deploySafeWallet().join());

        RelayRejectedException rejected = assertInstanceOf(RelayRejectedException.class, ex.getCause());
        assertEquals("Failed to deploy safe: boom", rejected.getMessage());
    }

    @Test
    void missingIdIsMalformedNotRejected() throws Exception {
        when(api.deploySafe()).thenReturn(reply("{\"state\":\"STATE_NEW\"}"));

        CompletionException ex = assertThrows(CompletionException.class, () -> submitter.deploySafeWallet().join());

        assertInstanceOf(MalformedRelayResponseException.class, ex.getCause());
    }

    @Test
    void missingAddressPropagatesUnchanged() {
        NoAddressAvailableException missing = new NoAddressAvailableException("no address");
        when(api.executeSafeTransactions(anyList(), any())).thenReturn(CompletableFuture.failedFuture(missing));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> submitter.submitSafeBatch(List.of(SafeCall.call(CAFE, "0x")), null).join());

        assertSame(missing, ex.getCause());
    }
}
