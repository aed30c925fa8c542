// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Set;

import org.junit.jupiter.api.Test;

import sh.relaykit.core.types.Address;

class CallDescriptorTest {

    private static final Address CAFE = new Address("0x" + "0".repeat(36) + "cafe");

    @Test
    void proxyCallKeepsFieldsVerbatim() {
        ProxyCall call = new ProxyCall(CAFE, "1", "0xdead", "0");

        assertEquals(CAFE, call.to());
        assertEquals("1", call.typeCode());
        assertEquals("0xdead", call.data());
        assertEquals("0", call.value());
    }

    @Test
    void largeValuesStayExact() {
        String wei = "123456789012345678901234567890";
        assertEquals(wei, new ProxyCall(CAFE, "1", "0x", wei).value());
    }

    @Test
    void proxyCallRejectsBadFields() {
        assertThrows(NullPointerException.class, () -> new ProxyCall(null, "1", "0x", "0"));
        assertThrows(IllegalArgumentException.class, () -> new ProxyCall(CAFE, " ", "0x", "0"));
        assertThrows(IllegalArgumentException.class, () -> new ProxyCall(CAFE, "1", "dead", "0"));
        assertThrows(IllegalArgumentException.class, () -> new ProxyCall(CAFE, "1", "0x", "-1"));
        assertThrows(IllegalArgumentException.class, () -> new ProxyCall(CAFE, "1", "0x", "1.5"));
    }

    @Test
    void safeCallPassesOperationThrough() {
        assertEquals(7, new SafeCall(CAFE, 7, "0x", "0").operation());
        assertEquals(SafeCall.DELEGATE_CALL, new SafeCall(CAFE, SafeCall.DELEGATE_CALL, "0x", "0").operation());
        assertThrows(NullPointerException.class, () -> new SafeCall(CAFE, null, "0x", "0"));
    }

    @Test
    void recordDefaultsMissingState() {
        TransactionRecord record = new TransactionRecord("tx-1", null, null, null);

        assertEquals("", record.state());
        assertEquals(false, record.isBroadcast());
        assertEquals(false, record.inState(Set.of(TransactionStates.CONFIRMED)));
        assertEquals(true, new TransactionRecord("tx-1", TransactionStates.MINED, null, "0xabc")
                .inState(Set.of(TransactionStates.MINED, TransactionStates.CONFIRMED)));
        assertThrows(IllegalArgumentException.class, () -> new TransactionRecord(" ", "STATE_NEW", null, null));
    }

    @Test
    void stateVocabulary() {
        assertEquals(true, TransactionStates.isKnown("STATE_MINED"));
        assertEquals(false, TransactionStates.isKnown("MINED"));
        assertEquals(true, TransactionStates.isTerminal(TransactionStates.CONFIRMED));
        assertEquals(false, TransactionStates.isTerminal(TransactionStates.EXECUTED));
    }
}
