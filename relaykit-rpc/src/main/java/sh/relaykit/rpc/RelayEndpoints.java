// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.rpc;

/**
 * Relay API paths and parameter names.
 */
public final class RelayEndpoints {

    public static final String RELAY_ADDRESS = "/relay-address";
    public static final String NONCE = "/nonce";
    public static final String SUBMIT = "/submit";
    public static final String TRANSACTION = "/transaction";
    public static final String TRANSACTIONS = "/transactions";

    public static final String PARAM_ADDRESS = "address";
    public static final String PARAM_TYPE = "type";
    public static final String PARAM_ID = "id";

    /** Submission type of a proxy-wallet batch. */
    public static final String TYPE_PROXY = "PROXY";
    /** Submission type of a Safe-wallet batch. */
    public static final String TYPE_SAFE = "SAFE";
    /** Submission type of a Safe-wallet deployment. */
    public static final String TYPE_SAFE_CREATE = "SAFE-CREATE";

    /** Nonce kind for externally-owned accounts and their proxies. */
    public static final String NONCE_EOA = "EOA";
    public static final String NONCE_SAFE = "SAFE";

    public static final String HEADER_API_KEY = "RELAYER_API_KEY";
    public static final String HEADER_SIGNATURE = "RELAYER_SIGNATURE";
    public static final String HEADER_TIMESTAMP = "RELAYER_TIMESTAMP";

    private RelayEndpoints() {
    }
}
