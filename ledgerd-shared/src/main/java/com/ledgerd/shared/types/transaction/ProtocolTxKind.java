package com.ledgerd.shared.types.transaction;

/**
 * Kinds of transactions injected by validators.
 * The code is part of the header hash and must never change for an existing kind.
 */
public enum ProtocolTxKind {
    ETHEREUM_EVENTS(0),
    BRIDGE_POOL(1),
    VALIDATOR_SET_UPDATE(2),
    ETH_EVENTS_VEXT(3),
    BRIDGE_POOL_VEXT(4),
    VALSET_UPDATE_VEXT(5);

    private final int code;

    ProtocolTxKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
