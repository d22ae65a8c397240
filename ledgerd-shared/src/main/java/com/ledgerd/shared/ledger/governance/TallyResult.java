package com.ledgerd.shared.ledger.governance;

/**
 * Outcome of tallying the votes on a proposal.
 */
public enum TallyResult {
    PASSED("passed"),
    REJECTED("rejected");

    private final String label;

    TallyResult(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
