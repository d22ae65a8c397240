package com.ledgerd.shared.ledger.governance;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Effect of executing a governance proposal at the end of its voting period.
 */
public record ProposalEvent(String eventType, Map<String, String> attributes) {

    public static final String EVENT_TYPE = "proposal";

    public ProposalEvent {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    /**
     * Builds the effect for an executed proposal.
     *
     * @param tally                  tally outcome
     * @param proposalId             id of the proposal
     * @param hasProposalCode        whether the proposal carried code to run
     * @param proposalCodeExitStatus whether that code ran successfully
     */
    public static ProposalEvent of(TallyResult tally, long proposalId,
                                   boolean hasProposalCode, boolean proposalCodeExitStatus) {
        Objects.requireNonNull(tally, "Tally result cannot be null");
        Map<String, String> attributes = new HashMap<>();
        attributes.put("tally_result", tally.toString());
        attributes.put("proposal_id", Long.toUnsignedString(proposalId));
        attributes.put("has_proposal_code", flag(hasProposalCode));
        attributes.put("proposal_code_exit_status", flag(proposalCodeExitStatus));
        return new ProposalEvent(EVENT_TYPE, attributes);
    }

    private static String flag(boolean value) {
        return value ? "1" : "0";
    }
}
