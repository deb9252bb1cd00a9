package lab.swapdesk.domain.txattempt;

public enum TxAttemptStatus {
    INTENT_RECORDED,     // signed, txId known, not yet handed to the network
    BROADCASTED,
    REJECTED,            // explicit rejection or provably never delivered
    OUTCOME_UNKNOWN,     // broadcast timed out after the request may have left
    CONFIRMED,
    FAILED_ON_CHAIN,
    CANCELLED;

    public boolean isTerminal() {
        return this == REJECTED || this == CONFIRMED || this == FAILED_ON_CHAIN || this == CANCELLED;
    }

    /** The transaction may exist on chain and its fate is still open. */
    public boolean awaitsChain() {
        return this == BROADCASTED || this == OUTCOME_UNKNOWN;
    }
}
