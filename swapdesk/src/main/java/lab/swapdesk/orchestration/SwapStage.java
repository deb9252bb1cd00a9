package lab.swapdesk.orchestration;

public enum SwapStage {
    QUEUED,
    VALIDATED,
    QUOTED,
    BALANCE_CHECKED,
    TX_BUILT,
    SIGNED,
    SUBMITTED,
    RECONCILED,
    FAILED,
    CANCELLED;

    public boolean isFinal() {
        return this == RECONCILED || this == FAILED || this == CANCELLED;
    }
}
