package lab.swapdesk.orchestration;

/**
 * How a broadcast transaction ended, as far as this service could observe it.
 */
public enum SwapOutcome {
    CONFIRMED(true),
    /** Broadcast acknowledged or seen on chain, but not final within the confirmation window. */
    SUBMITTED_UNCONFIRMED(true),
    /** Broadcast timed out and the transaction was never observed; query the status later. */
    UNKNOWN_OUTCOME(false),
    FAILED_ON_CHAIN(false);

    private final boolean success;

    SwapOutcome(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }
}
