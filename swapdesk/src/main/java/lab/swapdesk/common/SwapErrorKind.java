package lab.swapdesk.common;

/**
 * Kinds of failure a swap or withdrawal can end with.
 * The retryable flag tells the caller whether trying again without user action can succeed.
 */
public enum SwapErrorKind {
    INVALID_INPUT(false),
    NO_LIQUIDITY_DATA(true),
    INSUFFICIENT_FUNDS(false),
    KEY_DECRYPTION_FAILED(false),
    RPC_UNAVAILABLE(true),
    NETWORK_TIMEOUT(true),
    SUBMISSION_FAILED(true),
    SWAP_CANCELLED(false),
    SWAP_IN_PROGRESS(true);

    private final boolean retryable;

    SwapErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
