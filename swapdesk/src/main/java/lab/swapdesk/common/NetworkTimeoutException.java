package lab.swapdesk.common;

/**
 * An RPC call did not answer in time.
 * When {@code possiblyDelivered} is true the request body was already written, so a broadcast may have
 * reached the network and must be resolved by a status query instead of a resend.
 */
public class NetworkTimeoutException extends SwapException {

    private final boolean possiblyDelivered;

    public NetworkTimeoutException(String message, boolean possiblyDelivered, Throwable cause) {
        super(SwapErrorKind.NETWORK_TIMEOUT, message, cause);
        this.possiblyDelivered = possiblyDelivered;
    }

    public boolean isPossiblyDelivered() {
        return possiblyDelivered;
    }
}
