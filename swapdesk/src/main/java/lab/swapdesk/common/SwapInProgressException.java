package lab.swapdesk.common;

public class SwapInProgressException extends SwapException {

    public SwapInProgressException(String message) {
        super(SwapErrorKind.SWAP_IN_PROGRESS, message);
    }

    public SwapInProgressException(String message, Throwable cause) {
        super(SwapErrorKind.SWAP_IN_PROGRESS, message, cause);
    }
}
