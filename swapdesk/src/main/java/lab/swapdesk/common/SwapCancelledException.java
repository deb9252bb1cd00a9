package lab.swapdesk.common;

public class SwapCancelledException extends SwapException {

    public SwapCancelledException(String message) {
        super(SwapErrorKind.SWAP_CANCELLED, message);
    }

    public SwapCancelledException(String message, Throwable cause) {
        super(SwapErrorKind.SWAP_CANCELLED, message, cause);
    }
}
