package lab.swapdesk.common;

public class InvalidInputException extends SwapException {

    public InvalidInputException(String message) {
        super(SwapErrorKind.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(SwapErrorKind.INVALID_INPUT, message, cause);
    }
}
