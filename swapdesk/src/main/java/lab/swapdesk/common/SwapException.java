package lab.swapdesk.common;

public abstract class SwapException extends RuntimeException {

    private final SwapErrorKind kind;

    protected SwapException(SwapErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SwapException(SwapErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SwapErrorKind kind() {
        return kind;
    }
}
