package lab.swapdesk.common;

public class NoLiquidityDataException extends SwapException {

    public NoLiquidityDataException(String message) {
        super(SwapErrorKind.NO_LIQUIDITY_DATA, message);
    }

    public NoLiquidityDataException(String message, Throwable cause) {
        super(SwapErrorKind.NO_LIQUIDITY_DATA, message, cause);
    }
}
