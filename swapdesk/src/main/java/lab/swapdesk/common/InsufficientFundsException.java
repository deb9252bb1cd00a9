package lab.swapdesk.common;

import lombok.Getter;

/**
 * Balance below what the operation needs. Amounts are in the smallest unit of {@code asset}.
 */
@Getter
public class InsufficientFundsException extends SwapException {

    private final String asset;
    private final long requiredRaw;
    private final long availableRaw;

    public InsufficientFundsException(String asset, long requiredRaw, long availableRaw) {
        super(SwapErrorKind.INSUFFICIENT_FUNDS,
                "insufficient %s balance: required=%d available=%d shortfall=%d"
                        .formatted(asset, requiredRaw, availableRaw, requiredRaw - availableRaw));
        this.asset = asset;
        this.requiredRaw = requiredRaw;
        this.availableRaw = availableRaw;
    }

    public long getShortfallRaw() {
        return Math.max(0L, requiredRaw - availableRaw);
    }
}
