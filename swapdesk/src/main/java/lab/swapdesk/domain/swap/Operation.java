package lab.swapdesk.domain.swap;

public enum Operation {
    SWAP_BUY,
    SWAP_SELL,
    WITHDRAWAL;

    public static Operation of(SwapDirection direction) {
        return direction == SwapDirection.NATIVE_TO_TOKEN ? SWAP_BUY : SWAP_SELL;
    }
}
