package lab.swapdesk.quote;

import lab.swapdesk.common.Amounts;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;

import java.math.BigDecimal;

/**
 * @param amountHuman   input amount in display units of the asset being spent
 * @param amountRaw     the same amount in its smallest unit
 * @param tokenDecimals decimals of the counter token
 */
public record QuoteRequest(
        Chain chain,
        SwapDirection direction,
        String counterAsset,
        BigDecimal amountHuman,
        long amountRaw,
        int tokenDecimals
) {

    public static QuoteRequest of(Chain chain, SwapDirection direction, String counterAsset, BigDecimal amountHuman,
                                  int tokenDecimals) {
        int inputDecimals = direction == SwapDirection.NATIVE_TO_TOKEN ? chain.getNativeDecimals() : tokenDecimals;
        return new QuoteRequest(chain, direction, counterAsset, amountHuman,
                Amounts.toSmallestUnit(amountHuman, inputDecimals), tokenDecimals);
    }

    public int outputDecimals() {
        return direction == SwapDirection.NATIVE_TO_TOKEN ? tokenDecimals : chain.getNativeDecimals();
    }
}
