package lab.swapdesk.quote;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Constant-product style impact heuristic for display: {@code trade / (liquidity + trade) * 100}, capped at 100.
 * Not used for slippage enforcement.
 */
public final class PriceImpactEstimator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PriceImpactEstimator() {
    }

    public static BigDecimal estimate(BigDecimal tradeAmountUsd, BigDecimal liquidityUsd) {
        if (tradeAmountUsd == null || liquidityUsd == null || tradeAmountUsd.signum() < 0 || liquidityUsd.signum() < 0) {
            return null;
        }
        BigDecimal denominator = liquidityUsd.add(tradeAmountUsd);
        if (denominator.signum() == 0) {
            return null;
        }
        BigDecimal impact = tradeAmountUsd.multiply(HUNDRED).divide(denominator, MathContext.DECIMAL64);
        return impact.min(HUNDRED).setScale(4, RoundingMode.HALF_UP);
    }

    /** Converts a provider's fractional impact (0.0123 = 1.23%) to percent, capped at 100. */
    public static BigDecimal fromFraction(BigDecimal fraction) {
        if (fraction == null) {
            return null;
        }
        return fraction.abs().multiply(HUNDRED).min(HUNDRED).setScale(4, RoundingMode.HALF_UP);
    }
}
