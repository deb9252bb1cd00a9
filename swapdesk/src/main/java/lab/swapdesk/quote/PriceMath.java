package lab.swapdesk.quote;

import lab.swapdesk.domain.swap.SwapDirection;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Output estimates from a spot price expressed in native units per token.
 */
public final class PriceMath {

    private static final MathContext PRECISION = MathContext.DECIMAL128;

    private PriceMath() {
    }

    /** Smallest-unit output for the request at {@code priceNative}; 0 when the price is unusable. */
    public static long outputFromNativePrice(QuoteRequest request, BigDecimal priceNative) {
        if (priceNative == null || priceNative.signum() <= 0) {
            return 0L;
        }
        BigDecimal outputHuman = request.direction() == SwapDirection.NATIVE_TO_TOKEN
                ? request.amountHuman().divide(priceNative, PRECISION)
                : request.amountHuman().multiply(priceNative, PRECISION);
        BigDecimal raw = outputHuman.movePointRight(request.outputDecimals()).setScale(0, RoundingMode.DOWN);
        if (raw.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
            return 0L;
        }
        return raw.longValue();
    }

    /** Trade size in native display units. */
    public static BigDecimal tradeInNative(QuoteRequest request, BigDecimal priceNative) {
        return request.direction() == SwapDirection.NATIVE_TO_TOKEN
                ? request.amountHuman()
                : request.amountHuman().multiply(priceNative, PRECISION);
    }

    public static BigDecimal parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
