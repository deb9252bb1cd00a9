package lab.swapdesk.quote;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A provider's output estimate for one request. Used once and never cached.
 *
 * @param outputAmountRaw output in the smallest unit of the asset being bought
 * @param priceImpactPct  0..100, {@code null} when neither supplied nor derivable
 * @param market          optional market metadata of the counter token
 */
public record Quote(
        long outputAmountRaw,
        BigDecimal priceImpactPct,
        String source,
        Instant fetchedAt,
        MarketSnapshot market
) {

    public boolean isUsable() {
        return outputAmountRaw > 0;
    }
}
