package lab.swapdesk.quote;

import java.math.BigDecimal;

public record MarketSnapshot(BigDecimal priceUsd, BigDecimal liquidityUsd, BigDecimal marketCapUsd) {
}
