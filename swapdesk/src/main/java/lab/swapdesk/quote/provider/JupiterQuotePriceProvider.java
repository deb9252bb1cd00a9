package lab.swapdesk.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.solana.JupiterSwapClient;
import lab.swapdesk.adapter.solana.SolanaAdapter;
import lab.swapdesk.common.SwapException;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;
import lab.swapdesk.quote.PriceImpactEstimator;
import lab.swapdesk.quote.PriceMath;
import lab.swapdesk.quote.PriceProvider;
import lab.swapdesk.quote.Quote;
import lab.swapdesk.quote.QuoteRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.Optional;

/**
 * Authenticated Jupiter route quote: exact route output and impact. Registered only with an API key.
 */
@Slf4j
public class JupiterQuotePriceProvider implements PriceProvider {

    private static final int QUOTE_SLIPPAGE_BPS = 50;

    private final JupiterSwapClient jupiter;
    private final Clock clock;

    public JupiterQuotePriceProvider(JupiterSwapClient jupiter, Clock clock) {
        this.jupiter = jupiter;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "jupiter-quote";
    }

    @Override
    public boolean supports(Chain chain) {
        return chain == Chain.SOLANA;
    }

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public Optional<Quote> tryQuote(QuoteRequest request) {
        boolean buy = request.direction() == SwapDirection.NATIVE_TO_TOKEN;
        try {
            JsonNode route = jupiter.quote(
                    buy ? SolanaAdapter.WRAPPED_SOL_MINT : request.counterAsset(),
                    buy ? request.counterAsset() : SolanaAdapter.WRAPPED_SOL_MINT,
                    request.amountRaw(),
                    QUOTE_SLIPPAGE_BPS);
            long output = route.path("outAmount").asLong(0L);
            if (output <= 0) {
                return Optional.empty();
            }
            return Optional.of(new Quote(output,
                    PriceImpactEstimator.fromFraction(PriceMath.parse(route.path("priceImpactPct").asText(null))),
                    name(), clock.instant(), null));
        } catch (SwapException | RestClientException e) {
            log.warn("event=jupiter.quote.failed asset={} error={}", request.counterAsset(), e.getMessage());
            return Optional.empty();
        }
    }
}
