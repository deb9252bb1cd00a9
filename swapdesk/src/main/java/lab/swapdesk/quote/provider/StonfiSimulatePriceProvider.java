package lab.swapdesk.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.ton.StonfiClient;
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
 * STON.fi swap simulation: exact pool output for the requested size.
 */
@Slf4j
public class StonfiSimulatePriceProvider implements PriceProvider {

    private static final int SIMULATION_SLIPPAGE_BPS = 100;

    private final StonfiClient stonfi;
    private final String ptonMaster;
    private final Clock clock;

    public StonfiSimulatePriceProvider(StonfiClient stonfi, String ptonMaster, Clock clock) {
        this.stonfi = stonfi;
        this.ptonMaster = ptonMaster;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "stonfi-simulate";
    }

    @Override
    public boolean supports(Chain chain) {
        return chain == Chain.TON;
    }

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public Optional<Quote> tryQuote(QuoteRequest request) {
        boolean buy = request.direction() == SwapDirection.NATIVE_TO_TOKEN;
        try {
            JsonNode sim = stonfi.simulate(
                    buy ? ptonMaster : request.counterAsset(),
                    buy ? request.counterAsset() : ptonMaster,
                    request.amountRaw(),
                    SIMULATION_SLIPPAGE_BPS);
            long output = Long.parseLong(sim.path("ask_units").asText("0"));
            if (output <= 0) {
                return Optional.empty();
            }
            return Optional.of(new Quote(output,
                    PriceImpactEstimator.fromFraction(PriceMath.parse(sim.path("price_impact").asText(null))),
                    name(), clock.instant(), null));
        } catch (SwapException | RestClientException | NumberFormatException e) {
            log.warn("event=stonfi.quote.failed asset={} error={}", request.counterAsset(), e.getMessage());
            return Optional.empty();
        }
    }
}
