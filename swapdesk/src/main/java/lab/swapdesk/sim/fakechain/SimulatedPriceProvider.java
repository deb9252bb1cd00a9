package lab.swapdesk.sim.fakechain;

import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.quote.PriceMath;
import lab.swapdesk.quote.PriceProvider;
import lab.swapdesk.quote.Quote;
import lab.swapdesk.quote.QuoteRequest;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.util.Optional;

/**
 * Quotes at the spot price registered on the {@link FakeChain}.
 */
@RequiredArgsConstructor
public class SimulatedPriceProvider implements PriceProvider {

    private final FakeChain fakeChain;
    private final Clock clock;

    @Override
    public String name() {
        return "simulated";
    }

    @Override
    public boolean supports(Chain chain) {
        return true;
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public Optional<Quote> tryQuote(QuoteRequest request) {
        return fakeChain.priceNative(request.chain(), request.counterAsset())
                .map(price -> new Quote(PriceMath.outputFromNativePrice(request, price), null, name(),
                        clock.instant(), null));
    }
}
