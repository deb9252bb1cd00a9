package lab.swapdesk.quote;

import lab.swapdesk.domain.swap.Chain;

import java.util.Optional;

/**
 * One external price or quote source. Implementations never throw for provider-side failures
 * (non-200, malformed body, zero price); they log and return empty so the next provider is tried.
 */
public interface PriceProvider {

    String name();

    boolean supports(Chain chain);

    /** Lower runs first. */
    int priority();

    Optional<Quote> tryQuote(QuoteRequest request);
}
