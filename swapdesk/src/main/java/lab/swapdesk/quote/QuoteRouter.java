package lab.swapdesk.quote;

import lab.swapdesk.common.NoLiquidityDataException;
import lab.swapdesk.config.AsyncConfig;
import lab.swapdesk.config.SwapDeskProperties;
import lab.swapdesk.domain.swap.Chain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tries the providers of a chain in fixed priority order, each bounded by the provider timeout.
 * The first well-formed non-zero quote wins; the rest are not called.
 */
@Component
@Slf4j
public class QuoteRouter {

    private final Map<Chain, List<PriceProvider>> providersByChain;
    private final Executor executor;
    private final Duration timeout;

    @Autowired
    public QuoteRouter(
            List<PriceProvider> providers,
            @Qualifier(AsyncConfig.QUOTE_EXECUTOR) Executor executor,
            SwapDeskProperties properties
    ) {
        this(providers, executor, properties.getQuote().getProviderTimeout());
    }

    public QuoteRouter(List<PriceProvider> providers, Executor executor, Duration timeout) {
        Map<Chain, List<PriceProvider>> byChain = new EnumMap<>(Chain.class);
        for (Chain chain : Chain.values()) {
            byChain.put(chain, providers.stream()
                    .filter(p -> p.supports(chain))
                    .sorted(Comparator.comparingInt(PriceProvider::priority))
                    .toList());
        }
        this.providersByChain = Map.copyOf(byChain);
        this.executor = executor;
        this.timeout = timeout;
        byChain.forEach((chain, list) -> log.info("event=quote.router.providers chain={} order={}",
                chain, list.stream().map(PriceProvider::name).toList()));
    }

    public Quote quote(QuoteRequest request) {
        List<PriceProvider> providers = providersByChain.getOrDefault(request.chain(), List.of());
        for (PriceProvider provider : providers) {
            Optional<Quote> quote = ask(provider, request);
            if (quote.isPresent() && quote.get().isUsable()) {
                log.info("event=quote.router.selected chain={} asset={} direction={} source={} outputRaw={} impactPct={}",
                        request.chain(), request.counterAsset(), request.direction(), quote.get().source(),
                        quote.get().outputAmountRaw(), quote.get().priceImpactPct());
                return quote.get();
            }
            log.info("event=quote.router.fallthrough chain={} asset={} provider={}",
                    request.chain(), request.counterAsset(), provider.name());
        }
        throw new NoLiquidityDataException("no price provider returned a usable quote for %s on %s"
                .formatted(request.counterAsset(), request.chain()));
    }

    public List<String> providerNames(Chain chain) {
        return providersByChain.getOrDefault(chain, List.of()).stream().map(PriceProvider::name).toList();
    }

    private Optional<Quote> ask(PriceProvider provider, QuoteRequest request) {
        CompletableFuture<Optional<Quote>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> provider.tryQuote(request), executor);
        } catch (RejectedExecutionException e) {
            log.warn("event=quote.provider.rejected provider={} chain={} error={}",
                    provider.name(), request.chain(), e.getMessage());
            return Optional.empty();
        }
        try {
            Optional<Quote> quote = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return quote == null ? Optional.empty() : quote;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("event=quote.provider.timeout provider={} chain={} timeoutMs={}",
                    provider.name(), request.chain(), timeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("event=quote.provider.error provider={} chain={} error={}",
                    provider.name(), request.chain(), e.getCause() == null ? e.getMessage() : e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NoLiquidityDataException("interrupted while quoting " + request.counterAsset(), e);
        }
        return Optional.empty();
    }
}
