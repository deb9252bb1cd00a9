package lab.swapdesk.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.solana.SolanaAdapter;
import lab.swapdesk.adapter.ton.TonAddress;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.quote.MarketSnapshot;
import lab.swapdesk.quote.PriceImpactEstimator;
import lab.swapdesk.quote.PriceMath;
import lab.swapdesk.quote.PriceProvider;
import lab.swapdesk.quote.Quote;
import lab.swapdesk.quote.QuoteRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Dexscreener pairs endpoint. Picks the deepest pool that prices the token against the native asset and
 * derives output, impact and market data from it.
 */
@Slf4j
public class DexscreenerPriceProvider implements PriceProvider {

    private final RestClient restClient;
    private final String baseUrl;
    private final NativeUsdPriceResolver nativeUsd;
    private final Clock clock;

    public DexscreenerPriceProvider(RestClient restClient, String baseUrl, NativeUsdPriceResolver nativeUsd, Clock clock) {
        this.restClient = restClient;
        this.baseUrl = baseUrl;
        this.nativeUsd = nativeUsd;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "dexscreener";
    }

    @Override
    public boolean supports(Chain chain) {
        return true;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public Optional<Quote> tryQuote(QuoteRequest request) {
        JsonNode body;
        try {
            body = restClient.get()
                    .uri(baseUrl + "/latest/dex/tokens/{address}", request.counterAsset())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.warn("event=dexscreener.quote.failed asset={} error={}", request.counterAsset(), e.getMessage());
            return Optional.empty();
        }
        if (body == null || !body.path("pairs").isArray()) {
            return Optional.empty();
        }

        Optional<JsonNode> pair = StreamSupport.stream(body.path("pairs").spliterator(), false)
                .filter(p -> chainId(request.chain()).equals(p.path("chainId").asText()))
                .filter(p -> sameAsset(request.chain(), request.counterAsset(), p.path("baseToken").path("address").asText()))
                .filter(p -> isNativeQuote(request.chain(), p.path("quoteToken")))
                .max(Comparator.comparing(p -> liquidityOf(p).orElse(BigDecimal.ZERO)));
        if (pair.isEmpty()) {
            log.info("event=dexscreener.quote.no_pair asset={} chain={}", request.counterAsset(), request.chain());
            return Optional.empty();
        }

        JsonNode p = pair.get();
        BigDecimal priceNative = PriceMath.parse(p.path("priceNative").asText(null));
        long output = PriceMath.outputFromNativePrice(request, priceNative);
        if (output <= 0) {
            return Optional.empty();
        }
        BigDecimal priceUsd = PriceMath.parse(p.path("priceUsd").asText(null));
        BigDecimal liquidityUsd = liquidityOf(p).orElse(null);
        BigDecimal marketCap = p.has("marketCap") ? p.path("marketCap").decimalValue() : PriceMath.parse(p.path("fdv").asText(null));

        BigDecimal nativeUsdPrice = priceUsd != null
                ? priceUsd.divide(priceNative, MathContext.DECIMAL64)
                : (liquidityUsd != null ? nativeUsd.resolve(request.chain()).orElse(null) : null);
        BigDecimal impact = null;
        if (nativeUsdPrice != null && liquidityUsd != null) {
            BigDecimal tradeUsd = PriceMath.tradeInNative(request, priceNative).multiply(nativeUsdPrice, MathContext.DECIMAL64);
            impact = PriceImpactEstimator.estimate(tradeUsd, liquidityUsd);
        }
        return Optional.of(new Quote(output, impact, name(), clock.instant(),
                new MarketSnapshot(priceUsd, liquidityUsd, marketCap)));
    }

    private static Optional<BigDecimal> liquidityOf(JsonNode pair) {
        JsonNode usd = pair.path("liquidity").path("usd");
        return usd.isNumber() ? Optional.of(usd.decimalValue()) : Optional.empty();
    }

    private static String chainId(Chain chain) {
        return chain == Chain.SOLANA ? "solana" : "ton";
    }

    private static boolean isNativeQuote(Chain chain, JsonNode quoteToken) {
        if (chain == Chain.SOLANA && SolanaAdapter.WRAPPED_SOL_MINT.equals(quoteToken.path("address").asText())) {
            return true;
        }
        return chain.getNativeSymbol().equalsIgnoreCase(quoteToken.path("symbol").asText());
    }

    // TON addresses come back in whichever form the indexer stores; compare account ids.
    static boolean sameAsset(Chain chain, String requested, String reported) {
        if (chain == Chain.SOLANA || requested.equals(reported)) {
            return requested.equals(reported);
        }
        return TonAddress.isValid(requested) && TonAddress.isValid(reported)
                && TonAddress.parse(requested).equals(TonAddress.parse(reported));
    }
}
