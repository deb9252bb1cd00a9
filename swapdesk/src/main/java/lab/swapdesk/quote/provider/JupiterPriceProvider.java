package lab.swapdesk.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.solana.SolanaAdapter;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.quote.PriceMath;
import lab.swapdesk.quote.PriceProvider;
import lab.swapdesk.quote.Quote;
import lab.swapdesk.quote.QuoteRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Jupiter free price API, token priced in SOL. No liquidity data, so no impact estimate.
 */
@Slf4j
public class JupiterPriceProvider implements PriceProvider {

    private final RestClient restClient;
    private final String baseUrl;
    private final Clock clock;

    public JupiterPriceProvider(RestClient restClient, String baseUrl, Clock clock) {
        this.restClient = restClient;
        this.baseUrl = baseUrl;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "jupiter-price";
    }

    @Override
    public boolean supports(Chain chain) {
        return chain == Chain.SOLANA;
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public Optional<Quote> tryQuote(QuoteRequest request) {
        try {
            JsonNode body = restClient.get()
                    .uri(baseUrl + "/price/v2?ids={mint}&vsToken={sol}", request.counterAsset(), SolanaAdapter.WRAPPED_SOL_MINT)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
            JsonNode entry = body == null ? null : body.path("data").path(request.counterAsset());
            if (entry == null || entry.isMissingNode() || entry.isNull()) {
                return Optional.empty();
            }
            BigDecimal priceInSol = PriceMath.parse(entry.path("price").asText(null));
            long output = PriceMath.outputFromNativePrice(request, priceInSol);
            return output > 0
                    ? Optional.of(new Quote(output, null, name(), clock.instant(), null))
                    : Optional.empty();
        } catch (RestClientException e) {
            log.warn("event=jupiter.price.failed asset={} error={}", request.counterAsset(), e.getMessage());
            return Optional.empty();
        }
    }
}
