package lab.swapdesk.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.quote.MarketSnapshot;
import lab.swapdesk.quote.PriceMath;
import lab.swapdesk.quote.PriceProvider;
import lab.swapdesk.quote.Quote;
import lab.swapdesk.quote.QuoteRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Iterator;
import java.util.Optional;

/**
 * TonAPI market rates: jetton priced in TON and USD.
 */
@Slf4j
public class TonApiRatesPriceProvider implements PriceProvider {

    private final RestClient restClient;
    private final String baseUrl;
    private final Clock clock;

    public TonApiRatesPriceProvider(RestClient restClient, String baseUrl, String apiKey, Clock clock) {
        this.restClient = apiKey == null || apiKey.isBlank()
                ? restClient
                : restClient.mutate().defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey.trim()).build();
        this.baseUrl = baseUrl;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "tonapi-rates";
    }

    @Override
    public boolean supports(Chain chain) {
        return chain == Chain.TON;
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public Optional<Quote> tryQuote(QuoteRequest request) {
        try {
            JsonNode body = restClient.get()
                    .uri(baseUrl + "/v2/rates?tokens={token}&currencies=ton,usd", request.counterAsset())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
            JsonNode rates = body == null ? null : body.path("rates");
            if (rates == null || !rates.isObject() || rates.isEmpty()) {
                return Optional.empty();
            }
            JsonNode entry = rates.has(request.counterAsset()) ? rates.path(request.counterAsset()) : first(rates);
            BigDecimal priceTon = decimal(entry.path("prices").path("TON"));
            BigDecimal priceUsd = decimal(entry.path("prices").path("USD"));
            long output = PriceMath.outputFromNativePrice(request, priceTon);
            if (output <= 0) {
                return Optional.empty();
            }
            return Optional.of(new Quote(output, null, name(), clock.instant(),
                    new MarketSnapshot(priceUsd, null, null)));
        } catch (RestClientException e) {
            log.warn("event=tonapi.rates.failed asset={} error={}", request.counterAsset(), e.getMessage());
            return Optional.empty();
        }
    }

    private static JsonNode first(JsonNode object) {
        Iterator<JsonNode> values = object.elements();
        return values.hasNext() ? values.next() : object.path("");
    }

    private static BigDecimal decimal(JsonNode node) {
        return node.isNumber() ? node.decimalValue() : PriceMath.parse(node.asText(null));
    }
}
