package lab.swapdesk.quote.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.domain.swap.Chain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Spot USD price of a chain's native asset via CoinGecko /simple/price. Not cached.
 */
@Slf4j
public class NativeUsdPriceResolver {

    private final RestClient restClient;
    private final String baseUrl;

    public NativeUsdPriceResolver(RestClient restClient, String baseUrl) {
        this.restClient = restClient;
        this.baseUrl = baseUrl;
    }

    public Optional<BigDecimal> resolve(Chain chain) {
        String coinId = coinId(chain);
        try {
            JsonNode body = restClient.get()
                    .uri(baseUrl + "/simple/price?ids={id}&vs_currencies=usd", coinId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
            JsonNode usd = body == null ? null : body.path(coinId).path("usd");
            if (usd == null || !usd.isNumber() || usd.decimalValue().signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(usd.decimalValue());
        } catch (RestClientException e) {
            log.warn("event=coingecko.price.failed coinId={} error={}", coinId, e.getMessage());
            return Optional.empty();
        }
    }

    static String coinId(Chain chain) {
        return switch (chain) {
            case SOLANA -> "solana";
            case TON -> "the-open-network";
        };
    }
}
