package lab.swapdesk.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.rpc.RpcEndpointRotator;
import lab.swapdesk.common.NoLiquidityDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jupiter swap API: route quote, then a serialized swap transaction for that route.
 */
@Slf4j
public class JupiterSwapClient {

    private final RestClient restClient;
    private final RpcEndpointRotator rotator;
    private final String apiKey;

    public JupiterSwapClient(RestClient restClient, RpcEndpointRotator rotator, String apiKey) {
        this.restClient = restClient;
        this.rotator = rotator;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public record SwapTransaction(String base64Transaction, long lastValidBlockHeight) {
    }

    /**
     * Best route for {@code amount} of the input mint. {@code otherAmountThreshold} of the answer is the
     * minimum output the route will enforce.
     */
    public JsonNode quote(String inputMint, String outputMint, long amount, int slippageBps) {
        try {
            JsonNode quote = rotator.call("jupiter.quote", base -> restClient.get()
                    .uri(base + "/swap/v1/quote?inputMint={in}&outputMint={out}&amount={amount}&slippageBps={bps}",
                            inputMint, outputMint, amount, slippageBps)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (!apiKey.isEmpty()) {
                            h.set("x-api-key", apiKey);
                        }
                    })
                    .retrieve()
                    .body(JsonNode.class));
            if (quote == null || quote.path("outAmount").asLong(0L) <= 0L) {
                throw new NoLiquidityDataException("jupiter returned no route for %s -> %s".formatted(inputMint, outputMint));
            }
            return quote;
        } catch (HttpClientErrorException e) {
            log.warn("event=jupiter.quote.rejected status={} body={}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new NoLiquidityDataException("jupiter has no route: " + e.getStatusCode().value(), e);
        }
    }

    public SwapTransaction swap(JsonNode quoteResponse, String userPublicKey) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("quoteResponse", quoteResponse);
        body.put("userPublicKey", userPublicKey);
        body.put("wrapAndUnwrapSol", true);
        body.put("dynamicComputeUnitLimit", true);
        JsonNode response = rotator.call("jupiter.swap", base -> restClient.post()
                .uri(base + "/swap/v1/swap")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    if (!apiKey.isEmpty()) {
                        h.set("x-api-key", apiKey);
                    }
                })
                .body(body)
                .retrieve()
                .body(JsonNode.class));
        String transaction = response == null ? "" : response.path("swapTransaction").asText("");
        if (transaction.isEmpty()) {
            throw new NoLiquidityDataException("jupiter returned no swap transaction");
        }
        return new SwapTransaction(transaction, response.path("lastValidBlockHeight").asLong(0L));
    }
}
