package lab.swapdesk.adapter.ton;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.rpc.RpcEndpointRotator;
import lab.swapdesk.common.NoLiquidityDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * STON.fi HTTP API: swap simulation against the v2 routers.
 */
@Slf4j
public class StonfiClient {

    private final RestClient restClient;
    private final RpcEndpointRotator rotator;

    public StonfiClient(RestClient restClient, RpcEndpointRotator rotator) {
        this.restClient = restClient;
        this.rotator = rotator;
    }

    public JsonNode simulate(String offerAddress, String askAddress, long units, int slippageBps) {
        String tolerance = BigDecimal.valueOf(slippageBps)
                .divide(BigDecimal.valueOf(10_000), 4, RoundingMode.UNNECESSARY)
                .stripTrailingZeros()
                .toPlainString();
        try {
            JsonNode simulation = rotator.call("stonfi.simulate", base -> restClient.post()
                    .uri(base + "/v1/swap/simulate?offer_address={offer}&ask_address={ask}&units={units}"
                                    + "&slippage_tolerance={tolerance}&dex_v2=true",
                            offerAddress, askAddress, units, tolerance)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class));
            if (simulation == null || simulation.path("ask_units").asText("0").equals("0")) {
                throw new NoLiquidityDataException("stonfi simulation returned no output for " + askAddress);
            }
            return simulation;
        } catch (HttpClientErrorException e) {
            log.warn("event=stonfi.simulate.rejected status={} body={}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new NoLiquidityDataException("stonfi has no pool for %s -> %s".formatted(offerAddress, askAddress), e);
        }
    }
}
