package lab.swapdesk.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.rpc.RpcEndpointRotator;
import lab.swapdesk.common.RpcUnavailableException;
import lab.swapdesk.common.SubmissionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Solana JSON-RPC 2.0 over HTTP with endpoint failover.
 */
@Slf4j
public class SolanaRpcClient {

    private static final Map<String, Object> CONFIRMED = Map.of("commitment", "confirmed");

    private final RestClient restClient;
    private final RpcEndpointRotator rotator;
    private final AtomicLong requestIds = new AtomicLong(1);

    public SolanaRpcClient(RestClient restClient, RpcEndpointRotator rotator) {
        this.restClient = restClient;
        this.rotator = rotator;
    }

    public long getBalance(String address) {
        return read("getBalance", List.of(address, CONFIRMED)).path("value").asLong();
    }

    public int getTokenDecimals(String mint) {
        JsonNode value = read("getTokenSupply", List.of(mint, CONFIRMED)).path("value");
        if (!value.has("decimals")) {
            throw new RpcUnavailableException("getTokenSupply returned no decimals for " + mint);
        }
        return value.path("decimals").asInt();
    }

    // Sum of every token account the owner holds for the mint; accounts are rarely split but may be.
    public long getTokenBalance(String owner, String mint) {
        JsonNode accounts = read("getTokenAccountsByOwner", List.of(
                owner,
                Map.of("mint", mint),
                Map.of("encoding", "jsonParsed", "commitment", "confirmed")
        )).path("value");
        long total = 0L;
        for (JsonNode account : accounts) {
            String amount = account.path("account").path("data").path("parsed")
                    .path("info").path("tokenAmount").path("amount").asText("0");
            total = Math.addExact(total, Long.parseLong(amount));
        }
        return total;
    }

    public String getLatestBlockhash() {
        return read("getLatestBlockhash", List.of(CONFIRMED)).path("value").path("blockhash").asText();
    }

    /**
     * Broadcasts once with preflight on. A JSON-RPC error is an explicit rejection.
     */
    public String sendTransaction(String base64Transaction) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("encoding", "base64");
        options.put("skipPreflight", false);
        options.put("preflightCommitment", "confirmed");
        options.put("maxRetries", 0);
        JsonNode response = rotator.submit("sendTransaction",
                endpoint -> post(endpoint, "sendTransaction", List.of(base64Transaction, options)));
        JsonNode error = response == null ? null : response.get("error");
        if (error != null && !error.isNull()) {
            throw new SubmissionFailedException("solana rejected transaction: code=%s message=%s"
                    .formatted(error.path("code").asText(), error.path("message").asText()));
        }
        return response == null ? null : response.path("result").asText(null);
    }

    /**
     * Status entry of one signature, or a missing node when the cluster has never seen it.
     */
    public JsonNode getSignatureStatus(String signature) {
        JsonNode value = read("getSignatureStatuses",
                List.of(List.of(signature), Map.of("searchTransactionHistory", true))).path("value");
        return value.path(0);
    }

    private JsonNode read(String method, List<Object> params) {
        JsonNode response = rotator.call(method, endpoint -> post(endpoint, method, params));
        if (response == null) {
            throw new RpcUnavailableException("empty response for " + method);
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            log.warn("event=solana.rpc.error method={} code={} message={}",
                    method, error.path("code").asText(), error.path("message").asText());
            throw new RpcUnavailableException("solana rpc error on %s: %s".formatted(method, error.path("message").asText()));
        }
        return response.path("result");
    }

    private JsonNode post(String endpoint, String method, List<Object> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.getAndIncrement());
        body.put("method", method);
        body.put("params", params);
        return restClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class);
    }
}
