package lab.swapdesk.adapter.ton;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.rpc.RpcEndpointRotator;
import lab.swapdesk.common.SubmissionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.Map;
import java.util.Optional;

/**
 * TonAPI v2: account state, jettons, wallet seqno, message broadcast and lookup.
 */
@Slf4j
public class TonApiClient {

    private final RestClient restClient;
    private final RpcEndpointRotator rotator;

    public TonApiClient(RestClient restClient, RpcEndpointRotator rotator, String apiKey) {
        this.restClient = apiKey == null || apiKey.isBlank()
                ? restClient
                : restClient.mutate().defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey.trim()).build();
        this.rotator = rotator;
    }

    public record JettonHolding(long balanceRaw, String walletAddress) {
    }

    public JsonNode getAccount(String address) {
        return get("getAccount", "/v2/accounts/{id}", address);
    }

    public JsonNode getJetton(String jettonMaster) {
        return get("getJetton", "/v2/jettons/{id}", jettonMaster);
    }

    /** Hex public key stored in the wallet contract, empty when the contract is not deployed. */
    public String getPublicKey(String address) {
        try {
            return get("getPublicKey", "/v2/accounts/{id}/publickey", address).path("public_key").asText("");
        } catch (HttpClientErrorException.NotFound e) {
            return "";
        }
    }

    /** Empty when the owner has never held the jetton. */
    public Optional<JettonHolding> getJettonHolding(String owner, String jettonMaster) {
        try {
            JsonNode node = rotator.call("getJettonBalance", base -> restClient
                    .get()
                    .uri(base + "/v2/accounts/{owner}/jettons/{jetton}", owner, jettonMaster)
                    .retrieve()
                    .body(JsonNode.class));
            if (node == null) {
                return Optional.empty();
            }
            return Optional.of(new JettonHolding(
                    Long.parseLong(node.path("balance").asText("0")),
                    node.path("wallet_address").path("address").asText(null)));
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    /** Empty when the wallet contract is not deployed. */
    public Optional<Long> getSeqno(String wallet) {
        try {
            JsonNode node = get("getSeqno", "/v2/wallet/{id}/seqno", wallet);
            return Optional.of(node.path("seqno").asLong());
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    /**
     * Broadcasts a serialized external message once. A 4xx answer is an explicit rejection.
     */
    public void sendMessage(String base64Boc) {
        try {
            rotator.submit("sendMessage", base -> restClient
                    .post()
                    .uri(base + "/v2/blockchain/message")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("boc", base64Boc))
                    .retrieve()
                    .toBodilessEntity());
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == 429) {
                throw e;
            }
            throw new SubmissionFailedException("ton rejected message: status=%d body=%s"
                    .formatted(e.getStatusCode().value(), e.getResponseBodyAsString()), e);
        }
    }

    /** Transaction triggered by the message with the given hash, empty until it has been processed. */
    public Optional<JsonNode> findTransactionByMessage(String messageHashHex) {
        try {
            return Optional.ofNullable(get("getMessageTransaction", "/v2/blockchain/messages/{hash}/transaction",
                    messageHashHex));
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    private JsonNode get(String operation, String path, String id) {
        return rotator.call(operation, base -> restClient
                .get()
                .uri(base + path, id)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class));
    }
}
