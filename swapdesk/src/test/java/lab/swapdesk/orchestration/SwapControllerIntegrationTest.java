package lab.swapdesk.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SwapControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String wallet;
    private String secret;
    private String mint;

    @BeforeEach
    void setUp() throws Exception {
        JsonNode created = readJson(mockMvc.perform(post("/sim/solana/wallets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"nativeBalance": 2}
                                """))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString());
        wallet = created.get("address").asText();
        secret = created.get("encryptedSecret").asText();

        JsonNode token = readJson(mockMvc.perform(post("/sim/solana/tokens")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"decimals": 6, "priceNative": 0.01}
                                """))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString());
        mint = token.get("address").asText();
    }

    @Test
    void execute_buy_confirmsAndJournalsSingleAttempt() throws Exception {
        String ref = "swap-buy-" + UUID.randomUUID();

        mockMvc.perform(post("/swaps")
                        .header(SwapController.SWAP_REFERENCE_HEADER, ref)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("1", 500)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clientReference").value(ref))
                .andExpect(jsonPath("$.outcome").value("CONFIRMED"))
                .andExpect(jsonPath("$.operation").value("SWAP_BUY"))
                .andExpect(jsonPath("$.amountRaw").value(1_000_000_000L))
                .andExpect(jsonPath("$.quotedOutputRaw").value(100_000_000L))
                .andExpect(jsonPath("$.minOutputRaw").value(95_000_000L))
                .andExpect(jsonPath("$.outputAmountRaw").value(100_000_000L))
                .andExpect(jsonPath("$.gasConsumedRaw").value(5_000L))
                .andExpect(jsonPath("$.quoteSource").value("simulated"))
                .andExpect(jsonPath("$.submissionAttempts").value(1));

        mockMvc.perform(get("/swaps/{reference}", ref))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.attempts.length()").value(1))
                .andExpect(jsonPath("$.attempts[0].operation").value("SWAP_BUY"));

        mockMvc.perform(get("/sim/solana/wallets/{address}", wallet).param("token", mint))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenBalanceRaw").value(100_000_000L))
                .andExpect(jsonPath("$.nativeBalanceRaw").value(999_995_000L));
    }

    @Test
    void execute_sameReferenceTwice_answersWithJournalInsteadOfSwappingAgain() throws Exception {
        String ref = "swap-replay-" + UUID.randomUUID();
        mockMvc.perform(post("/swaps")
                        .header(SwapController.SWAP_REFERENCE_HEADER, ref)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("0.5", 100)))
                .andExpect(status().isOk());

        mockMvc.perform(post("/swaps")
                        .header(SwapController.SWAP_REFERENCE_HEADER, ref)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("0.5", 100)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.attempts.length()").value(1));

        mockMvc.perform(get("/sim/solana/wallets/{address}", wallet).param("token", mint))
                .andExpect(jsonPath("$.tokenBalanceRaw").value(50_000_000L));
    }

    @Test
    void execute_firstBroadcastRejected_rebuildsAndConfirmsSecond() throws Exception {
        String ref = "swap-reject-" + UUID.randomUUID();
        mockMvc.perform(post("/sim/solana/wallets/{address}/next-outcome/{outcome}", wallet, "REJECT"))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/swaps")
                        .header(SwapController.SWAP_REFERENCE_HEADER, ref)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("0.1", 500)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("CONFIRMED"))
                .andExpect(jsonPath("$.submissionAttempts").value(2));

        mockMvc.perform(get("/swaps/{reference}", ref))
                .andExpect(jsonPath("$.attempts.length()").value(2))
                .andExpect(jsonPath("$.attempts[0].status").value("REJECTED"))
                .andExpect(jsonPath("$.attempts[1].status").value("CONFIRMED"));
    }

    @Test
    void execute_timeoutAfterDelivery_resolvesByPollingWithoutResending() throws Exception {
        String ref = "swap-ambiguous-" + UUID.randomUUID();
        mockMvc.perform(post("/sim/solana/wallets/{address}/next-outcome/{outcome}", wallet, "TIMEOUT_DELIVERED"))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/swaps")
                        .header(SwapController.SWAP_REFERENCE_HEADER, ref)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("0.1", 500)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("CONFIRMED"))
                .andExpect(jsonPath("$.submissionAttempts").value(1));

        mockMvc.perform(get("/swaps/{reference}", ref))
                .andExpect(jsonPath("$.attempts.length()").value(1));
    }

    @Test
    void execute_droppedBroadcast_reportsUnknownOutcomeAndMovesNothing() throws Exception {
        String ref = "swap-dropped-" + UUID.randomUUID();
        mockMvc.perform(post("/sim/solana/wallets/{address}/next-outcome/{outcome}", wallet, "TIMEOUT_DROPPED"))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/swaps")
                        .header(SwapController.SWAP_REFERENCE_HEADER, ref)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("0.1", 500)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("UNKNOWN_OUTCOME"))
                .andExpect(jsonPath("$.submissionAttempts").value(1));

        mockMvc.perform(get("/sim/solana/wallets/{address}", wallet))
                .andExpect(jsonPath("$.nativeBalanceRaw").value(2_000_000_000L));
    }

    @Test
    void execute_amountAboveBalanceAndReserve_returnsUnprocessableWithShortfall() throws Exception {
        mockMvc.perform(post("/swaps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("2", 500)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("INSUFFICIENT_FUNDS"))
                .andExpect(jsonPath("$.retryable").value(false))
                .andExpect(jsonPath("$.details.asset").value("SOL"))
                .andExpect(jsonPath("$.details.shortfallRaw").value(3_000_000L));
    }

    @Test
    void execute_slippageOutOfRange_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/swaps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("0.1", 20_000)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_INPUT"));
    }

    @Test
    void execute_unsupportedChain_returnsBadRequestListingChains() throws Exception {
        mockMvc.perform(post("/swaps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "chain": "ethereum",
                                  "walletAddress": "%s",
                                  "encryptedSecret": "%s",
                                  "direction": "buy",
                                  "counterAsset": "%s",
                                  "amount": 0.1
                                }
                                """.formatted(wallet, secret, mint)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("unsupported chain: ethereum"))
                .andExpect(jsonPath("$.details.allowedChains[0]").value("SOLANA"));
    }

    @Test
    void execute_foreignSecret_failsWithoutLeakingKeyMaterial() throws Exception {
        JsonNode other = readJson(mockMvc.perform(post("/sim/solana/wallets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andReturn().getResponse().getContentAsString());

        mockMvc.perform(post("/swaps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "chain": "solana",
                                  "walletAddress": "%s",
                                  "encryptedSecret": "%s",
                                  "direction": "buy",
                                  "counterAsset": "%s",
                                  "amount": 0.1
                                }
                                """.formatted(wallet, other.get("encryptedSecret").asText(), mint)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("KEY_DECRYPTION_FAILED"))
                .andExpect(jsonPath("$.message").value("Wallet secret could not be used; operation aborted"));
    }

    @Test
    void submit_async_runsToConfirmationAndRefusesLateCancel() throws Exception {
        String ref = "swap-async-" + UUID.randomUUID();
        mockMvc.perform(post("/swaps/async")
                        .header(SwapController.SWAP_REFERENCE_HEADER, ref)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("0.1", 500)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.clientReference").value(ref))
                .andExpect(jsonPath("$.statusPath").value("/swaps/" + ref));

        JsonNode view = awaitStatus(ref, "CONFIRMED");
        assertThat(view.get("txId").asText()).isNotBlank();

        mockMvc.perform(post("/swaps/{reference}/cancel", ref))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void cancel_unknownReference_returnsNotFound() throws Exception {
        mockMvc.perform(post("/swaps/{reference}/cancel", "no-such-swap"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/swaps/{reference}", "no-such-swap"))
                .andExpect(status().isNotFound());
    }

    @Test
    void sync_pendingSwap_staysBroadcastedWhileChainIsPending() throws Exception {
        String ref = "swap-pending-" + UUID.randomUUID();
        mockMvc.perform(post("/sim/solana/wallets/{address}/next-outcome/{outcome}", wallet, "STAY_PENDING"))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/swaps")
                        .header(SwapController.SWAP_REFERENCE_HEADER, ref)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(buyBody("0.1", 500)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SUBMITTED_UNCONFIRMED"));

        mockMvc.perform(post("/swaps/{reference}/sync", ref))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("BROADCASTED"));
    }

    private JsonNode awaitStatus(String ref, String expected) throws Exception {
        JsonNode view = null;
        for (int i = 0; i < 100; i++) {
            var response = mockMvc.perform(get("/swaps/{reference}", ref)).andReturn().getResponse();
            if (response.getStatus() == 200) {
                view = readJson(response.getContentAsString());
                if (expected.equals(view.path("status").asText()) && view.get("stage").isNull()) {
                    return view;
                }
            }
            Thread.sleep(50);
        }
        throw new AssertionError("swap " + ref + " never reached " + expected + ", last view " + view);
    }

    private String buyBody(String amount, int slippageBps) {
        return """
                {
                  "chain": "solana",
                  "walletAddress": "%s",
                  "encryptedSecret": "%s",
                  "direction": "buy",
                  "counterAsset": "%s",
                  "amount": %s,
                  "slippageBps": %d
                }
                """.formatted(wallet, secret, mint, amount, slippageBps);
    }

    private JsonNode readJson(String json) throws Exception {
        return objectMapper.readTree(json);
    }
}
