package lab.swapdesk.adapter.ton;

import com.fasterxml.jackson.databind.JsonNode;
import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ton.cell.BagOfCells;
import lab.swapdesk.adapter.ton.cell.Cell;
import lab.swapdesk.adapter.ton.cell.CellBuilder;
import lab.swapdesk.common.InvalidInputException;
import lab.swapdesk.common.KeyDecryptionFailedException;
import lab.swapdesk.custody.Ed25519KeyPair;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;

/**
 * TON through TonAPI, swaps routed by STON.fi v2, signed as wallet v4r2 external messages.
 * The transaction id is the hash of the external message cell.
 */
@Slf4j
public class TonAdapter implements ChainAdapter {

    static final long DEFAULT_BUY_FORWARD_GAS = 300_000_000L;
    static final long DEFAULT_SELL_GAS_BUDGET = 300_000_000L;
    static final long DEFAULT_SELL_FORWARD_GAS = 240_000_000L;
    private static final Duration SWAP_DEADLINE = Duration.ofMinutes(15);

    private final TonApiClient tonApi;
    private final StonfiClient stonfi;
    private final String ptonMaster;
    private final long subwalletId;
    private final int messageTtlSeconds;
    private final Clock clock;

    public TonAdapter(TonApiClient tonApi, StonfiClient stonfi, String ptonMaster, long subwalletId,
                      int messageTtlSeconds, Clock clock) {
        this.tonApi = tonApi;
        this.stonfi = stonfi;
        this.ptonMaster = ptonMaster;
        this.subwalletId = subwalletId;
        this.messageTtlSeconds = messageTtlSeconds;
        this.clock = clock;
    }

    @Override
    public Chain getChain() {
        return Chain.TON;
    }

    @Override
    public boolean validateAddress(String address) {
        return TonAddress.isValid(address);
    }

    @Override
    public long getNativeBalance(String address) {
        return tonApi.getAccount(address).path("balance").asLong();
    }

    @Override
    public long getTokenBalance(String ownerAddress, String tokenAddress) {
        return tonApi.getJettonHolding(ownerAddress, tokenAddress)
                .map(TonApiClient.JettonHolding::balanceRaw)
                .orElse(0L);
    }

    @Override
    public int tokenDecimals(String tokenAddress) {
        return tonApi.getJetton(tokenAddress).path("metadata").path("decimals").asInt(Chain.TON.getNativeDecimals());
    }

    @Override
    public UnsignedTransaction buildSwapTransaction(SwapOrder order) {
        TonAddress wallet = TonAddress.parse(order.walletAddress());
        long seqno = requireDeployed(order.walletAddress());
        long deadline = clock.instant().plus(SWAP_DEADLINE).getEpochSecond();
        long queryId = clock.millis();

        Cell internal;
        long value;
        String destination;
        if (order.direction() == SwapDirection.NATIVE_TO_TOKEN) {
            JsonNode sim = stonfi.simulate(ptonMaster, order.counterAsset(), order.amountRaw(), order.slippageBps());
            long forwardGas = gasParam(sim, "forward_gas", DEFAULT_BUY_FORWARD_GAS);
            Cell swap = StonfiSwapPayloads.swap(
                    TonAddress.parse(sim.path("ask_jetton_wallet").asText()), wallet, order.minOutputRaw(), deadline);
            Cell body = StonfiSwapPayloads.tonTransfer(queryId, order.amountRaw(), wallet, swap);
            destination = sim.path("offer_jetton_wallet").asText();
            value = Math.addExact(order.amountRaw(), forwardGas);
            internal = WalletV4Messages.internalMessage(TonAddress.parse(destination), value, true, body);
            log.info("event=ton.swap.built wallet={} direction={} askUnits={} minOut={} value={} router={}",
                    order.walletAddress(), order.direction(), sim.path("ask_units").asText(), order.minOutputRaw(),
                    value, sim.path("router_address").asText());
        } else {
            JsonNode sim = stonfi.simulate(order.counterAsset(), ptonMaster, order.amountRaw(), order.slippageBps());
            long gasBudget = gasParam(sim, "gas_budget", DEFAULT_SELL_GAS_BUDGET);
            long forwardGas = gasParam(sim, "forward_gas", DEFAULT_SELL_FORWARD_GAS);
            destination = tonApi.getJettonHolding(order.walletAddress(), order.counterAsset())
                    .map(TonApiClient.JettonHolding::walletAddress)
                    .orElseThrow(() -> new InvalidInputException(
                            "wallet " + order.walletAddress() + " holds no " + order.counterAsset()));
            Cell swap = StonfiSwapPayloads.swap(
                    TonAddress.parse(sim.path("ask_jetton_wallet").asText()), wallet, order.minOutputRaw(), deadline);
            Cell body = StonfiSwapPayloads.jettonTransfer(queryId, order.amountRaw(),
                    TonAddress.parse(sim.path("router_address").asText()), wallet, forwardGas, swap);
            value = gasBudget;
            internal = WalletV4Messages.internalMessage(TonAddress.parse(destination), value, true, body);
            log.info("event=ton.swap.built wallet={} direction={} askUnits={} minOut={} value={} router={}",
                    order.walletAddress(), order.direction(), sim.path("ask_units").asText(), order.minOutputRaw(),
                    value, sim.path("router_address").asText());
        }
        return new UnsignedTransaction(Chain.TON, order.walletAddress(), destination, value, order.minOutputRaw(),
                seqno, BagOfCells.serialize(internal));
    }

    @Override
    public UnsignedTransaction buildNativeTransfer(String fromAddress, String toAddress, long amountRaw, String comment) {
        long seqno = requireDeployed(fromAddress);
        Cell body = comment == null || comment.isBlank() ? null : CellBuilder.textComment(comment);
        Cell internal = WalletV4Messages.internalMessage(TonAddress.parse(toAddress), amountRaw, false, body);
        return new UnsignedTransaction(Chain.TON, fromAddress, toAddress, amountRaw, 0L, seqno,
                BagOfCells.serialize(internal));
    }

    @Override
    public Ed25519KeyPair loadSigningKey(byte[] secret, String expectedAddress) {
        byte[] seed = TonMnemonic.toSeed(TonMnemonic.parseWords(secret));
        Ed25519KeyPair key;
        try {
            key = Ed25519KeyPair.fromSeed(seed);
        } finally {
            Arrays.fill(seed, (byte) 0);
        }
        String onChainKey = tonApi.getPublicKey(expectedAddress);
        if (!onChainKey.isEmpty() && !onChainKey.equalsIgnoreCase(HexFormat.of().formatHex(key.publicKey()))) {
            key.close();
            throw new KeyDecryptionFailedException("decrypted mnemonic does not control wallet " + expectedAddress);
        }
        return key;
    }

    @Override
    public SignedTransaction sign(UnsignedTransaction transaction, Ed25519KeyPair key) {
        Cell internal = BagOfCells.deserialize(transaction.payload());
        long validUntil = clock.instant().getEpochSecond() + messageTtlSeconds;
        Cell signingBody = WalletV4Messages.signingBody(subwalletId, validUntil, transaction.sequence(), internal);
        byte[] signature = key.sign(signingBody.hash());
        Cell external = WalletV4Messages.externalMessage(
                TonAddress.parse(transaction.walletAddress()), signature, signingBody);
        return new SignedTransaction(Chain.TON, HexFormat.of().formatHex(external.hash()), BagOfCells.serialize(external));
    }

    @Override
    public void submit(SignedTransaction transaction) {
        tonApi.sendMessage(Base64.getEncoder().encodeToString(transaction.wire()));
    }

    @Override
    public TxStatus getTransactionStatus(String txId) {
        Optional<JsonNode> tx = tonApi.findTransactionByMessage(txId);
        if (tx.isEmpty()) {
            return TxStatus.NOT_FOUND;
        }
        return tx.get().path("success").asBoolean(false) ? TxStatus.CONFIRMED : TxStatus.FAILED;
    }

    private long requireDeployed(String wallet) {
        return tonApi.getSeqno(wallet).orElseThrow(() -> new InvalidInputException(
                "ton wallet " + wallet + " is not deployed; it needs one outgoing transfer before it can swap"));
    }

    private static long gasParam(JsonNode simulation, String field, long fallback) {
        JsonNode value = simulation.path("gas_params").path(field);
        if (value.isMissingNode() || value.isNull() || value.asText().isBlank()) {
            return fallback;
        }
        return Long.parseLong(value.asText());
    }
}
