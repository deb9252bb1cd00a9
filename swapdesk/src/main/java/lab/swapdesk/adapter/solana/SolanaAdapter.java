package lab.swapdesk.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.common.KeyDecryptionFailedException;
import lab.swapdesk.common.NoLiquidityDataException;
import lab.swapdesk.custody.Ed25519KeyPair;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

@RequiredArgsConstructor
@Slf4j
public class SolanaAdapter implements ChainAdapter {

    public static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";

    private static final ObjectMapper SECRET_MAPPER = new ObjectMapper();

    private final SolanaRpcClient rpc;
    private final JupiterSwapClient jupiter;

    @Override
    public Chain getChain() {
        return Chain.SOLANA;
    }

    @Override
    public boolean validateAddress(String address) {
        return isValidAddress(address);
    }

    public static boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        try {
            return Base58.decode(address.trim()).length == 32;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public long getNativeBalance(String address) {
        return rpc.getBalance(address);
    }

    @Override
    public long getTokenBalance(String ownerAddress, String tokenAddress) {
        return rpc.getTokenBalance(ownerAddress, tokenAddress);
    }

    @Override
    public int tokenDecimals(String tokenAddress) {
        if (WRAPPED_SOL_MINT.equals(tokenAddress)) {
            return Chain.SOLANA.getNativeDecimals();
        }
        return rpc.getTokenDecimals(tokenAddress);
    }

    @Override
    public UnsignedTransaction buildSwapTransaction(SwapOrder order) {
        boolean buy = order.direction() == SwapDirection.NATIVE_TO_TOKEN;
        String inputMint = buy ? WRAPPED_SOL_MINT : order.counterAsset();
        String outputMint = buy ? order.counterAsset() : WRAPPED_SOL_MINT;

        JsonNode route = jupiter.quote(inputMint, outputMint, order.amountRaw(), order.slippageBps());
        long routeMinOutput = route.path("otherAmountThreshold").asLong(0L);
        // The route's threshold is what the program enforces on chain; it must not undercut the quoted floor.
        if (routeMinOutput < order.minOutputRaw()) {
            log.warn("event=solana.swap.route_below_min wallet={} routeMinOut={} minOutputRaw={}",
                    order.walletAddress(), routeMinOutput, order.minOutputRaw());
            throw new NoLiquidityDataException("jupiter route guarantees %d, below the required minimum %d"
                    .formatted(routeMinOutput, order.minOutputRaw()));
        }
        JupiterSwapClient.SwapTransaction swap = jupiter.swap(route, order.walletAddress());
        log.info("event=solana.swap.built wallet={} direction={} outAmount={} routeMinOut={} lastValidBlockHeight={}",
                order.walletAddress(), order.direction(), route.path("outAmount").asText(), routeMinOutput,
                swap.lastValidBlockHeight());

        return new UnsignedTransaction(
                Chain.SOLANA,
                order.walletAddress(),
                outputMint,
                buy ? order.amountRaw() : 0L,
                routeMinOutput,
                0L,
                Base64.getDecoder().decode(swap.base64Transaction())
        );
    }

    @Override
    public UnsignedTransaction buildNativeTransfer(String fromAddress, String toAddress, long amountRaw, String comment) {
        if (comment != null && !comment.isBlank()) {
            log.debug("event=solana.transfer.comment_ignored from={}", fromAddress);
        }
        String blockhash = rpc.getLatestBlockhash();
        byte[] payload = SolanaTransactions.systemTransfer(
                Base58.decode(fromAddress), Base58.decode(toAddress), amountRaw, Base58.decode(blockhash));
        return new UnsignedTransaction(Chain.SOLANA, fromAddress, toAddress, amountRaw, 0L, 0L, payload);
    }

    // Accepts a raw 32-byte seed or 64-byte keypair, or the same encoded as base58 text or a JSON byte array.
    @Override
    public Ed25519KeyPair loadSigningKey(byte[] secret, String expectedAddress) {
        byte[] keyBytes = secret.length == 32 || secret.length == 64 ? secret.clone() : decodeText(secret);
        try {
            if (keyBytes.length != 32 && keyBytes.length != 64) {
                throw new KeyDecryptionFailedException(
                        "solana secret must be a 32-byte seed or 64-byte keypair, got " + keyBytes.length + " bytes");
            }
            Ed25519KeyPair key = Ed25519KeyPair.fromSeed(Arrays.copyOfRange(keyBytes, 0, 32));
            if (keyBytes.length == 64 && !Arrays.equals(key.publicKey(), Arrays.copyOfRange(keyBytes, 32, 64))) {
                key.close();
                throw new KeyDecryptionFailedException("solana keypair public half does not match its seed");
            }
            if (!Base58.encode(key.publicKey()).equals(expectedAddress)) {
                key.close();
                throw new KeyDecryptionFailedException("decrypted key does not belong to wallet " + expectedAddress);
            }
            return key;
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    @Override
    public SignedTransaction sign(UnsignedTransaction transaction, Ed25519KeyPair key) {
        SolanaTransactions.Signed signed = SolanaTransactions.signAsFeePayer(transaction.payload(), key);
        return new SignedTransaction(Chain.SOLANA, signed.signature(), signed.wire());
    }

    @Override
    public void submit(SignedTransaction transaction) {
        String accepted = rpc.sendTransaction(Base64.getEncoder().encodeToString(transaction.wire()));
        if (accepted != null && !accepted.equals(transaction.txId())) {
            log.warn("event=solana.submit.signature_mismatch expected={} returned={}", transaction.txId(), accepted);
        }
    }

    @Override
    public TxStatus getTransactionStatus(String txId) {
        JsonNode status = rpc.getSignatureStatus(txId);
        if (status == null || status.isMissingNode() || status.isNull()) {
            return TxStatus.NOT_FOUND;
        }
        JsonNode err = status.get("err");
        if (err != null && !err.isNull()) {
            return TxStatus.FAILED;
        }
        String confirmation = status.path("confirmationStatus").asText("");
        return "confirmed".equals(confirmation) || "finalized".equals(confirmation)
                ? TxStatus.CONFIRMED
                : TxStatus.PENDING;
    }

    private static byte[] decodeText(byte[] secret) {
        String text = new String(secret, StandardCharsets.UTF_8).trim();
        try {
            if (text.startsWith("[")) {
                int[] values = SECRET_MAPPER.readValue(text, int[].class);
                byte[] out = new byte[values.length];
                for (int i = 0; i < values.length; i++) {
                    out[i] = (byte) values[i];
                }
                return out;
            }
            return Base58.decode(text);
        } catch (IOException | IllegalArgumentException e) {
            throw new KeyDecryptionFailedException("solana secret is neither raw bytes, base58 nor a JSON byte array", e);
        }
    }
}
