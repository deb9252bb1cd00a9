package lab.swapdesk.sim.fakechain;

import com.fasterxml.jackson.databind.ObjectMapper;
import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.solana.Base58;
import lab.swapdesk.adapter.solana.SolanaAdapter;
import lab.swapdesk.adapter.ton.TonAddress;
import lab.swapdesk.common.InvalidInputException;
import lab.swapdesk.common.KeyDecryptionFailedException;
import lab.swapdesk.common.NoLiquidityDataException;
import lab.swapdesk.custody.Ed25519KeyPair;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Chain adapter over {@link FakeChain}. Addresses, keys and signatures are real Ed25519 material so the
 * custody path runs unchanged; balances and outcomes come from the in-memory ledger.
 */
@Slf4j
public class SimulatedChainAdapter implements ChainAdapter {

    static final long SOLANA_FEE_RAW = 5_000L;
    static final long TON_FEE_RAW = 10_000_000L;

    private static final ObjectMapper PAYLOAD_MAPPER = new ObjectMapper();

    private final Chain chain;
    private final FakeChain fakeChain;

    public SimulatedChainAdapter(Chain chain, FakeChain fakeChain) {
        this.chain = chain;
        this.fakeChain = fakeChain;
    }

    public record Envelope(long sequence, FakeChain.Effect effect) {
    }

    @Override
    public Chain getChain() {
        return chain;
    }

    @Override
    public boolean validateAddress(String address) {
        return chain == Chain.SOLANA ? SolanaAdapter.isValidAddress(address) : TonAddress.isValid(address);
    }

    @Override
    public long getNativeBalance(String address) {
        return fakeChain.nativeBalance(chain, address);
    }

    @Override
    public long getTokenBalance(String ownerAddress, String tokenAddress) {
        return fakeChain.tokenBalance(chain, ownerAddress, tokenAddress);
    }

    @Override
    public int tokenDecimals(String tokenAddress) {
        return fakeChain.tokenDecimals(chain, tokenAddress)
                .orElseThrow(() -> new InvalidInputException("unknown token " + tokenAddress + " on " + chain));
    }

    @Override
    public UnsignedTransaction buildSwapTransaction(SwapOrder order) {
        BigDecimal price = fakeChain.priceNative(chain, order.counterAsset())
                .orElseThrow(() -> new NoLiquidityDataException("no simulated pool for " + order.counterAsset()));
        int tokenDecimals = tokenDecimals(order.counterAsset());
        FakeChain.Effect effect;
        long value;
        if (order.direction() == SwapDirection.NATIVE_TO_TOKEN) {
            long tokensOut = BigDecimal.valueOf(order.amountRaw())
                    .movePointLeft(chain.getNativeDecimals())
                    .divide(price, tokenDecimals + 2, RoundingMode.DOWN)
                    .movePointRight(tokenDecimals)
                    .setScale(0, RoundingMode.DOWN)
                    .longValueExact();
            effect = new FakeChain.Effect(chain, order.walletAddress(), order.amountRaw(), 0L,
                    order.counterAsset(), tokensOut, null, fee());
            value = order.amountRaw();
        } else {
            long nativeOut = BigDecimal.valueOf(order.amountRaw())
                    .movePointLeft(tokenDecimals)
                    .multiply(price)
                    .movePointRight(chain.getNativeDecimals())
                    .setScale(0, RoundingMode.DOWN)
                    .longValueExact();
            effect = new FakeChain.Effect(chain, order.walletAddress(), 0L, nativeOut,
                    order.counterAsset(), -order.amountRaw(), null, fee());
            value = 0L;
        }
        long sequence = fakeChain.nextSequence(chain, order.walletAddress());
        log.info("event=sim.swap.built chain={} wallet={} direction={} amountRaw={} minOut={} seq={}",
                chain, order.walletAddress(), order.direction(), order.amountRaw(), order.minOutputRaw(), sequence);
        return new UnsignedTransaction(chain, order.walletAddress(), "sim-pool:" + order.counterAsset(), value,
                order.minOutputRaw(), sequence, encode(new Envelope(sequence, effect)));
    }

    @Override
    public UnsignedTransaction buildNativeTransfer(String fromAddress, String toAddress, long amountRaw, String comment) {
        long sequence = fakeChain.nextSequence(chain, fromAddress);
        FakeChain.Effect effect = new FakeChain.Effect(chain, fromAddress, amountRaw, 0L, null, 0L, toAddress, fee());
        return new UnsignedTransaction(chain, fromAddress, toAddress, amountRaw, 0L, sequence,
                encode(new Envelope(sequence, effect)));
    }

    @Override
    public Ed25519KeyPair loadSigningKey(byte[] secret, String expectedAddress) {
        if (secret == null || secret.length != Ed25519KeyPair.SEED_LENGTH) {
            throw new KeyDecryptionFailedException("simulated wallet secret must be a 32-byte seed");
        }
        Ed25519KeyPair key = Ed25519KeyPair.fromSeed(secret);
        if (!sameAddress(addressOf(chain, key.publicKey()), expectedAddress)) {
            key.close();
            throw new KeyDecryptionFailedException("decrypted seed does not control wallet " + expectedAddress);
        }
        return key;
    }

    @Override
    public SignedTransaction sign(UnsignedTransaction transaction, Ed25519KeyPair key) {
        byte[] payload = transaction.payload();
        byte[] signature = key.sign(payload);
        String txId = chain == Chain.SOLANA
                ? Base58.encode(signature)
                : HexFormat.of().formatHex(sha256(signature));
        byte[] wire = Arrays.copyOf(payload, payload.length + signature.length);
        System.arraycopy(signature, 0, wire, payload.length, signature.length);
        return new SignedTransaction(chain, txId, wire);
    }

    @Override
    public void submit(SignedTransaction transaction) {
        byte[] wire = transaction.wire();
        Envelope envelope = decode(Arrays.copyOf(wire, wire.length - 64));
        fakeChain.broadcast(transaction.txId(), envelope.effect());
    }

    @Override
    public TxStatus getTransactionStatus(String txId) {
        return fakeChain.status(txId);
    }

    /** Address the wallet with this public key has on the chain. */
    public static String addressOf(Chain chain, byte[] publicKey) {
        if (chain == Chain.SOLANA) {
            return Base58.encode(publicKey);
        }
        return new TonAddress(0, sha256(publicKey)).toUserFriendly(true, false);
    }

    private boolean sameAddress(String derived, String expected) {
        if (chain == Chain.SOLANA) {
            return derived.equals(expected);
        }
        return TonAddress.isValid(expected) && TonAddress.parse(derived).equals(TonAddress.parse(expected));
    }

    private long fee() {
        return chain == Chain.SOLANA ? SOLANA_FEE_RAW : TON_FEE_RAW;
    }

    private static byte[] encode(Envelope envelope) {
        try {
            return PAYLOAD_MAPPER.writeValueAsBytes(envelope);
        } catch (IOException e) {
            throw new IllegalStateException("simulated payload could not be encoded", e);
        }
    }

    private static Envelope decode(byte[] payload) {
        try {
            return PAYLOAD_MAPPER.readValue(payload, Envelope.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("simulated payload is malformed", e);
        }
    }

    static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
