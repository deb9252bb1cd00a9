package lab.swapdesk.sim.fakechain;

import lab.swapdesk.adapter.ChainAdapter.SignedTransaction;
import lab.swapdesk.adapter.ChainAdapter.SwapOrder;
import lab.swapdesk.adapter.ChainAdapter.TxStatus;
import lab.swapdesk.adapter.ChainAdapter.UnsignedTransaction;
import lab.swapdesk.common.KeyDecryptionFailedException;
import lab.swapdesk.common.NetworkTimeoutException;
import lab.swapdesk.common.SubmissionFailedException;
import lab.swapdesk.custody.Ed25519KeyPair;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulatedChainAdapterTest {

    private static final String MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
    private static final String RECIPIENT = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";

    private final FakeChain fakeChain = new FakeChain();
    private final SimulatedChainAdapter adapter = new SimulatedChainAdapter(Chain.SOLANA, fakeChain);

    private byte[] seed;
    private Ed25519KeyPair key;
    private String wallet;

    @BeforeEach
    void setUp() {
        seed = new byte[Ed25519KeyPair.SEED_LENGTH];
        Arrays.fill(seed, (byte) 7);
        key = Ed25519KeyPair.fromSeed(seed);
        wallet = SimulatedChainAdapter.addressOf(Chain.SOLANA, key.publicKey());
        fakeChain.setNativeBalance(Chain.SOLANA, wallet, 2_000_000_000L);
        fakeChain.listToken(Chain.SOLANA, MINT, 6, new BigDecimal("0.01"));
    }

    @AfterEach
    void tearDown() {
        key.close();
    }

    @Test
    void loadSigningKey_matchingAddress_returnsKey() {
        try (Ed25519KeyPair loaded = adapter.loadSigningKey(seed, wallet)) {
            assertThat(loaded.publicKey()).isEqualTo(key.publicKey());
        }
    }

    @Test
    void loadSigningKey_foreignAddress_throwsKeyDecryptionFailed() {
        assertThatThrownBy(() -> adapter.loadSigningKey(seed, RECIPIENT))
                .isInstanceOf(KeyDecryptionFailedException.class);
    }

    @Test
    void loadSigningKey_wrongLength_throwsKeyDecryptionFailed() {
        assertThatThrownBy(() -> adapter.loadSigningKey(new byte[16], wallet))
                .isInstanceOf(KeyDecryptionFailedException.class)
                .hasMessageContaining("32-byte");
    }

    @Test
    void submit_acceptedBuy_movesBalancesAndConfirms() {
        SignedTransaction signed = adapter.sign(buy(1_000_000_000L), key);

        adapter.submit(signed);

        assertThat(adapter.getTransactionStatus(signed.txId())).isEqualTo(TxStatus.CONFIRMED);
        assertThat(adapter.getNativeBalance(wallet)).isEqualTo(1_000_000_000L - SimulatedChainAdapter.SOLANA_FEE_RAW);
        assertThat(adapter.getTokenBalance(wallet, MINT)).isEqualTo(100_000_000L);
    }

    @Test
    void submit_sell_creditsNativeAndDebitsTokens() {
        fakeChain.setTokenBalance(Chain.SOLANA, wallet, MINT, 50_000_000L);
        UnsignedTransaction sell = adapter.buildSwapTransaction(
                new SwapOrder(SwapDirection.TOKEN_TO_NATIVE, MINT, 50_000_000L, 0L, 100, wallet));

        adapter.submit(adapter.sign(sell, key));

        assertThat(adapter.getTokenBalance(wallet, MINT)).isZero();
        assertThat(adapter.getNativeBalance(wallet))
                .isEqualTo(2_000_000_000L + 500_000_000L - SimulatedChainAdapter.SOLANA_FEE_RAW);
    }

    @Test
    void submit_timeoutAfterDelivery_throwsAmbiguousTimeoutButLands() {
        fakeChain.scriptOutcome(Chain.SOLANA, wallet, FakeChain.NextOutcome.TIMEOUT_DELIVERED);
        SignedTransaction signed = adapter.sign(buy(100_000_000L), key);

        assertThatThrownBy(() -> adapter.submit(signed))
                .isInstanceOfSatisfying(NetworkTimeoutException.class,
                        e -> assertThat(e.isPossiblyDelivered()).isTrue());
        assertThat(adapter.getTransactionStatus(signed.txId())).isEqualTo(TxStatus.CONFIRMED);
    }

    @Test
    void submit_rejected_leavesNothingOnChain() {
        fakeChain.scriptOutcome(Chain.SOLANA, wallet, FakeChain.NextOutcome.REJECT);
        SignedTransaction signed = adapter.sign(buy(100_000_000L), key);

        assertThatThrownBy(() -> adapter.submit(signed)).isInstanceOf(SubmissionFailedException.class);
        assertThat(adapter.getTransactionStatus(signed.txId())).isEqualTo(TxStatus.NOT_FOUND);
        assertThat(adapter.getNativeBalance(wallet)).isEqualTo(2_000_000_000L);
    }

    @Test
    void submit_sameTransactionTwice_secondIsRefused() {
        SignedTransaction signed = adapter.sign(buy(100_000_000L), key);
        adapter.submit(signed);

        assertThatThrownBy(() -> adapter.submit(signed))
                .isInstanceOf(SubmissionFailedException.class)
                .hasMessageContaining("already processed");
    }

    @Test
    void submit_failOnChain_chargesFeeOnly() {
        fakeChain.scriptOutcome(Chain.SOLANA, wallet, FakeChain.NextOutcome.FAIL_ON_CHAIN);
        SignedTransaction signed = adapter.sign(buy(100_000_000L), key);

        adapter.submit(signed);

        assertThat(adapter.getTransactionStatus(signed.txId())).isEqualTo(TxStatus.FAILED);
        assertThat(adapter.getNativeBalance(wallet)).isEqualTo(2_000_000_000L - SimulatedChainAdapter.SOLANA_FEE_RAW);
        assertThat(adapter.getTokenBalance(wallet, MINT)).isZero();
    }

    @Test
    void submit_nativeTransfer_creditsRecipient() {
        UnsignedTransaction transfer = adapter.buildNativeTransfer(wallet, RECIPIENT, 300_000_000L, "payout");

        adapter.submit(adapter.sign(transfer, key));

        assertThat(adapter.getNativeBalance(RECIPIENT)).isEqualTo(300_000_000L);
        assertThat(adapter.getNativeBalance(wallet))
                .isEqualTo(1_700_000_000L - SimulatedChainAdapter.SOLANA_FEE_RAW);
    }

    @Test
    void buildSwapTransaction_identicalOrders_getDistinctTransactionIds() {
        String first = adapter.sign(buy(100_000_000L), key).txId();
        String second = adapter.sign(buy(100_000_000L), key).txId();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void addressOf_tonKey_isValidTonAddress() {
        SimulatedChainAdapter ton = new SimulatedChainAdapter(Chain.TON, fakeChain);

        String address = SimulatedChainAdapter.addressOf(Chain.TON, key.publicKey());

        assertThat(ton.validateAddress(address)).isTrue();
        assertThat(ton.loadSigningKey(seed, address).publicKey()).isEqualTo(key.publicKey());
    }

    private UnsignedTransaction buy(long lamports) {
        return adapter.buildSwapTransaction(
                new SwapOrder(SwapDirection.NATIVE_TO_TOKEN, MINT, lamports, 0L, 100, wallet));
    }
}
