package lab.swapdesk.adapter;

import lab.swapdesk.common.Amounts;
import lab.swapdesk.custody.Ed25519KeyPair;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;

import java.math.BigDecimal;

/**
 * Per-chain primitives used by the swap and withdrawal orchestration.
 * Signing and submission are separate calls so the transaction id can be journaled before broadcast.
 */
public interface ChainAdapter {

    Chain getChain();

    /** Local format check only, never touches the network. */
    boolean validateAddress(String address);

    long getNativeBalance(String address);

    long getTokenBalance(String ownerAddress, String tokenAddress);

    int tokenDecimals(String tokenAddress);

    default long toSmallestUnit(BigDecimal amount) {
        return Amounts.toSmallestUnit(amount, getChain().getNativeDecimals());
    }

    default BigDecimal toHumanUnit(long raw) {
        return Amounts.toHumanUnit(raw, getChain().getNativeDecimals());
    }

    UnsignedTransaction buildSwapTransaction(SwapOrder order);

    UnsignedTransaction buildNativeTransfer(String fromAddress, String toAddress, long amountRaw, String comment);

    /**
     * Turns decrypted secret material into the wallet's signing key.
     *
     * @throws lab.swapdesk.common.KeyDecryptionFailedException if the material has the wrong shape
     *                                                          or belongs to another address
     */
    Ed25519KeyPair loadSigningKey(byte[] secret, String expectedAddress);

    SignedTransaction sign(UnsignedTransaction transaction, Ed25519KeyPair key);

    /**
     * Broadcasts a signed transaction once.
     *
     * @throws lab.swapdesk.common.SubmissionFailedException when the network explicitly rejected it
     * @throws lab.swapdesk.common.NetworkTimeoutException   when no answer came back
     */
    void submit(SignedTransaction transaction);

    TxStatus getTransactionStatus(String txId);

    record SwapOrder(
            SwapDirection direction,
            String counterAsset,
            long amountRaw,
            long minOutputRaw,
            int slippageBps,
            String walletAddress
    ) {
    }

    /**
     * @param destination       address the wallet sends to (router, jetton wallet or transfer recipient)
     * @param nativeValueRaw    native amount leaving the wallet with this transaction, forwarded gas included
     * @param routeMinOutputRaw minimum output the built transaction enforces on chain, 0 for transfers
     * @param sequence          wallet sequence number the transaction was built for, 0 where unused
     * @param payload           chain-specific unsigned bytes
     */
    record UnsignedTransaction(
            Chain chain,
            String walletAddress,
            String destination,
            long nativeValueRaw,
            long routeMinOutputRaw,
            long sequence,
            byte[] payload
    ) {
    }

    record SignedTransaction(Chain chain, String txId, byte[] wire) {
    }

    enum TxStatus {
        NOT_FOUND,
        PENDING,
        CONFIRMED,
        FAILED
    }
}
