package lab.swapdesk.orchestration;

import lab.swapdesk.custody.WalletHandle;
import lab.swapdesk.domain.swap.Chain;
import lab.swapdesk.domain.swap.SwapDirection;

import java.math.BigDecimal;

/**
 * @param encryptedSecret the wallet's stored Fernet token
 * @param slippageBps     defaults to 500 (5%) when absent
 */
public record CreateSwapRequest(
        String chain,
        String walletAddress,
        String encryptedSecret,
        String direction,
        String counterAsset,
        BigDecimal amount,
        Integer slippageBps
) {
    static final int DEFAULT_SLIPPAGE_BPS = 500;

    public SwapRequest toSwapRequest() {
        if (walletAddress == null || encryptedSecret == null || encryptedSecret.isBlank()) {
            throw new IllegalArgumentException("walletAddress and encryptedSecret are required");
        }
        return new SwapRequest(
                Chain.parse(chain),
                WalletHandle.of(walletAddress.trim(), encryptedSecret.trim()),
                SwapDirection.parse(direction),
                counterAsset == null ? null : counterAsset.trim(),
                amount,
                slippageBps == null ? DEFAULT_SLIPPAGE_BPS : slippageBps);
    }
}
