package lab.swapdesk.orchestration;

import lab.swapdesk.custody.WalletHandle;
import lab.swapdesk.domain.swap.Chain;

import java.math.BigDecimal;

public record CreateWithdrawalRequest(
        String chain,
        String walletAddress,
        String encryptedSecret,
        String destination,
        BigDecimal amount,
        String comment
) {
    public WithdrawalRequest toWithdrawalRequest() {
        if (walletAddress == null || encryptedSecret == null || encryptedSecret.isBlank()) {
            throw new IllegalArgumentException("walletAddress and encryptedSecret are required");
        }
        return new WithdrawalRequest(
                Chain.parse(chain),
                WalletHandle.of(walletAddress.trim(), encryptedSecret.trim()),
                destination == null ? null : destination.trim(),
                amount,
                comment);
    }
}
