package lab.swapdesk.custody;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Public address plus the encrypted secret of a custodial wallet, borrowed for one operation.
 * Never persisted by the swap desk.
 */
public record WalletHandle(String chainAddress, byte[] encryptedSecret) {

    public WalletHandle {
        Objects.requireNonNull(chainAddress, "chainAddress");
        Objects.requireNonNull(encryptedSecret, "encryptedSecret");
        encryptedSecret = encryptedSecret.clone();
    }

    public static WalletHandle of(String chainAddress, String encryptedToken) {
        return new WalletHandle(chainAddress, encryptedToken.getBytes(StandardCharsets.US_ASCII));
    }

    @Override
    public byte[] encryptedSecret() {
        return encryptedSecret.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WalletHandle other)) {
            return false;
        }
        return chainAddress.equals(other.chainAddress) && Arrays.equals(encryptedSecret, other.encryptedSecret);
    }

    @Override
    public int hashCode() {
        return 31 * chainAddress.hashCode() + Arrays.hashCode(encryptedSecret);
    }

    @Override
    public String toString() {
        return "WalletHandle[chainAddress=" + chainAddress + ", encryptedSecret=<redacted>]";
    }
}
