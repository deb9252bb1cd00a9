package lab.swapdesk.custody;

import lab.swapdesk.adapter.ChainAdapter;
import lab.swapdesk.adapter.ChainAdapter.SignedTransaction;
import lab.swapdesk.adapter.ChainAdapter.UnsignedTransaction;
import lab.swapdesk.common.KeyDecryptionFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Component
@RequiredArgsConstructor
@Slf4j
public class CustodialWallet {

    private final SecretCodec secretCodec;

    // Decrypt the stored secret and turn it into the chain's signing key. The plaintext is wiped on return.
    public Ed25519KeyPair unlock(WalletHandle wallet, ChainAdapter adapter) {
        byte[] plaintext = null;
        try {
            plaintext = secretCodec.decrypt(wallet.encryptedSecret());
            return adapter.loadSigningKey(plaintext, wallet.chainAddress());
        } catch (KeyDecryptionFailedException e) {
            log.error("event=custody.unlock.failed chain={} address={} reason={}",
                    adapter.getChain(), wallet.chainAddress(), e.getMessage());
            throw e;
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    public SignedTransaction sign(WalletHandle wallet, ChainAdapter adapter, UnsignedTransaction transaction) {
        try (Ed25519KeyPair key = unlock(wallet, adapter)) {
            return adapter.sign(transaction, key);
        }
    }
}
