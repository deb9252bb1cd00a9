package lab.swapdesk.common;

/**
 * The stored wallet secret could not be decrypted or does not have the shape the chain signer needs.
 * Never retried: it means corrupted storage or a wrong encryption key.
 */
public class KeyDecryptionFailedException extends SwapException {

    public KeyDecryptionFailedException(String message) {
        super(SwapErrorKind.KEY_DECRYPTION_FAILED, message);
    }

    public KeyDecryptionFailedException(String message, Throwable cause) {
        super(SwapErrorKind.KEY_DECRYPTION_FAILED, message, cause);
    }
}
