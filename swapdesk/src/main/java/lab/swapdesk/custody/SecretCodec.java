package lab.swapdesk.custody;

/**
 * Symmetric encryption at rest for wallet secrets. One instance per process, built from a fixed key.
 */
public interface SecretCodec {

    byte[] encrypt(byte[] plaintext);

    /**
     * @throws lab.swapdesk.common.KeyDecryptionFailedException when the token is malformed, tampered with,
     *                                                          or was produced under another key
     */
    byte[] decrypt(byte[] token);
}
