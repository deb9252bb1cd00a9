package lab.swapdesk.custody;

import lab.swapdesk.common.KeyDecryptionFailedException;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;

/**
 * Fernet tokens: version 0x80, 64-bit timestamp, 128-bit IV, AES-128-CBC ciphertext, HMAC-SHA256.
 * Compatible with secrets written by the Python {@code cryptography} package.
 */
public class FernetSecretCodec implements SecretCodec {

    private static final byte VERSION = (byte) 0x80;
    private static final int IV_LENGTH = 16;
    private static final int HMAC_LENGTH = 32;
    private static final int HEADER_LENGTH = 1 + 8 + IV_LENGTH;

    private final byte[] signingKey;
    private final byte[] encryptionKey;
    private final SecureRandom random;
    private final Clock clock;

    public FernetSecretCodec(String urlSafeBase64Key) {
        this(urlSafeBase64Key, new SecureRandom(), Clock.systemUTC());
    }

    FernetSecretCodec(String urlSafeBase64Key, SecureRandom random, Clock clock) {
        if (urlSafeBase64Key == null || urlSafeBase64Key.isBlank()) {
            throw new IllegalArgumentException("encryption key is required");
        }
        byte[] key;
        try {
            key = Base64.getUrlDecoder().decode(urlSafeBase64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("encryption key must be url-safe base64", e);
        }
        if (key.length != 32) {
            throw new IllegalArgumentException("encryption key must decode to 32 bytes, got " + key.length);
        }
        this.signingKey = Arrays.copyOfRange(key, 0, 16);
        this.encryptionKey = Arrays.copyOfRange(key, 16, 32);
        this.random = random;
        this.clock = clock;
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(encryptionKey, "AES"), new IvParameterSpec(iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            ByteBuffer body = ByteBuffer.allocate(HEADER_LENGTH + ciphertext.length);
            body.put(VERSION).putLong(clock.millis() / 1000).put(iv).put(ciphertext);
            byte[] signed = body.array();

            byte[] token = Arrays.copyOf(signed, signed.length + HMAC_LENGTH);
            System.arraycopy(hmac(signed), 0, token, signed.length, HMAC_LENGTH);
            return Base64.getUrlEncoder().encode(token);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("secret encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] token) {
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(new String(token, StandardCharsets.US_ASCII).trim());
        } catch (IllegalArgumentException e) {
            throw new KeyDecryptionFailedException("secret token is not url-safe base64", e);
        }
        if (raw.length < HEADER_LENGTH + IV_LENGTH + HMAC_LENGTH
                || (raw.length - HEADER_LENGTH - HMAC_LENGTH) % IV_LENGTH != 0) {
            throw new KeyDecryptionFailedException("secret token has invalid length " + raw.length);
        }
        if (raw[0] != VERSION) {
            throw new KeyDecryptionFailedException("unsupported secret token version");
        }

        int signedLength = raw.length - HMAC_LENGTH;
        byte[] signed = Arrays.copyOfRange(raw, 0, signedLength);
        byte[] expectedMac = Arrays.copyOfRange(raw, signedLength, raw.length);
        try {
            if (!MessageDigest.isEqual(hmac(signed), expectedMac)) {
                throw new KeyDecryptionFailedException("secret token signature mismatch (wrong key or corrupted data)");
            }
            byte[] iv = Arrays.copyOfRange(raw, 9, HEADER_LENGTH);
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(encryptionKey, "AES"), new IvParameterSpec(iv));
            return cipher.doFinal(raw, HEADER_LENGTH, signedLength - HEADER_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new KeyDecryptionFailedException("secret token could not be decrypted", e);
        }
    }

    private byte[] hmac(byte[] data) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(signingKey, "HmacSHA256"));
        return mac.doFinal(data);
    }
}
