package lab.swapdesk.custody;

import lab.swapdesk.common.KeyDecryptionFailedException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FernetSecretCodecTest {

    // Fernet reference test vector.
    private static final String SPEC_KEY = "cw_0x689RpI-jtRR7oE8h_eQsKImvJapLeSbXpwF4e4=";
    private static final String SPEC_TOKEN =
            "gAAAAAAdwJ6wAAECAwQFBgcICQoLDA0ODy021cpGVWKZ_eEwCGM4BLLF_5CV9dOPmrhuVUPgJobwOz7JcbmrR64jVmpU4IwqDA==";

    private static final String KEY = "AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=";

    @Test
    void decrypt_referenceToken() {
        byte[] plaintext = new FernetSecretCodec(SPEC_KEY).decrypt(SPEC_TOKEN.getBytes(StandardCharsets.US_ASCII));

        assertThat(new String(plaintext, StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    void encrypt_withReferenceIvAndTime_producesReferenceToken() {
        SecureRandom sequentialIv = new SecureRandom() {
            @Override
            public void nextBytes(byte[] bytes) {
                for (int i = 0; i < bytes.length; i++) {
                    bytes[i] = (byte) i;
                }
            }
        };
        Clock clock = Clock.fixed(Instant.ofEpochSecond(499_162_800L), ZoneOffset.UTC);
        FernetSecretCodec codec = new FernetSecretCodec(SPEC_KEY, sequentialIv, clock);

        byte[] token = codec.encrypt("hello".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(token, StandardCharsets.US_ASCII)).isEqualTo(SPEC_TOKEN);
    }

    @Test
    void encryptThenDecrypt_returnsSecret() {
        FernetSecretCodec codec = new FernetSecretCodec(KEY);
        byte[] secret = new byte[32];
        new SecureRandom().nextBytes(secret);

        assertThat(codec.decrypt(codec.encrypt(secret))).isEqualTo(secret);
    }

    @Test
    void decrypt_underAnotherKey_failsWithKeyDecryptionError() {
        byte[] token = new FernetSecretCodec(KEY).encrypt("seed".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> new FernetSecretCodec(SPEC_KEY).decrypt(token))
                .isInstanceOf(KeyDecryptionFailedException.class)
                .hasMessageContaining("signature mismatch");
    }

    @Test
    void decrypt_tamperedToken_failsWithKeyDecryptionError() {
        FernetSecretCodec codec = new FernetSecretCodec(KEY);
        byte[] raw = Base64.getUrlDecoder().decode(codec.encrypt("seed".getBytes(StandardCharsets.UTF_8)));
        raw[30] ^= 0x01;
        byte[] tampered = Base64.getUrlEncoder().encode(raw);

        assertThatThrownBy(() -> codec.decrypt(tampered)).isInstanceOf(KeyDecryptionFailedException.class);
    }

    @Test
    void decrypt_garbage_failsWithKeyDecryptionError() {
        FernetSecretCodec codec = new FernetSecretCodec(KEY);

        assertThatThrownBy(() -> codec.decrypt("not a token!".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(KeyDecryptionFailedException.class);
        assertThatThrownBy(() -> codec.decrypt("gAAAAA==".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(KeyDecryptionFailedException.class);
    }

    @Test
    void constructor_rejectsShortKey() {
        assertThatThrownBy(() -> new FernetSecretCodec("AAECAwQ="))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
    }
}
