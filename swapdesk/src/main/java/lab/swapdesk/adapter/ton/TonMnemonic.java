package lab.swapdesk.adapter.ton;

import lab.swapdesk.common.KeyDecryptionFailedException;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * TON wallet mnemonic (24 words, no password) to Ed25519 seed.
 */
public final class TonMnemonic {

    public static final int WORD_COUNT = 24;
    private static final int PBKDF_ITERATIONS = 100_000;
    private static final byte[] SEED_SALT = "TON default seed".getBytes(StandardCharsets.UTF_8);
    private static final byte[] BASIC_SALT = "TON seed version".getBytes(StandardCharsets.UTF_8);

    private TonMnemonic() {
    }

    public static List<String> parseWords(byte[] secret) {
        String text = new String(secret, StandardCharsets.UTF_8).trim().toLowerCase(Locale.ROOT);
        List<String> words = text.isEmpty() ? List.of() : Arrays.asList(text.split("[\\s,]+"));
        if (words.size() != WORD_COUNT) {
            throw new KeyDecryptionFailedException("ton mnemonic must have 24 words, got " + words.size());
        }
        return words;
    }

    public static byte[] toSeed(List<String> words) {
        byte[] entropy = entropy(words);
        try {
            if (!isBasicSeed(entropy)) {
                throw new KeyDecryptionFailedException("ton mnemonic failed its checksum; stored words are corrupted");
            }
            return Arrays.copyOf(pbkdf2(entropy, SEED_SALT, PBKDF_ITERATIONS), 32);
        } finally {
            Arrays.fill(entropy, (byte) 0);
        }
    }

    private static byte[] entropy(List<String> words) {
        HMac hmac = new HMac(new SHA512Digest());
        hmac.init(new KeyParameter(String.join(" ", words).getBytes(StandardCharsets.UTF_8)));
        byte[] out = new byte[hmac.getMacSize()];
        hmac.doFinal(out, 0);
        return out;
    }

    // Mnemonics generated without a password derive a seed whose first byte is zero under this salt.
    private static boolean isBasicSeed(byte[] entropy) {
        return pbkdf2(entropy, BASIC_SALT, Math.max(1, PBKDF_ITERATIONS / 256))[0] == 0;
    }

    private static byte[] pbkdf2(byte[] password, byte[] salt, int iterations) {
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
        generator.init(password, salt, iterations);
        return ((KeyParameter) generator.generateDerivedParameters(512)).getKey();
    }
}
