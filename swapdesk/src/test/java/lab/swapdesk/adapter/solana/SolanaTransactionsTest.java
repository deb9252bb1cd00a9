package lab.swapdesk.adapter.solana;

import lab.swapdesk.custody.Ed25519KeyPair;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolanaTransactionsTest {

    private static final byte[] BLOCKHASH = filled(32, 9);

    @Test
    void signAsFeePayer_systemTransfer_fillsSlotZeroWithVerifiableSignature() {
        try (Ed25519KeyPair payer = Ed25519KeyPair.fromSeed(filled(32, 1));
             Ed25519KeyPair recipient = Ed25519KeyPair.fromSeed(filled(32, 2))) {
            byte[] unsigned = SolanaTransactions.systemTransfer(payer.publicKey(), recipient.publicKey(),
                    1_500_000L, BLOCKHASH);

            SolanaTransactions.Signed signed = SolanaTransactions.signAsFeePayer(unsigned, payer);

            byte[] signature = Arrays.copyOfRange(signed.wire(), 1, 1 + SolanaTransactions.SIGNATURE_LENGTH);
            byte[] message = Arrays.copyOfRange(signed.wire(), 1 + SolanaTransactions.SIGNATURE_LENGTH,
                    signed.wire().length);
            assertThat(Base58.encode(signature)).isEqualTo(signed.signature());
            assertThat(Ed25519KeyPair.verify(payer.publicKey(), message, signature)).isTrue();
            assertThat(Arrays.copyOfRange(signed.wire(), 1 + SolanaTransactions.SIGNATURE_LENGTH, signed.wire().length))
                    .isEqualTo(Arrays.copyOfRange(unsigned, 1 + SolanaTransactions.SIGNATURE_LENGTH, unsigned.length));
        }
    }

    @Test
    void signAsFeePayer_foreignFeePayer_isRefused() {
        try (Ed25519KeyPair payer = Ed25519KeyPair.fromSeed(filled(32, 1));
             Ed25519KeyPair other = Ed25519KeyPair.fromSeed(filled(32, 3))) {
            byte[] unsigned = SolanaTransactions.systemTransfer(payer.publicKey(), other.publicKey(), 1L, BLOCKHASH);

            assertThatThrownBy(() -> SolanaTransactions.signAsFeePayer(unsigned, other))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("is not the signing wallet");
        }
    }

    @Test
    void signAsFeePayer_truncatedWire_isRefused() {
        try (Ed25519KeyPair payer = Ed25519KeyPair.fromSeed(filled(32, 1))) {
            assertThatThrownBy(() -> SolanaTransactions.signAsFeePayer(new byte[]{1, 0, 0}, payer))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void compactU16_multiByteValue_readsBackWhatWasWritten() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        SolanaTransactions.writeCompactU16(out, 0x3fff);

        byte[] bytes = out.toByteArray();
        assertThat(bytes).containsExactly(0xff, 0x7f);
        assertThat(SolanaTransactions.readCompactU16(bytes, new int[]{0})).isEqualTo(0x3fff);
    }

    private static byte[] filled(int length, int value) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }
}
