package lab.swapdesk.adapter.solana;

import lab.swapdesk.custody.Ed25519KeyPair;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Wire-level helpers for legacy and v0 Solana transactions:
 * {@code compact-u16 signature count | signatures (64 bytes each) | message}.
 */
public final class SolanaTransactions {

    public static final String SYSTEM_PROGRAM_ID = "11111111111111111111111111111111";
    static final int SIGNATURE_LENGTH = 64;
    private static final int KEY_LENGTH = 32;
    private static final int SYSTEM_TRANSFER = 2;

    private SolanaTransactions() {
    }

    public record Signed(String signature, byte[] wire) {
    }

    /**
     * Signs a single-signer transaction whose fee payer is the given key and fills signature slot 0.
     */
    public static Signed signAsFeePayer(byte[] unsignedWire, Ed25519KeyPair key) {
        int[] cursor = {0};
        int signatureCount = readCompactU16(unsignedWire, cursor);
        int messageOffset = cursor[0] + signatureCount * SIGNATURE_LENGTH;
        if (signatureCount < 1 || messageOffset >= unsignedWire.length) {
            throw new IllegalArgumentException("malformed transaction: signature section");
        }
        byte[] message = Arrays.copyOfRange(unsignedWire, messageOffset, unsignedWire.length);

        int[] m = {0};
        if ((message[0] & 0x80) != 0) {
            m[0]++; // versioned message prefix
        }
        int requiredSignatures = message[m[0]] & 0xff;
        if (requiredSignatures != signatureCount) {
            throw new IllegalArgumentException("header requires %d signatures but transaction carries %d"
                    .formatted(requiredSignatures, signatureCount));
        }
        if (requiredSignatures != 1) {
            throw new IllegalArgumentException("transaction needs %d signers; only the wallet can sign"
                    .formatted(requiredSignatures));
        }
        m[0] += 3;
        int accountCount = readCompactU16(message, m);
        if (accountCount < 1 || m[0] + KEY_LENGTH > message.length) {
            throw new IllegalArgumentException("malformed transaction: account keys");
        }
        byte[] feePayer = Arrays.copyOfRange(message, m[0], m[0] + KEY_LENGTH);
        if (!Arrays.equals(feePayer, key.publicKey())) {
            throw new IllegalArgumentException("fee payer " + Base58.encode(feePayer) + " is not the signing wallet");
        }

        byte[] signature = key.sign(message);
        byte[] signed = unsignedWire.clone();
        System.arraycopy(signature, 0, signed, cursor[0], SIGNATURE_LENGTH);
        return new Signed(Base58.encode(signature), signed);
    }

    /**
     * Unsigned legacy transaction moving lamports with the system program.
     */
    public static byte[] systemTransfer(byte[] from, byte[] to, long lamports, byte[] recentBlockhash) {
        ByteArrayOutputStream message = new ByteArrayOutputStream();
        message.write(1); // required signatures
        message.write(0); // readonly signed
        message.write(1); // readonly unsigned (system program)
        writeCompactU16(message, 3);
        message.writeBytes(from);
        message.writeBytes(to);
        message.writeBytes(Base58.decode(SYSTEM_PROGRAM_ID));
        message.writeBytes(recentBlockhash);

        writeCompactU16(message, 1);
        message.write(2); // program id index
        writeCompactU16(message, 2);
        message.write(0);
        message.write(1);
        byte[] data = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(SYSTEM_TRANSFER)
                .putLong(lamports)
                .array();
        writeCompactU16(message, data.length);
        message.writeBytes(data);

        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        writeCompactU16(wire, 1);
        wire.writeBytes(new byte[SIGNATURE_LENGTH]);
        wire.writeBytes(message.toByteArray());
        return wire.toByteArray();
    }

    static int readCompactU16(byte[] data, int[] cursor) {
        int value = 0;
        for (int shift = 0; shift < 21; shift += 7) {
            if (cursor[0] >= data.length) {
                throw new IllegalArgumentException("truncated compact-u16");
            }
            int b = data[cursor[0]++] & 0xff;
            value |= (b & 0x7f) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new IllegalArgumentException("compact-u16 too long");
    }

    static void writeCompactU16(ByteArrayOutputStream out, int value) {
        int remaining = value;
        while (true) {
            int b = remaining & 0x7f;
            remaining >>= 7;
            if (remaining == 0) {
                out.write(b);
                return;
            }
            out.write(b | 0x80);
        }
    }
}
