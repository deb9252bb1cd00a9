package lab.swapdesk.adapter.ton.cell;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Ordinary TON cell: up to 1023 data bits and four references, identified by its representation hash.
 */
public final class Cell {

    public static final int MAX_BITS = 1023;
    public static final int MAX_REFS = 4;

    private final byte[] data;
    private final int bitLength;
    private final List<Cell> refs;
    private final int depth;
    private final byte[] hash;

    Cell(byte[] data, int bitLength, List<Cell> refs) {
        this.data = data;
        this.bitLength = bitLength;
        this.refs = List.copyOf(refs);
        int maxChildDepth = -1;
        for (Cell ref : this.refs) {
            maxChildDepth = Math.max(maxChildDepth, ref.depth);
        }
        this.depth = maxChildDepth + 1;
        this.hash = computeHash();
    }

    public int bitLength() {
        return bitLength;
    }

    public List<Cell> refs() {
        return refs;
    }

    public int depth() {
        return depth;
    }

    public byte[] hash() {
        return hash.clone();
    }

    /** Data bytes with the completion tag applied when the bit length is not byte aligned. */
    byte[] paddedData() {
        int length = (bitLength + 7) / 8;
        byte[] out = new byte[length];
        System.arraycopy(data, 0, out, 0, length);
        if (bitLength % 8 != 0) {
            out[length - 1] |= (byte) (1 << (7 - bitLength % 8));
        }
        return out;
    }

    boolean bit(int index) {
        return (data[index / 8] & (1 << (7 - index % 8))) != 0;
    }

    int refsDescriptor() {
        return refs.size();
    }

    int bitsDescriptor() {
        return bitLength / 8 + (bitLength + 7) / 8;
    }

    private byte[] computeHash() {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            sha256.update((byte) refsDescriptor());
            sha256.update((byte) bitsDescriptor());
            sha256.update(paddedData());
            for (Cell ref : refs) {
                sha256.update((byte) (ref.depth >> 8));
                sha256.update((byte) ref.depth);
            }
            for (Cell ref : refs) {
                sha256.update(ref.hash);
            }
            return sha256.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
