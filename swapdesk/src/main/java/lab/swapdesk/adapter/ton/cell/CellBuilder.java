package lab.swapdesk.adapter.ton.cell;

import lab.swapdesk.adapter.ton.TonAddress;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public final class CellBuilder {

    private final byte[] data = new byte[(Cell.MAX_BITS + 7) / 8];
    private int bits;
    private final List<Cell> refs = new ArrayList<>();

    private CellBuilder() {
    }

    public static CellBuilder beginCell() {
        return new CellBuilder();
    }

    public CellBuilder storeBit(boolean bit) {
        if (bits >= Cell.MAX_BITS) {
            throw new IllegalStateException("cell overflow: more than " + Cell.MAX_BITS + " bits");
        }
        if (bit) {
            data[bits / 8] |= (byte) (1 << (7 - bits % 8));
        }
        bits++;
        return this;
    }

    public CellBuilder storeUint(long value, int bitCount) {
        return storeUint(BigInteger.valueOf(value), bitCount);
    }

    public CellBuilder storeUint(BigInteger value, int bitCount) {
        if (value.signum() < 0 || value.bitLength() > bitCount) {
            throw new IllegalArgumentException("value " + value + " does not fit in " + bitCount + " unsigned bits");
        }
        for (int i = bitCount - 1; i >= 0; i--) {
            storeBit(value.testBit(i));
        }
        return this;
    }

    public CellBuilder storeInt(long value, int bitCount) {
        BigInteger v = BigInteger.valueOf(value);
        if (v.signum() < 0) {
            v = v.add(BigInteger.ONE.shiftLeft(bitCount));
        }
        return storeUint(v, bitCount);
    }

    public CellBuilder storeBytes(byte[] bytes) {
        for (byte b : bytes) {
            storeUint(b & 0xff, 8);
        }
        return this;
    }

    /** VarUInteger 16: 4-bit byte length followed by the big-endian amount. */
    public CellBuilder storeCoins(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("coins cannot be negative");
        }
        if (amount == 0) {
            return storeUint(0, 4);
        }
        BigInteger value = BigInteger.valueOf(amount);
        int length = (value.bitLength() + 7) / 8;
        storeUint(length, 4);
        return storeUint(value, length * 8);
    }

    /** addr_std without anycast, or addr_none for {@code null}. */
    public CellBuilder storeAddress(TonAddress address) {
        if (address == null) {
            return storeUint(0, 2);
        }
        storeUint(2, 2);
        storeBit(false);
        storeInt(address.workchain(), 8);
        return storeBytes(address.hash());
    }

    public CellBuilder storeRef(Cell cell) {
        if (refs.size() >= Cell.MAX_REFS) {
            throw new IllegalStateException("cell overflow: more than " + Cell.MAX_REFS + " refs");
        }
        refs.add(cell);
        return this;
    }

    public CellBuilder storeMaybeRef(Cell cell) {
        if (cell == null) {
            return storeBit(false);
        }
        storeBit(true);
        return storeRef(cell);
    }

    /** Appends all bits and refs of another cell. */
    public CellBuilder storeCellContents(Cell cell) {
        for (int i = 0; i < cell.bitLength(); i++) {
            storeBit(cell.bit(i));
        }
        for (Cell ref : cell.refs()) {
            storeRef(ref);
        }
        return this;
    }

    /** Text comment: op 0 followed by UTF-8 bytes, continued in a chain of refs when too long. */
    public static Cell textComment(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return snake(bytes, 0, beginCell().storeUint(0, 32), (Cell.MAX_BITS - 32) / 8);
    }

    private static Cell snake(byte[] bytes, int offset, CellBuilder builder, int capacity) {
        int end = Math.min(bytes.length, offset + capacity);
        for (int i = offset; i < end; i++) {
            builder.storeUint(bytes[i] & 0xff, 8);
        }
        if (end < bytes.length) {
            builder.storeRef(snake(bytes, end, beginCell(), Cell.MAX_BITS / 8));
        }
        return builder.endCell();
    }

    public int bits() {
        return bits;
    }

    public Cell endCell() {
        byte[] copy = new byte[(bits + 7) / 8];
        System.arraycopy(data, 0, copy, 0, copy.length);
        return new Cell(copy, bits, refs);
    }

    static Cell fromParts(byte[] data, int bitLength, List<Cell> refs) {
        return new Cell(data, bitLength, refs);
    }
}
