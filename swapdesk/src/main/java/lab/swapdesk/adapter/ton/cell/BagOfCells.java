package lab.swapdesk.adapter.ton.cell;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32C;

/**
 * Single-root bag-of-cells serialization (magic b5ee9c72) with a CRC32C trailer.
 */
public final class BagOfCells {

    private static final byte[] MAGIC = {(byte) 0xb5, (byte) 0xee, (byte) 0x9c, (byte) 0x72};

    private BagOfCells() {
    }

    public static byte[] serialize(Cell root) {
        List<Cell> order = topologicalOrder(root);
        Map<String, Integer> indexByHash = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            indexByHash.put(hex(order.get(i).hash()), i);
        }
        int sizeBytes = bytesFor(order.size());

        ByteArrayOutputStream cells = new ByteArrayOutputStream();
        for (Cell cell : order) {
            cells.write(cell.refsDescriptor());
            cells.write(cell.bitsDescriptor());
            cells.writeBytes(cell.paddedData());
            for (Cell ref : cell.refs()) {
                writeUint(cells, indexByHash.get(hex(ref.hash())), sizeBytes);
            }
        }
        byte[] cellData = cells.toByteArray();
        int offBytes = bytesFor(cellData.length);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(MAGIC);
        out.write(0x40 | sizeBytes); // has_crc32c, no index, no cache bits
        out.write(offBytes);
        writeUint(out, order.size(), sizeBytes);
        writeUint(out, 1, sizeBytes);
        writeUint(out, 0, sizeBytes);
        writeUint(out, cellData.length, offBytes);
        writeUint(out, 0, sizeBytes);
        out.writeBytes(cellData);

        CRC32C crc = new CRC32C();
        byte[] body = out.toByteArray();
        crc.update(body);
        long checksum = crc.getValue();
        for (int i = 0; i < 4; i++) {
            out.write((int) (checksum >>> (8 * i)) & 0xff);
        }
        return out.toByteArray();
    }

    public static Cell deserialize(byte[] boc) {
        if (boc.length < 10 || !Arrays.equals(Arrays.copyOfRange(boc, 0, 4), MAGIC)) {
            throw new IllegalArgumentException("not a bag of cells");
        }
        int flags = boc[4] & 0xff;
        boolean hasIndex = (flags & 0x80) != 0;
        boolean hasCrc = (flags & 0x40) != 0;
        int sizeBytes = flags & 0x07;
        int offBytes = boc[5] & 0xff;
        int[] pos = {6};
        int cellCount = (int) readUint(boc, pos, sizeBytes);
        int rootCount = (int) readUint(boc, pos, sizeBytes);
        readUint(boc, pos, sizeBytes); // absent
        readUint(boc, pos, offBytes); // total cells size
        if (rootCount != 1) {
            throw new IllegalArgumentException("expected a single root, got " + rootCount);
        }
        int rootIndex = (int) readUint(boc, pos, sizeBytes);
        if (hasIndex) {
            pos[0] += cellCount * offBytes;
        }

        byte[][] data = new byte[cellCount][];
        int[] bitLengths = new int[cellCount];
        int[][] refIndexes = new int[cellCount][];
        for (int i = 0; i < cellCount; i++) {
            int d1 = boc[pos[0]++] & 0xff;
            int d2 = boc[pos[0]++] & 0xff;
            int dataLength = (d2 + 1) / 2;
            byte[] bytes = Arrays.copyOfRange(boc, pos[0], pos[0] + dataLength);
            pos[0] += dataLength;
            int bitLength = dataLength * 8;
            if (d2 % 2 == 1) {
                int last = bytes[dataLength - 1] & 0xff;
                int trailing = Integer.numberOfTrailingZeros(last);
                bytes[dataLength - 1] = (byte) (last & ~(1 << trailing));
                bitLength -= trailing + 1;
            }
            int refCount = d1 & 0x07;
            int[] refs = new int[refCount];
            for (int r = 0; r < refCount; r++) {
                refs[r] = (int) readUint(boc, pos, sizeBytes);
            }
            data[i] = bytes;
            bitLengths[i] = bitLength;
            refIndexes[i] = refs;
        }
        if (hasCrc) {
            CRC32C crc = new CRC32C();
            crc.update(boc, 0, boc.length - 4);
            long expected = 0;
            for (int i = 0; i < 4; i++) {
                expected |= (long) (boc[boc.length - 4 + i] & 0xff) << (8 * i);
            }
            if (crc.getValue() != expected) {
                throw new IllegalArgumentException("bag of cells checksum mismatch");
            }
        }

        Cell[] cells = new Cell[cellCount];
        for (int i = cellCount - 1; i >= 0; i--) {
            List<Cell> refs = new ArrayList<>();
            for (int ref : refIndexes[i]) {
                if (ref <= i || cells[ref] == null) {
                    throw new IllegalArgumentException("cell " + i + " references a preceding cell");
                }
                refs.add(cells[ref]);
            }
            cells[i] = CellBuilder.fromParts(data[i], bitLengths[i], refs);
        }
        return cells[rootIndex];
    }

    private static List<Cell> topologicalOrder(Cell root) {
        List<Cell> postOrder = new ArrayList<>();
        visit(root, new HashMap<>(), postOrder);
        Collections.reverse(postOrder);
        return postOrder;
    }

    private static void visit(Cell cell, Map<String, Boolean> visited, List<Cell> postOrder) {
        if (visited.putIfAbsent(hex(cell.hash()), Boolean.TRUE) != null) {
            return;
        }
        for (Cell ref : cell.refs()) {
            visit(ref, visited, postOrder);
        }
        postOrder.add(cell);
    }

    private static int bytesFor(long value) {
        int bytes = 1;
        while (value >= (1L << (8 * bytes))) {
            bytes++;
        }
        return bytes;
    }

    private static void writeUint(ByteArrayOutputStream out, long value, int bytes) {
        for (int i = bytes - 1; i >= 0; i--) {
            out.write((int) (value >>> (8 * i)) & 0xff);
        }
    }

    private static long readUint(byte[] in, int[] pos, int bytes) {
        long value = 0;
        for (int i = 0; i < bytes; i++) {
            value = (value << 8) | (in[pos[0]++] & 0xff);
        }
        return value;
    }

    private static String hex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }
}
