package lab.swapdesk.adapter.ton.cell;

import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CellTest {

    @Test
    void emptyCell_hasWellKnownHash() {
        Cell empty = CellBuilder.beginCell().endCell();

        assertThat(HexFormat.of().formatHex(empty.hash()))
                .isEqualTo("96a296d224f285c67bee93c30f8a309157f0daa35dc5b87e410b78630a09cfc7");
    }

    @Test
    void bagOfCells_preservesTreeAndHash() {
        Cell child = CellBuilder.beginCell().storeUint(0xdeadbeefL, 32).endCell();
        Cell root = CellBuilder.beginCell()
                .storeUint(7, 3)
                .storeCoins(1_000_000_000L)
                .storeRef(child)
                .storeRef(CellBuilder.textComment("hello"))
                .endCell();

        byte[] boc = BagOfCells.serialize(root);
        Cell decoded = BagOfCells.deserialize(boc);

        assertThat(HexFormat.of().formatHex(boc)).startsWith("b5ee9c72");
        assertThat(decoded.hash()).isEqualTo(root.hash());
        assertThat(decoded.refs()).hasSize(2);
        assertThat(decoded.bitLength()).isEqualTo(root.bitLength());
    }

    @Test
    void bagOfCells_detectsCorruption() {
        byte[] boc = BagOfCells.serialize(CellBuilder.beginCell().storeUint(42, 16).endCell());
        boc[boc.length - 5] ^= 0x01;

        assertThatThrownBy(() -> BagOfCells.deserialize(boc)).isInstanceOf(IllegalArgumentException.class);
    }
}
