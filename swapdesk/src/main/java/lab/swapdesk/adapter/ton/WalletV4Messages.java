package lab.swapdesk.adapter.ton;

import lab.swapdesk.adapter.ton.cell.Cell;
import lab.swapdesk.adapter.ton.cell.CellBuilder;

/**
 * Messages for wallet contract v4r2: internal messages it sends, and the signed external message that
 * carries them.
 */
public final class WalletV4Messages {

    /** Pay fees separately and ignore errors. */
    public static final int SEND_MODE = 3;
    private static final int OP_SIMPLE_SEND = 0;

    private WalletV4Messages() {
    }

    public static Cell internalMessage(TonAddress destination, long valueRaw, boolean bounce, Cell body) {
        CellBuilder b = CellBuilder.beginCell()
                .storeBit(false)          // int_msg_info$0
                .storeBit(true)           // ihr_disabled
                .storeBit(bounce)
                .storeBit(false)          // bounced
                .storeAddress(null)       // src, filled in by the wallet
                .storeAddress(destination)
                .storeCoins(valueRaw)
                .storeBit(false)          // no extra currencies
                .storeCoins(0)            // ihr_fee
                .storeCoins(0)            // fwd_fee
                .storeUint(0, 64)         // created_lt
                .storeUint(0, 32)         // created_at
                .storeBit(false);         // no state init
        if (body == null) {
            return b.storeBit(false).endCell();
        }
        return b.storeBit(true).storeRef(body).endCell();
    }

    public static Cell signingBody(long subwalletId, long validUntil, long seqno, Cell internalMessage) {
        return CellBuilder.beginCell()
                .storeUint(subwalletId, 32)
                .storeUint(validUntil, 32)
                .storeUint(seqno, 32)
                .storeUint(OP_SIMPLE_SEND, 8)
                .storeUint(SEND_MODE, 8)
                .storeRef(internalMessage)
                .endCell();
    }

    public static Cell externalMessage(TonAddress wallet, byte[] signature, Cell signingBody) {
        Cell body = CellBuilder.beginCell()
                .storeBytes(signature)
                .storeCellContents(signingBody)
                .endCell();
        return CellBuilder.beginCell()
                .storeUint(2, 2)          // ext_in_msg_info$10
                .storeAddress(null)       // src
                .storeAddress(wallet)
                .storeCoins(0)            // import_fee
                .storeBit(false)          // no state init
                .storeBit(true)           // body in a ref
                .storeRef(body)
                .endCell();
    }
}
