package lab.swapdesk.adapter.ton;

import lab.swapdesk.adapter.ton.cell.Cell;
import lab.swapdesk.adapter.ton.cell.CellBuilder;

/**
 * Message bodies for STON.fi router v2 swaps.
 */
public final class StonfiSwapPayloads {

    static final long OP_SWAP = 0x6664de2aL;
    static final long OP_PTON_TON_TRANSFER = 0x01f3835dL;
    static final long OP_JETTON_TRANSFER = 0x0f8a7ea5L;
    private static final int DEFAULT_REFERRAL_FEE = 10;

    private StonfiSwapPayloads() {
    }

    /**
     * Router-side swap instruction. {@code askJettonWallet} is the router's wallet for the asset being bought.
     */
    public static Cell swap(TonAddress askJettonWallet, TonAddress wallet, long minOutputRaw, long deadline) {
        Cell params = CellBuilder.beginCell()
                .storeCoins(minOutputRaw)
                .storeAddress(wallet)      // receiver
                .storeCoins(0)             // custom payload forward gas
                .storeMaybeRef(null)       // custom payload
                .storeCoins(0)             // refund forward gas
                .storeMaybeRef(null)       // refund payload
                .storeUint(DEFAULT_REFERRAL_FEE, 16)
                .storeAddress(null)        // referral
                .endCell();
        return CellBuilder.beginCell()
                .storeUint(OP_SWAP, 32)
                .storeAddress(askJettonWallet)
                .storeAddress(wallet)      // refund
                .storeAddress(wallet)      // excesses
                .storeUint(deadline, 64)
                .storeRef(params)
                .endCell();
    }

    /** Native side of a buy: TON wrapped by the router's pTON wallet, forwarding the swap instruction. */
    public static Cell tonTransfer(long queryId, long offerAmountRaw, TonAddress refund, Cell swapPayload) {
        return CellBuilder.beginCell()
                .storeUint(OP_PTON_TON_TRANSFER, 32)
                .storeUint(queryId, 64)
                .storeCoins(offerAmountRaw)
                .storeAddress(refund)
                .storeMaybeRef(swapPayload)
                .endCell();
    }

    /** Token side of a sell: jetton transfer to the router with the swap instruction as forward payload. */
    public static Cell jettonTransfer(long queryId, long amountRaw, TonAddress router, TonAddress responseTo,
                                      long forwardTonRaw, Cell swapPayload) {
        return CellBuilder.beginCell()
                .storeUint(OP_JETTON_TRANSFER, 32)
                .storeUint(queryId, 64)
                .storeCoins(amountRaw)
                .storeAddress(router)
                .storeAddress(responseTo)
                .storeBit(false)           // no custom payload
                .storeCoins(forwardTonRaw)
                .storeMaybeRef(swapPayload)
                .endCell();
    }
}
