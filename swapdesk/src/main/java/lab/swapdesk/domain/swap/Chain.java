package lab.swapdesk.domain.swap;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum Chain {
    SOLANA("SOL", 9, "https://solscan.io/tx/"),
    TON("TON", 9, "https://tonviewer.com/transaction/");

    private final String nativeSymbol;
    private final int nativeDecimals;
    private final String explorerTxPrefix;

    Chain(String nativeSymbol, int nativeDecimals, String explorerTxPrefix) {
        this.nativeSymbol = nativeSymbol;
        this.nativeDecimals = nativeDecimals;
        this.explorerTxPrefix = explorerTxPrefix;
    }

    public String getNativeSymbol() {
        return nativeSymbol;
    }

    public int getNativeDecimals() {
        return nativeDecimals;
    }

    public String explorerUrl(String txId) {
        return txId == null ? null : explorerTxPrefix + txId;
    }

    public static Chain parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("chain is required");
        }
        try {
            return Chain.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported chain: " + value);
        }
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Enum::name).toList();
    }
}
