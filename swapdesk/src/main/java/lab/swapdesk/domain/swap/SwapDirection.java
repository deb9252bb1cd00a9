package lab.swapdesk.domain.swap;

import java.util.Locale;

public enum SwapDirection {
    /** Spend the chain's native asset, receive the counter token. */
    NATIVE_TO_TOKEN,
    /** Spend the counter token, receive the chain's native asset. */
    TOKEN_TO_NATIVE;

    /** Accepts the enum name or the bot's buy / sell wording. */
    public static SwapDirection parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("direction is required");
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "BUY", "NATIVE_TO_TOKEN" -> NATIVE_TO_TOKEN;
            case "SELL", "TOKEN_TO_NATIVE" -> TOKEN_TO_NATIVE;
            default -> throw new IllegalArgumentException("unsupported direction: " + value);
        };
    }
}
