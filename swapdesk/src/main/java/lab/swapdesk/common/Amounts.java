package lab.swapdesk.common;

import java.math.BigDecimal;

/**
 * Exact conversion between human units and on-chain smallest units.
 * All pipeline arithmetic happens on the raw {@code long}; decimals only appear at the API boundary.
 */
public final class Amounts {

    public static final int NATIVE_DECIMALS = 9;

    private Amounts() {
    }

    public static long toSmallestUnit(BigDecimal amount, int decimals) {
        if (amount == null) {
            throw new InvalidInputException("amount is required");
        }
        try {
            return amount.movePointRight(decimals).toBigIntegerExact().longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidInputException(
                    "invalid amount %s: at most %d fractional digits allowed".formatted(amount.toPlainString(), decimals));
        }
    }

    public static BigDecimal toHumanUnit(long raw, int decimals) {
        return BigDecimal.valueOf(raw, decimals);
    }

    public static String format(long raw, int decimals) {
        BigDecimal human = toHumanUnit(raw, decimals).stripTrailingZeros();
        return human.signum() == 0 ? "0" : human.toPlainString();
    }
}
