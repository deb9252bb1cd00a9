package lab.swapdesk.orchestration;

import lab.swapdesk.common.InvalidInputException;

import java.math.BigInteger;

/**
 * {@code floor(quoted * (10000 - slippageBps) / 10000)} in integer arithmetic.
 */
public final class MinOutputCalculator {

    public static final int MAX_SLIPPAGE_BPS = 10_000;
    private static final BigInteger BPS_SCALE = BigInteger.valueOf(MAX_SLIPPAGE_BPS);

    private MinOutputCalculator() {
    }

    public static long minOutput(long quotedOutputRaw, int slippageBps) {
        if (slippageBps < 0 || slippageBps > MAX_SLIPPAGE_BPS) {
            throw new InvalidInputException("slippageBps must be within 0..10000, got " + slippageBps);
        }
        if (quotedOutputRaw < 0) {
            throw new IllegalArgumentException("quoted output must not be negative");
        }
        return BigInteger.valueOf(quotedOutputRaw)
                .multiply(BigInteger.valueOf(MAX_SLIPPAGE_BPS - slippageBps))
                .divide(BPS_SCALE)
                .longValueExact();
    }
}
