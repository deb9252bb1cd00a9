package lab.swapdesk.orchestration;

import lab.swapdesk.common.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MinOutputCalculatorTest {

    @Test
    void minOutput_floorsAfterApplyingSlippage() {
        assertThat(MinOutputCalculator.minOutput(1_000_000L, 500)).isEqualTo(950_000L);
        assertThat(MinOutputCalculator.minOutput(999L, 1)).isEqualTo(998L);
        assertThat(MinOutputCalculator.minOutput(1_000L, 0)).isEqualTo(1_000L);
        assertThat(MinOutputCalculator.minOutput(1_000L, 10_000)).isZero();
    }

    @Test
    void minOutput_doesNotOverflowOnLargeQuotes() {
        assertThat(MinOutputCalculator.minOutput(Long.MAX_VALUE, 100))
                .isEqualTo(9_131_138_316_486_228_048L);
    }

    @Test
    void minOutput_rejectsSlippageOutsideRange() {
        assertThatThrownBy(() -> MinOutputCalculator.minOutput(1_000L, -1)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> MinOutputCalculator.minOutput(1_000L, 10_001)).isInstanceOf(InvalidInputException.class);
    }
}
