package lab.swapdesk.adapter.rpc;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void backoffMs_withoutJitter_doublesPerFailedAttempt() {
        RetryPolicy policy = new RetryPolicy(100L, 0.0, 4);

        assertThat(policy.backoffMs(0)).isEqualTo(100L);
        assertThat(policy.backoffMs(1)).isEqualTo(200L);
        assertThat(policy.backoffMs(3)).isEqualTo(800L);
        assertThat(policy.backoffMs(-1)).isEqualTo(100L);
    }

    @Test
    void backoffMs_withJitter_staysWithinSpread() {
        RetryPolicy policy = new RetryPolicy(1_000L, 0.2, 3);

        for (int i = 0; i < 200; i++) {
            assertThat(policy.backoffMs(1)).isBetween(1_600L, 2_400L);
        }
    }

    @Test
    void backoffMs_manyFailures_capsDoubling() {
        RetryPolicy policy = new RetryPolicy(1L, 0.0, 3);

        assertThat(policy.backoffMs(60)).isEqualTo(1L << 20);
    }

    @Test
    void noDelay_neverPauses() {
        RetryPolicy policy = RetryPolicy.noDelay(2);

        assertThat(policy.backoffMs(5)).isZero();
        assertThat(policy.maxAttempts()).isEqualTo(2);
    }

    @Test
    void construct_invalidSettings_rejected() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 0.2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(-1L, 0.2, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(100L, 1.5, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
