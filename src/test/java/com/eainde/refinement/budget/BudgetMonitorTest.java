package com.eainde.refinement.budget;

import com.eainde.refinement.config.RefinementSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BudgetMonitorTest {

    private final BudgetMonitor monitor = new BudgetMonitor(
            RefinementSettings.builder().maxTokens(1_000).timeoutMs(10_000).build());

    @Test
    @DisplayName("within budget: no flags")
    void withinBudget() {
        assertThat(monitor.check(1_000, 7_999)).isEqualTo(new BudgetStatus(false, false, false));
        assertThat(monitor.hasTimeLeft(7_999)).isTrue();
    }

    @Test
    @DisplayName("token overrun is a warning and counts as near exhaustion")
    void tokenOverrun() {
        BudgetStatus status = monitor.check(1_001, 0);

        assertThat(status.tokenWarning()).isTrue();
        assertThat(status.timeExceeded()).isFalse();
        assertThat(status.nearExhaustion()).isTrue();
    }

    @Test
    @DisplayName("80% of the time budget is near exhaustion")
    void nearTimeLimit() {
        BudgetStatus status = monitor.check(0, 8_000);

        assertThat(status.nearExhaustion()).isTrue();
        assertThat(status.timeExceeded()).isFalse();
    }

    @Test
    @DisplayName("reaching the time budget exceeds it")
    void timeExceeded() {
        assertThat(monitor.check(0, 10_000).timeExceeded()).isTrue();
        assertThat(monitor.hasTimeLeft(10_000)).isFalse();
    }
}
