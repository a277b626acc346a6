package com.lexassist.planner.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReasoningBudgetTest {

    @Test
    void parsesKnownBudgetsIgnoringCase() {
        assertThat(ReasoningBudget.fromValue("quick")).isEqualTo(ReasoningBudget.QUICK);
        assertThat(ReasoningBudget.fromValue(" Standard ")).isEqualTo(ReasoningBudget.STANDARD);
        assertThat(ReasoningBudget.fromValue("DEEP")).isEqualTo(ReasoningBudget.DEEP);
    }

    @Test
    void rejectsUnknownBudget() {
        assertThatThrownBy(() -> ReasoningBudget.fromValue("turbo"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("turbo");
        assertThatThrownBy(() -> ReasoningBudget.fromValue(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
