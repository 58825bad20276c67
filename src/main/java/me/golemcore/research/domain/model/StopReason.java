package me.golemcore.research.domain.model;

/**
 * Why a conversation engine run reached its terminal state.
 */
public enum StopReason {
    FINAL_ANSWER,
    STEP_BUDGET_EXHAUSTED,
    DEADLINE_EXCEEDED,
    EMPTY_RESPONSES,
    MODEL_ERROR,
    CANCELLED;

    /**
     * Whether the engine forced termination (BudgetExceeded) rather than the
     * model finishing on its own.
     */
    public boolean isBudgetExceeded() {
        return this == STEP_BUDGET_EXHAUSTED || this == DEADLINE_EXCEEDED;
    }
}
