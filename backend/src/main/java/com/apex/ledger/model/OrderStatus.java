package com.apex.ledger.model;

/**
 * Order lifecycle: an order is created SUBMITTED and moves once to a terminal state.
 */
public enum OrderStatus {
    SUBMITTED,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
            case SUBMITTED -> false;
            case FILLED, REJECTED, CANCELLED -> true;
        };
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case SUBMITTED -> target != SUBMITTED;
            case FILLED, REJECTED, CANCELLED -> false;
        };
    }
}
