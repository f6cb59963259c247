package com.cryptotrader.domain.enums;

/**
 * Outcome of a risk evaluation. Everything except {@link #NONE} is actionable and
 * is dispatched to the callbacks registered for that action.
 */
public enum RiskAction {
    NONE,
    CLOSE_POSITION,
    REDUCE_POSITION,
    BLOCK_NEW_TRADE,
    EMERGENCY_EXIT_ALL,
    PAUSE_TRADING
}
