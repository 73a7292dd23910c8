package com.regimetrader.risk;

public enum AlertType {
    POSITION_SIZE,
    DAILY_LOSS,
    CONSECUTIVE_LOSSES,
    DRAWDOWN,
    CORRELATION,
    VOLATILITY,
    CONCENTRATION,
    INVALID_SIGNAL
}
