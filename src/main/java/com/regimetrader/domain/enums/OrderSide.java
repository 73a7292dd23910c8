package com.regimetrader.domain.enums;

public enum OrderSide {
    BUY,
    SELL
}
