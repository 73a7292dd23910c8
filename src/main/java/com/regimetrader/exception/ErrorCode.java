package com.regimetrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIGURATION_ERROR("CONFIGURATION_ERROR"),
    REGIME_MODEL_MISSING("REGIME_MODEL_MISSING"),
    REGIME_MODEL_INVALID("REGIME_MODEL_INVALID"),
    UNKNOWN_POLICY("UNKNOWN_POLICY"),
    UNKNOWN_SYMBOL("UNKNOWN_SYMBOL");

    private final String code;
}
