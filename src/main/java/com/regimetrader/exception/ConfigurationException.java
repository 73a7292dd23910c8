package com.regimetrader.exception;

import java.util.Map;

/**
 * Raised when the pipeline is wired incorrectly: a missing or malformed regime model,
 * a policy id the router has never heard of, a symbol with no registered pipeline.
 *
 * <p>This is the only exception the decision path throws. Market conditions (bad ticks,
 * singular covariances, risk breaches) are always absorbed into conservative results.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ConfigurationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public ConfigurationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ConfigurationException regimeModelMissing(String location) {
        return new ConfigurationException(
                ErrorCode.REGIME_MODEL_MISSING,
                "Regime model not found: " + location,
                Map.of("location", String.valueOf(location)));
    }

    public static ConfigurationException regimeModelInvalid(String reason) {
        return new ConfigurationException(ErrorCode.REGIME_MODEL_INVALID, "Invalid regime model: " + reason);
    }

    public static ConfigurationException unknownPolicy(String policyId) {
        return new ConfigurationException(
                ErrorCode.UNKNOWN_POLICY,
                "Unknown policy id: " + policyId,
                Map.of("policyId", String.valueOf(policyId)));
    }

    public static ConfigurationException unknownSymbol(String symbol) {
        return new ConfigurationException(
                ErrorCode.UNKNOWN_SYMBOL,
                "No pipeline registered for symbol: " + symbol,
                Map.of("symbol", String.valueOf(symbol)));
    }
}
