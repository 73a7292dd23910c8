package com.regimetrader.router;

import java.util.List;

/**
 * Names of the contextual features the router understands. Any feature absent from a
 * context is read as 0.
 */
public final class FeatureKeys {

    public static final String SIGMA_HAR = "sigma_har";
    public static final String SIGMA_GARCH = "sigma_garch";
    public static final String VOL_RATIO = "vol_ratio";
    public static final String ORDER_BOOK_IMBALANCE = "obi";
    public static final String TRADE_IMBALANCE = "ti";
    public static final String SPREAD_BPS = "spread_bps";
    public static final String MICRO_VOL = "micro_vol";
    public static final String RISK_REVERSAL_25 = "rr25";
    public static final String BUTTERFLY_25 = "fly25";
    public static final String IV_TERM_SLOPE = "iv_term_slope";
    public static final String SKEW_Z = "skew_z";
    public static final String FUNDING_RATE = "funding_rate";
    public static final String SENTIMENT_SCORE = "sentiment_score";
    public static final String WHALE_ACTIVITY = "whale_activity";

    /** Prefix of the regime probability features: regime_0 .. regime_{n-1}. */
    public static final String REGIME_PREFIX = "regime_";

    /** Market features in weight-vector order. Regime probabilities follow them. */
    public static final List<String> MARKET_FEATURES = List.of(
            SIGMA_HAR,
            SIGMA_GARCH,
            VOL_RATIO,
            ORDER_BOOK_IMBALANCE,
            TRADE_IMBALANCE,
            SPREAD_BPS,
            MICRO_VOL,
            RISK_REVERSAL_25,
            BUTTERFLY_25,
            IV_TERM_SLOPE,
            SKEW_Z,
            FUNDING_RATE,
            SENTIMENT_SCORE,
            WHALE_ACTIVITY);

    private FeatureKeys() {}

    public static String regime(int regimeId) {
        return REGIME_PREFIX + regimeId;
    }
}
