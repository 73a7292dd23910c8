package com.regimetrader.execution;

/**
 * Order style requested upstream. Informational: the routing table decides the final style.
 */
public enum RequestedOrderType {
    MARKET,
    LIMIT
}
