package com.apex.ledger.exception;

/**
 * Raised by a market data provider when a quote or series cannot be served,
 * including lookups abandoned on timeout.
 */
public class MarketDataException extends TradingException {

    private final String symbol;

    public MarketDataException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public MarketDataException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
