package com.apex.ledger.trading.pipeline;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface MarketDataProvider {

    /**
     * Latest quote for the symbol, empty when none is available.
     *
     * @throws com.apex.ledger.exception.MarketDataException if the lookup fails or times out
     */
    Optional<BigDecimal> getCurrentPrice(String symbol);

    /**
     * Daily simple returns for the inclusive date range, oldest first.
     */
    List<Double> getHistoricalReturns(String symbol, LocalDate from, LocalDate to);
}
