package com.apex.ledger.trading.pipeline;

import com.apex.ledger.exception.MarketDataException;
import com.apex.ledger.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulated feed backed by a quote book. Prices and daily returns are pushed
 * in by the caller (a backtest loop or a test) and served back verbatim.
 */
@Service
@Slf4j
public class InMemoryMarketDataProvider implements MarketDataProvider {

    private final Map<String, BigDecimal> quotes = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<LocalDate, Double>> returns = new ConcurrentHashMap<>();

    public void updatePrice(String symbol, BigDecimal price) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        if (price == null || price.signum() <= 0) {
            throw new MarketDataException(symbol, "Quote must be positive: " + price);
        }
        quotes.put(symbol, MoneyUtils.scale(price));
        log.debug("Quote {} -> {}", symbol, price);
    }

    public void removePrice(String symbol) {
        quotes.remove(symbol);
    }

    public void putReturn(String symbol, LocalDate date, double dailyReturn) {
        NavigableMap<LocalDate, Double> series = returns.computeIfAbsent(symbol, key -> new TreeMap<>());
        synchronized (series) {
            series.put(date, dailyReturn);
        }
    }

    /**
     * Stores consecutive daily returns starting at {@code start}, one per calendar day.
     */
    public void putReturns(String symbol, LocalDate start, List<Double> series) {
        LocalDate date = start;
        for (Double value : series) {
            putReturn(symbol, date, value);
            date = date.plusDays(1);
        }
    }

    public void clear() {
        quotes.clear();
        returns.clear();
    }

    @Override
    public Optional<BigDecimal> getCurrentPrice(String symbol) {
        return Optional.ofNullable(quotes.get(symbol));
    }

    @Override
    public List<Double> getHistoricalReturns(String symbol, LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException("Invalid date range " + from + " .. " + to);
        }
        NavigableMap<LocalDate, Double> series = returns.get(symbol);
        if (series == null) {
            throw new MarketDataException(symbol, "No return history for " + symbol);
        }
        synchronized (series) {
            return new ArrayList<>(series.subMap(from, true, to, true).values());
        }
    }
}
