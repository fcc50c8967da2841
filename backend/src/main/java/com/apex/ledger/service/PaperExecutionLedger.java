package com.apex.ledger.service;

import com.apex.ledger.exception.MarketDataException;
import com.apex.ledger.model.AccountSnapshot;
import com.apex.ledger.model.OrderSide;
import com.apex.ledger.model.OrderStatus;
import com.apex.ledger.model.OrderType;
import com.apex.ledger.model.PaperOrder;
import com.apex.ledger.model.PaperPosition;
import com.apex.ledger.model.TradeRecord;
import com.apex.ledger.model.TradeSignal;
import com.apex.ledger.trading.pipeline.MarketDataProvider;
import com.apex.ledger.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory cash and position book for one simulated account.
 *
 * <p>Every mutation runs under a single lock and ends by publishing an immutable
 * view of the account and its positions, so {@link #getAccountInfo()} and
 * {@link #getPositions()} never observe a half-applied fill.
 */
@Slf4j
public class PaperExecutionLedger {

    private final String accountId;
    private final MarketDataProvider marketDataProvider;
    private final CommissionModel commissionModel;
    private final Clock clock;
    private final int tradeHistoryLimit;
    private final ReentrantLock lock = new ReentrantLock();

    private BigDecimal initialBalance;
    private BigDecimal cash;
    private BigDecimal realizedPnl = MoneyUtils.ZERO;
    private final Map<String, PaperPosition> positions = new LinkedHashMap<>();
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();
    private final Deque<TradeRecord> tradeHistory = new ArrayDeque<>();
    private BigDecimal totalBought = MoneyUtils.ZERO;
    private BigDecimal totalSold = MoneyUtils.ZERO;
    private BigDecimal totalCommission = MoneyUtils.ZERO;
    private int tradeCount;
    private int sellCount;
    private int winningSells;
    private long tradeSequence;

    private volatile LedgerView view;

    public PaperExecutionLedger(String accountId,
                                BigDecimal initialBalance,
                                MarketDataProvider marketDataProvider,
                                CommissionModel commissionModel,
                                Clock clock,
                                int tradeHistoryLimit) {
        if (!MoneyUtils.isPositive(initialBalance)) {
            throw new IllegalArgumentException("Initial balance must be positive");
        }
        if (tradeHistoryLimit < 1) {
            throw new IllegalArgumentException("Trade history limit must be at least 1");
        }
        this.accountId = accountId;
        this.marketDataProvider = marketDataProvider;
        this.commissionModel = commissionModel;
        this.clock = clock;
        this.tradeHistoryLimit = tradeHistoryLimit;
        this.initialBalance = MoneyUtils.scale(initialBalance);
        this.cash = this.initialBalance;
        publish();
        log.info("Paper account {} opened with {}", accountId, MoneyUtils.format(this.initialBalance));
    }

    public String getAccountId() {
        return accountId;
    }

    /**
     * Derives a submitted order from a signal and registers it. Signals without a
     * price become market orders.
     */
    public PaperOrder createOrder(TradeSignal signal) {
        lock.lock();
        try {
            PaperOrder order = PaperOrder.fromSignal(signal, now());
            PaperOrder existing = orders.get(order.getOrderId());
            if (existing != null) {
                log.info("Signal {} already has order {} ({})", signal.getSignalId(), existing.getOrderId(), existing.getStatus());
                return existing;
            }
            orders.put(order.getOrderId(), order);
            log.debug("Created order {} {} {} x{}", order.getOrderId(), order.getOrderType(), order.getSymbol(), order.getQuantity());
            return order;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fills a submitted order in full or rejects it. Price resolution, commission,
     * cash and position updates and the trade record are applied together or not at all.
     * After a fill every other open position is marked to its current quote, so the
     * published equity reflects current prices.
     */
    public ExecutionResult execute(PaperOrder order) {
        if (order == null || order.getSymbol() == null || order.getSide() == null || order.getQuantity() <= 0) {
            return ExecutionResult.failed(ExecutionFailure.INVALID_ORDER, "Order is missing symbol, side or a positive quantity", order);
        }
        lock.lock();
        try {
            PaperOrder current = orders.getOrDefault(order.getOrderId(), order);
            if (current.getStatus() != OrderStatus.SUBMITTED) {
                return ExecutionResult.failed(ExecutionFailure.ORDER_NOT_OPEN,
                        "Order " + current.getOrderId() + " is already " + current.getStatus(), current);
            }
            orders.put(current.getOrderId(), current);

            Optional<BigDecimal> resolved = resolveFillPrice(current);
            if (resolved.isEmpty()) {
                return reject(current, ExecutionFailure.PRICE_UNAVAILABLE, "No market price for " + current.getSymbol());
            }
            BigDecimal fillPrice = MoneyUtils.scale(resolved.get());
            BigDecimal tradeValue = MoneyUtils.multiply(fillPrice, current.getQuantity());
            BigDecimal commission = commissionModel.commissionFor(tradeValue);

            return current.getSide() == OrderSide.BUY
                    ? applyBuy(current, fillPrice, tradeValue, commission)
                    : applySell(current, fillPrice, tradeValue, commission);
        } finally {
            lock.unlock();
        }
    }

    public boolean cancelOrder(String orderId) {
        lock.lock();
        try {
            PaperOrder order = orders.get(orderId);
            if (order == null || order.getStatus() != OrderStatus.SUBMITTED) {
                log.info("Cancel ignored for {}: {}", orderId, order == null ? "unknown order" : order.getStatus());
                return false;
            }
            orders.put(orderId, order.cancelled(now()));
            log.info("Cancelled order {}", orderId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int cancelAllOrders() {
        lock.lock();
        try {
            LocalDateTime at = now();
            int cancelled = 0;
            for (Map.Entry<String, PaperOrder> entry : orders.entrySet()) {
                if (entry.getValue().getStatus() == OrderStatus.SUBMITTED) {
                    entry.setValue(entry.getValue().cancelled(at));
                    cancelled++;
                }
            }
            log.info("Cancelled {} open orders on {}", cancelled, accountId);
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks every open position to the provider's current quote. Symbols without
     * a quote keep their last known price.
     */
    public AccountSnapshot refreshMarketPrices() {
        Map<String, BigDecimal> quotes = new LinkedHashMap<>();
        for (PaperPosition position : view.positions()) {
            try {
                marketDataProvider.getCurrentPrice(position.getSymbol())
                        .ifPresent(price -> quotes.put(position.getSymbol(), price));
            } catch (MarketDataException e) {
                log.warn("Quote unavailable for {}, keeping last price: {}", position.getSymbol(), e.getMessage());
            }
        }
        lock.lock();
        try {
            LocalDateTime at = now();
            quotes.forEach((symbol, price) -> positions.computeIfPresent(symbol, (key, position) -> position.markedAt(price, at)));
            publish();
            return view.account();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears positions, orders, history and totals and starts over with {@code newBalance} in cash.
     */
    public void resetAccount(BigDecimal newBalance) {
        if (!MoneyUtils.isPositive(newBalance)) {
            throw new IllegalArgumentException("Balance must be positive");
        }
        lock.lock();
        try {
            initialBalance = MoneyUtils.scale(newBalance);
            cash = initialBalance;
            realizedPnl = MoneyUtils.ZERO;
            positions.clear();
            orders.clear();
            tradeHistory.clear();
            totalBought = MoneyUtils.ZERO;
            totalSold = MoneyUtils.ZERO;
            totalCommission = MoneyUtils.ZERO;
            tradeCount = 0;
            sellCount = 0;
            winningSells = 0;
            publish();
            log.info("Paper account {} reset to {}", accountId, MoneyUtils.format(initialBalance));
        } finally {
            lock.unlock();
        }
    }

    public AccountSnapshot getAccountInfo() {
        return view.account();
    }

    public List<PaperPosition> getPositions() {
        return view.positions();
    }

    public Optional<PaperPosition> getPosition(String symbol) {
        return view.positions().stream()
                .filter(position -> position.getSymbol().equals(symbol))
                .findFirst();
    }

    /**
     * @param status filter, or null for every order
     */
    public List<PaperOrder> getOrders(OrderStatus status) {
        lock.lock();
        try {
            return orders.values().stream()
                    .filter(order -> status == null || order.getStatus() == status)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public Optional<PaperOrder> getOrder(String orderId) {
        lock.lock();
        try {
            return Optional.ofNullable(orders.get(orderId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Most recent fills, oldest first.
     */
    public List<TradeRecord> getTradeHistory() {
        lock.lock();
        try {
            return List.copyOf(tradeHistory);
        } finally {
            lock.unlock();
        }
    }

    public LedgerPerformance getPerformance() {
        lock.lock();
        try {
            AccountSnapshot account = view.account();
            BigDecimal totalReturn = MoneyUtils.subtract(account.getEquity(), initialBalance);
            return LedgerPerformance.builder()
                    .accountId(accountId)
                    .initialBalance(initialBalance)
                    .cash(cash)
                    .marketValue(account.getMarketValue())
                    .equity(account.getEquity())
                    .totalReturn(totalReturn)
                    .returnRate(MoneyUtils.ratio(totalReturn, initialBalance))
                    .realizedPnl(realizedPnl)
                    .unrealizedPnl(account.getUnrealizedPnl())
                    .tradeCount(tradeCount)
                    .sellCount(sellCount)
                    .winningSells(winningSells)
                    .winRate(MoneyUtils.ratio(BigDecimal.valueOf(winningSells), BigDecimal.valueOf(sellCount)))
                    .totalBought(totalBought)
                    .totalSold(totalSold)
                    .totalCommission(totalCommission)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private Optional<BigDecimal> resolveFillPrice(PaperOrder order) {
        if (order.getOrderType() == OrderType.LIMIT) {
            return Optional.ofNullable(order.getLimitPrice()).filter(MoneyUtils::isPositive);
        }
        try {
            return marketDataProvider.getCurrentPrice(order.getSymbol()).filter(MoneyUtils::isPositive);
        } catch (MarketDataException e) {
            log.warn("Market data lookup failed for {}: {}", order.getSymbol(), e.getMessage());
            return Optional.empty();
        }
    }

    private ExecutionResult applyBuy(PaperOrder order, BigDecimal fillPrice, BigDecimal tradeValue, BigDecimal commission) {
        BigDecimal required = MoneyUtils.add(tradeValue, commission);
        if (cash.compareTo(required) < 0) {
            return reject(order, ExecutionFailure.INSUFFICIENT_FUNDS,
                    String.format("Insufficient funds: required %s, available %s",
                            MoneyUtils.format(required), MoneyUtils.format(cash)));
        }
        LocalDateTime at = now();
        PaperPosition held = positions.getOrDefault(order.getSymbol(), PaperPosition.empty(order.getSymbol(), at));
        int newQuantity = held.getQuantity() + order.getQuantity();
        BigDecimal costBasis = MoneyUtils.add(held.getCostBasis(), required);
        PaperPosition updated = held.toBuilder()
                .quantity(newQuantity)
                .costBasis(costBasis)
                .averageCost(MoneyUtils.divide(costBasis, newQuantity))
                .build()
                .markedAt(fillPrice, at);

        cash = MoneyUtils.subtract(cash, required);
        totalBought = MoneyUtils.add(totalBought, tradeValue);
        positions.put(order.getSymbol(), updated);
        return complete(order, fillPrice, tradeValue, commission, MoneyUtils.ZERO, updated, at);
    }

    private ExecutionResult applySell(PaperOrder order, BigDecimal fillPrice, BigDecimal tradeValue, BigDecimal commission) {
        PaperPosition held = positions.get(order.getSymbol());
        int heldQuantity = held == null ? 0 : held.getQuantity();
        if (order.getQuantity() > heldQuantity) {
            return reject(order, ExecutionFailure.INSUFFICIENT_POSITION,
                    String.format("Insufficient position in %s: held %d, sell %d",
                            order.getSymbol(), heldQuantity, order.getQuantity()));
        }
        LocalDateTime at = now();
        BigDecimal pnl = MoneyUtils.multiply(MoneyUtils.subtract(fillPrice, held.getAverageCost()), order.getQuantity());
        int newQuantity = heldQuantity - order.getQuantity();
        PaperPosition updated;
        if (newQuantity == 0) {
            updated = held.toBuilder()
                    .quantity(0)
                    .costBasis(MoneyUtils.ZERO)
                    .averageCost(MoneyUtils.ZERO)
                    .build()
                    .markedAt(fillPrice, at);
            positions.remove(order.getSymbol());
        } else {
            BigDecimal releasedCost = MoneyUtils.scale(held.getCostBasis()
                    .multiply(BigDecimal.valueOf(order.getQuantity()))
                    .divide(BigDecimal.valueOf(heldQuantity), MoneyUtils.SCALE, MoneyUtils.ROUNDING));
            updated = held.toBuilder()
                    .quantity(newQuantity)
                    .costBasis(MoneyUtils.subtract(held.getCostBasis(), releasedCost))
                    .build()
                    .markedAt(fillPrice, at);
            positions.put(order.getSymbol(), updated);
        }

        cash = MoneyUtils.add(cash, MoneyUtils.subtract(tradeValue, commission));
        totalSold = MoneyUtils.add(totalSold, tradeValue);
        realizedPnl = MoneyUtils.add(realizedPnl, pnl);
        sellCount++;
        if (pnl.signum() > 0) {
            winningSells++;
        }
        return complete(order, fillPrice, tradeValue, commission, pnl, updated, at);
    }

    private ExecutionResult complete(PaperOrder order, BigDecimal fillPrice, BigDecimal tradeValue, BigDecimal commission,
                                     BigDecimal pnl, PaperPosition position, LocalDateTime at) {
        PaperOrder filled = order.filled(fillPrice, commission, at);
        orders.put(filled.getOrderId(), filled);
        totalCommission = MoneyUtils.add(totalCommission, commission);
        tradeCount++;

        tradeHistory.addLast(TradeRecord.builder()
                .tradeId(accountId + "-T" + (++tradeSequence))
                .orderId(filled.getOrderId())
                .signalId(filled.getSignalId())
                .symbol(filled.getSymbol())
                .side(filled.getSide())
                .quantity(filled.getFilledQuantity())
                .price(fillPrice)
                .tradeValue(tradeValue)
                .commission(commission)
                .realizedPnl(pnl)
                .strategy(filled.getStrategy())
                .executedAt(at)
                .build());
        while (tradeHistory.size() > tradeHistoryLimit) {
            tradeHistory.removeFirst();
        }

        markOtherPositions(filled.getSymbol(), at);
        publish();
        log.info("Filled {} {} {} x{} @ {} (value {}, commission {}, pnl {}); cash {}",
                filled.getOrderId(), filled.getSide(), filled.getSymbol(), filled.getFilledQuantity(),
                fillPrice, MoneyUtils.format(tradeValue), MoneyUtils.format(commission),
                MoneyUtils.format(pnl), MoneyUtils.format(cash));
        return ExecutionResult.filled(filled, tradeValue, pnl, position);
    }

    // The traded symbol keeps its fill price; every other holding moves to its current quote
    private void markOtherPositions(String tradedSymbol, LocalDateTime at) {
        for (Map.Entry<String, PaperPosition> entry : positions.entrySet()) {
            if (entry.getKey().equals(tradedSymbol)) {
                continue;
            }
            try {
                Optional<BigDecimal> quote = marketDataProvider.getCurrentPrice(entry.getKey()).filter(MoneyUtils::isPositive);
                if (quote.isPresent()) {
                    entry.setValue(entry.getValue().markedAt(quote.get(), at));
                } else {
                    log.warn("No quote for {}, keeping last price {}", entry.getKey(), entry.getValue().getCurrentPrice());
                }
            } catch (MarketDataException e) {
                log.warn("Quote unavailable for {}, keeping last price: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    private ExecutionResult reject(PaperOrder order, ExecutionFailure failure, String message) {
        PaperOrder rejected = order.rejected(message, now());
        orders.put(rejected.getOrderId(), rejected);
        log.info("Order {} rejected by ledger [{}]: {}", order.getOrderId(), failure, message);
        return ExecutionResult.failed(failure, message, rejected);
    }

    private void publish() {
        BigDecimal marketValue = MoneyUtils.ZERO;
        BigDecimal unrealized = MoneyUtils.ZERO;
        for (PaperPosition position : positions.values()) {
            marketValue = MoneyUtils.add(marketValue, position.getMarketValue());
            unrealized = MoneyUtils.add(unrealized, position.getUnrealizedPnl());
        }
        AccountSnapshot account = AccountSnapshot.builder()
                .accountId(accountId)
                .cash(cash)
                .marketValue(marketValue)
                .equity(MoneyUtils.add(cash, marketValue))
                .buyingPower(cash)
                .realizedPnl(realizedPnl)
                .unrealizedPnl(unrealized)
                .updatedAt(now())
                .build();
        view = new LedgerView(account, List.copyOf(positions.values()));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private record LedgerView(AccountSnapshot account, List<PaperPosition> positions) {}
}
