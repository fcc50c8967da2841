package com.apex.ledger.model;

import com.apex.ledger.util.MoneyUtils;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Long-only holding. {@code costBasis} is the exact cash paid (value plus
 * commission) for the shares still held; {@code averageCost} is its per-share
 * rounding and is reset to zero whenever the quantity reaches zero.
 */
@Value
@Builder(toBuilder = true)
public class PaperPosition {

    String symbol;
    int quantity;
    BigDecimal averageCost;
    BigDecimal costBasis;
    BigDecimal currentPrice;
    BigDecimal marketValue;
    BigDecimal unrealizedPnl;
    LocalDateTime updatedAt;

    public static PaperPosition empty(String symbol, LocalDateTime now) {
        return PaperPosition.builder()
                .symbol(symbol)
                .quantity(0)
                .averageCost(MoneyUtils.ZERO)
                .costBasis(MoneyUtils.ZERO)
                .currentPrice(MoneyUtils.ZERO)
                .marketValue(MoneyUtils.ZERO)
                .unrealizedPnl(MoneyUtils.ZERO)
                .updatedAt(now)
                .build();
    }

    public boolean isFlat() {
        return quantity == 0;
    }

    public PaperPosition markedAt(BigDecimal price, LocalDateTime at) {
        BigDecimal value = MoneyUtils.multiply(price, quantity);
        return toBuilder()
                .currentPrice(MoneyUtils.scale(price))
                .marketValue(value)
                .unrealizedPnl(isFlat() ? MoneyUtils.ZERO : MoneyUtils.subtract(value, costBasis))
                .updatedAt(at)
                .build();
    }
}
