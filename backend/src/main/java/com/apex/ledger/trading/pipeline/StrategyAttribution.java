package com.apex.ledger.trading.pipeline;

import com.apex.ledger.model.OrderSide;
import com.apex.ledger.service.ExecutionResult;
import com.apex.ledger.util.MoneyUtils;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Running totals for one strategy tag within an account.
 */
@Value
@Builder(toBuilder = true)
public class StrategyAttribution {

    String strategy;

    @Builder.Default
    int fills = 0;

    @Builder.Default
    int buys = 0;

    @Builder.Default
    int sells = 0;

    @Builder.Default
    int riskRejections = 0;

    @Builder.Default
    BigDecimal tradedValue = MoneyUtils.ZERO;

    @Builder.Default
    BigDecimal commission = MoneyUtils.ZERO;

    @Builder.Default
    BigDecimal realizedPnl = MoneyUtils.ZERO;

    public static StrategyAttribution empty(String strategy) {
        return StrategyAttribution.builder().strategy(strategy).build();
    }

    public StrategyAttribution withFill(ExecutionResult result) {
        boolean buy = result.order().getSide() == OrderSide.BUY;
        return toBuilder()
                .fills(fills + 1)
                .buys(buy ? buys + 1 : buys)
                .sells(buy ? sells : sells + 1)
                .tradedValue(MoneyUtils.add(tradedValue, result.tradeValue()))
                .commission(MoneyUtils.add(commission, result.commission()))
                .realizedPnl(MoneyUtils.add(realizedPnl, result.realizedPnl()))
                .build();
    }

    public StrategyAttribution withRiskRejection() {
        return toBuilder().riskRejections(riskRejections + 1).build();
    }
}
