package com.apex.ledger.exception;

import com.apex.ledger.model.OrderStatus;

public class OrderStateException extends TradingException {

    public OrderStateException(String orderId, OrderStatus from, OrderStatus to) {
        super("Illegal order transition for " + orderId + ": " + from + " -> " + to);
    }
}
