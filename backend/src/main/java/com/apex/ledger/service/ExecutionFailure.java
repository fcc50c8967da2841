package com.apex.ledger.service;

public enum ExecutionFailure {
    INVALID_ORDER,
    ORDER_NOT_OPEN,
    PRICE_UNAVAILABLE,
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_POSITION
}
