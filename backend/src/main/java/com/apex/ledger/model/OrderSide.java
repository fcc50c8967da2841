package com.apex.ledger.model;

public enum OrderSide {
    BUY,
    SELL
}
