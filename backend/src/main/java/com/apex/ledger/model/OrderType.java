package com.apex.ledger.model;

public enum OrderType {
    MARKET,
    LIMIT
}
