package com.apex.ledger.service.analytics;

import com.apex.ledger.exception.RiskComputationException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.List;

/**
 * Square matrix labelled by symbol, used for both covariance and correlation.
 * The backing matrix is copied in and out, so instances are immutable.
 */
public final class CovarianceMatrix {

    private final List<String> symbols;
    private final RealMatrix matrix;

    public CovarianceMatrix(List<String> symbols, RealMatrix matrix) {
        if (symbols.size() != matrix.getRowDimension() || !matrix.isSquare()) {
            throw new RiskComputationException(RiskComputationException.Reason.INVALID_INPUT,
                    "Matrix must be square with one row per symbol");
        }
        this.symbols = List.copyOf(symbols);
        this.matrix = matrix.copy();
    }

    public static CovarianceMatrix of(List<String> symbols, double[][] values) {
        return new CovarianceMatrix(symbols, MatrixUtils.createRealMatrix(values));
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public int indexOf(String symbol) {
        return symbols.indexOf(symbol);
    }

    public double get(String row, String column) {
        int i = indexOf(row);
        int j = indexOf(column);
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("Unknown symbol " + (i < 0 ? row : column));
        }
        return matrix.getEntry(i, j);
    }

    public RealMatrix toRealMatrix() {
        return matrix.copy();
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public String toString() {
        return "CovarianceMatrix" + symbols;
    }
}
