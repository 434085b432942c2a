package org.axioms.core;

/**
 * 量词种类。
 */
public enum QuantifierKind {

    FORALL("∀"),
    EXISTS("∃");

    private final String symbol;

    QuantifierKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
