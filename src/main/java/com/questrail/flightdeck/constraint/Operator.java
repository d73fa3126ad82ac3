package com.questrail.flightdeck.constraint;

/**
 * Comparison operators accepted when building a {@link Constraint} from an
 * attribute/operator/value triple.
 */
public enum Operator
{
    LT("<"),
    LE("<="),
    EQ("="),
    NE("!="),
    GE(">="),
    GT(">");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
