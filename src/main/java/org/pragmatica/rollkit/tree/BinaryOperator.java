package org.pragmatica.rollkit.tree;

/**
 * Binary operators of the dice language, with their symbol, description and binding power.
 */
public enum BinaryOperator {
    DICE_ROLL("d", "Dice Roll", 150, Associativity.RIGHT),
    KEEP_HIGHEST("kh", "Keep Highest", 130, Associativity.LEFT),
    KEEP_LOWEST("kl", "Keep Lowest", 130, Associativity.LEFT),
    DROP_HIGHEST("dh", "Drop Highest", 130, Associativity.LEFT),
    DROP_LOWEST("dl", "Drop Lowest", 130, Associativity.LEFT),
    MULTIPLICATION("*", "Multiplication", 90, Associativity.LEFT),
    ADDITION("+", "Addition", 70, Associativity.LEFT),
    SUBTRACTION("-", "Subtraction", 70, Associativity.LEFT),
    EQUAL("==", "Equal", 50, Associativity.LEFT),
    NOT_EQUAL("!=", "Not Equal", 50, Associativity.LEFT),
    LESS_THAN("<", "Less Than", 50, Associativity.LEFT),
    LESS_EQUAL("<=", "Less or Equal", 50, Associativity.LEFT),
    GREATER_THAN(">", "Greater Than", 50, Associativity.LEFT),
    GREATER_EQUAL(">=", "Greater or Equal", 50, Associativity.LEFT);

    public enum Associativity {
        LEFT,
        RIGHT
    }

    private final String symbol;
    private final String description;
    private final int precedence;
    private final Associativity associativity;

    BinaryOperator(String symbol, String description, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.description = description;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public String symbol() {
        return symbol;
    }

    public String description() {
        return description;
    }

    /**
     * Higher binds tighter.
     */
    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    public boolean isKeepDrop() {
        return this == KEEP_HIGHEST || this == KEEP_LOWEST || this == DROP_HIGHEST || this == DROP_LOWEST;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
