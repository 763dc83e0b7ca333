package org.snapeval.compiler.expr;

/**
 * The operators of a binary expression, grouped by how they are compiled.
 */
public enum BinaryOperator {
    ADD("+", Category.ARITHMETIC),
    SUB("-", Category.ARITHMETIC),
    MUL("*", Category.ARITHMETIC),
    DIV("/", Category.ARITHMETIC),
    MOD("%", Category.ARITHMETIC),

    EQ("==", Category.RELATIONAL),
    NE("!=", Category.RELATIONAL),
    LT("<", Category.RELATIONAL),
    LE("<=", Category.RELATIONAL),
    GT(">", Category.RELATIONAL),
    GE(">=", Category.RELATIONAL),

    CONDITIONAL_AND("&&", Category.BOOLEAN_CONDITIONAL),
    CONDITIONAL_OR("||", Category.BOOLEAN_CONDITIONAL),

    BITWISE_AND("&", Category.LOGICAL),
    BITWISE_OR("|", Category.LOGICAL),
    BITWISE_XOR("^", Category.LOGICAL),

    SHL("<<", Category.SHIFT),
    SHR_SIGNED(">>", Category.SHIFT),
    SHR_UNSIGNED(">>>", Category.SHIFT);

    /**
     * How an operator is type-checked.
     */
    public enum Category {
        ARITHMETIC,
        RELATIONAL,
        BOOLEAN_CONDITIONAL,
        LOGICAL,
        SHIFT
    }

    private final String symbol;
    private final Category category;

    BinaryOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String getSymbol() {
        return symbol;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * @return {@code true} for the ordering operators {@code <, <=, >, >=}.
     */
    public boolean isOrdering() {
        return this == LT || this == LE || this == GT || this == GE;
    }
}
