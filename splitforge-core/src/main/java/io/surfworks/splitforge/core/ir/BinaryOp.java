package io.surfworks.splitforge.core.ir;

/**
 * Binary operators of the expression language.
 */
public enum BinaryOp {
    ADD("+", Category.ARITHMETIC),
    SUB("-", Category.ARITHMETIC),
    MUL("*", Category.ARITHMETIC),
    DIV("/", Category.ARITHMETIC),
    MOD("%", Category.ARITHMETIC),
    MIN("min", Category.ARITHMETIC),
    MAX("max", Category.ARITHMETIC),
    EQ("==", Category.COMPARISON),
    NE("!=", Category.COMPARISON),
    LT("<", Category.COMPARISON),
    LE("<=", Category.COMPARISON),
    GT(">", Category.COMPARISON),
    GE(">=", Category.COMPARISON),
    AND("&&", Category.LOGICAL),
    OR("||", Category.LOGICAL);

    enum Category { ARITHMETIC, COMPARISON, LOGICAL }

    private final String symbol;
    private final Category category;

    BinaryOp(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * True for operators printed as a function call rather than infix.
     */
    public boolean isFunctionStyle() {
        return this == MIN || this == MAX;
    }

    /**
     * True if the result is boolean regardless of operand type.
     */
    public boolean yieldsBool() {
        return category != Category.ARITHMETIC;
    }
}
