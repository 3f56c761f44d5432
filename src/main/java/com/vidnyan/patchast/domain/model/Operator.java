package com.vidnyan.patchast.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operator tags as they appear in the syntax tree, with their source spelling.
 */
public enum Operator {
    AND("And", "and"),
    OR("Or", "or"),
    ADD("Add", "+"),
    SUB("Sub", "-"),
    MULT("Mult", "*"),
    DIV("Div", "/"),
    MOD("Mod", "%"),
    POW("Pow", "**"),
    MAT_MULT("MatMult", "@"),
    L_SHIFT("LShift", "<<"),
    R_SHIFT("RShift", ">>"),
    BIT_OR("BitOr", "|"),
    BIT_AND("BitAnd", "&"),
    BIT_XOR("BitXor", "^"),
    FLOOR_DIV("FloorDiv", "//"),
    INVERT("Invert", "~"),
    NOT("Not", "not"),
    U_ADD("UAdd", "+"),
    U_SUB("USub", "-"),
    EQ("Eq", "=="),
    NOT_EQ("NotEq", "!="),
    LT("Lt", "<"),
    LT_E("LtE", "<="),
    GT("Gt", ">"),
    GT_E("GtE", ">="),
    IS("Is", "is"),
    IS_NOT("IsNot", "is not"),
    IN("In", "in"),
    NOT_IN("NotIn", "not in");

    private static final Map<String, Operator> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Operator::tag, Function.identity()));

    private final String tag;
    private final String symbol;

    Operator(String tag, String symbol) {
        this.tag = tag;
        this.symbol = symbol;
    }

    public String tag() {
        return tag;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Source tokens of this operator; {@code is not} and {@code not in} are two tokens.
     */
    public List<String> tokens() {
        return List.of(symbol.split(" "));
    }

    public static Operator fromTag(String tag) {
        Operator operator = BY_TAG.get(tag);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown operator <" + tag + ">");
        }
        return operator;
    }
}
