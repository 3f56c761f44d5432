package com.vidnyan.patchast.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of syntax node kinds understood by the patcher.
 * Each kind declares the Python type name it is read from, its fields in
 * declaration order and whether it is a statement.
 */
public enum NodeKind {

    // Roots
    MODULE("Module", false, "body", "type_ignores"),
    EXPRESSION("Expression", false, "body"),

    // Statements
    FUNCTION_DEF("FunctionDef", true, "name", "args", "body", "decorator_list", "returns", "type_comment"),
    ASYNC_FUNCTION_DEF("AsyncFunctionDef", true, "name", "args", "body", "decorator_list", "returns", "type_comment"),
    CLASS_DEF("ClassDef", true, "name", "bases", "keywords", "body", "decorator_list"),
    RETURN("Return", true, "value"),
    DELETE("Delete", true, "targets"),
    ASSIGN("Assign", true, "targets", "value", "type_comment"),
    AUG_ASSIGN("AugAssign", true, "target", "op", "value"),
    ANN_ASSIGN("AnnAssign", true, "target", "annotation", "value", "simple"),
    FOR("For", true, "target", "iter", "body", "orelse", "type_comment"),
    ASYNC_FOR("AsyncFor", true, "target", "iter", "body", "orelse", "type_comment"),
    WHILE("While", true, "test", "body", "orelse"),
    IF("If", true, "test", "body", "orelse"),
    WITH("With", true, "items", "body", "type_comment"),
    ASYNC_WITH("AsyncWith", true, "items", "body", "type_comment"),
    MATCH("Match", true, "subject", "cases"),
    RAISE("Raise", true, "exc", "cause"),
    TRY("Try", true, "body", "handlers", "orelse", "finalbody"),
    TRY_STAR("TryStar", true, "body", "handlers", "orelse", "finalbody"),
    ASSERT("Assert", true, "test", "msg"),
    IMPORT("Import", true, "names"),
    IMPORT_FROM("ImportFrom", true, "module", "names", "level"),
    GLOBAL("Global", true, "names"),
    NONLOCAL("Nonlocal", true, "names"),
    EXPR("Expr", true, "value"),
    PASS("Pass", true),
    BREAK("Break", true),
    CONTINUE("Continue", true),

    // Legacy statements
    EXEC("Exec", true, "body", "globals", "locals"),
    PRINT("Print", true, "dest", "values", "nl"),
    TRY_EXCEPT("TryExcept", true, "body", "handlers", "orelse"),
    TRY_FINALLY("TryFinally", true, "body", "finalbody"),

    // Expressions
    BOOL_OP("BoolOp", false, "op", "values"),
    NAMED_EXPR("NamedExpr", false, "target", "value"),
    BIN_OP("BinOp", false, "left", "op", "right"),
    UNARY_OP("UnaryOp", false, "op", "operand"),
    LAMBDA("Lambda", false, "args", "body"),
    IF_EXP("IfExp", false, "test", "body", "orelse"),
    DICT("Dict", false, "keys", "values"),
    SET("Set", false, "elts"),
    LIST_COMP("ListComp", false, "elt", "generators"),
    SET_COMP("SetComp", false, "elt", "generators"),
    DICT_COMP("DictComp", false, "key", "value", "generators"),
    GENERATOR_EXP("GeneratorExp", false, "elt", "generators"),
    AWAIT("Await", false, "value"),
    YIELD("Yield", false, "value"),
    YIELD_FROM("YieldFrom", false, "value"),
    COMPARE("Compare", false, "left", "ops", "comparators"),
    CALL("Call", false, "func", "args", "keywords"),
    FORMATTED_VALUE("FormattedValue", false, "value", "conversion", "format_spec"),
    JOINED_STR("JoinedStr", false, "values"),
    CONSTANT("Constant", false, "value", "kind"),
    ATTRIBUTE("Attribute", false, "value", "attr", "ctx"),
    SUBSCRIPT("Subscript", false, "value", "slice", "ctx"),
    STARRED("Starred", false, "value", "ctx"),
    NAME("Name", false, "id", "ctx"),
    LIST("List", false, "elts", "ctx"),
    TUPLE("Tuple", false, "elts", "ctx"),
    SLICE("Slice", false, "lower", "upper", "step"),

    // Legacy expressions
    NUM("Num", false, "n"),
    STR("Str", false, "s"),
    BYTES("Bytes", false, "s"),
    NAME_CONSTANT("NameConstant", false, "value"),
    ELLIPSIS("Ellipsis", false),
    INDEX("Index", false, "value"),
    EXT_SLICE("ExtSlice", false, "dims"),
    REPR("Repr", false, "value"),

    // Auxiliary nodes
    COMPREHENSION("comprehension", false, "target", "iter", "ifs", "is_async"),
    EXCEPT_HANDLER("ExceptHandler", false, "type", "name", "body"),
    ARGUMENTS("arguments", false, "posonlyargs", "args", "vararg", "kwonlyargs", "kw_defaults", "kwarg", "defaults"),
    ARG("arg", false, "arg", "annotation", "type_comment"),
    KEYWORD("keyword", false, "arg", "value"),
    ALIAS("alias", false, "name", "asname"),
    WITH_ITEM("withitem", false, "context_expr", "optional_vars"),
    MATCH_CASE("match_case", false, "pattern", "guard", "body"),

    // Patterns
    MATCH_VALUE("MatchValue", false, "value"),
    MATCH_SINGLETON("MatchSingleton", false, "value"),
    MATCH_SEQUENCE("MatchSequence", false, "patterns"),
    MATCH_MAPPING("MatchMapping", false, "keys", "patterns", "rest"),
    MATCH_CLASS("MatchClass", false, "cls", "patterns", "kwd_attrs", "kwd_patterns"),
    MATCH_STAR("MatchStar", false, "name"),
    MATCH_AS("MatchAs", false, "pattern", "name"),
    MATCH_OR("MatchOr", false, "patterns"),

    /** Any type name the patcher has no rule for. */
    UNKNOWN("?", false);

    private static final Map<String, NodeKind> BY_TYPE_NAME = Arrays.stream(values())
            .filter(kind -> kind != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(NodeKind::typeName, Function.identity()));

    private final String typeName;
    private final boolean statement;
    private final List<String> fields;

    NodeKind(String typeName, boolean statement, String... fields) {
        this.typeName = typeName;
        this.statement = statement;
        this.fields = List.of(fields);
    }

    public String typeName() {
        return typeName;
    }

    public boolean isStatement() {
        return statement;
    }

    /**
     * Field names in declaration order.
     */
    public List<String> fields() {
        return fields;
    }

    public static NodeKind fromTypeName(String typeName) {
        return BY_TYPE_NAME.getOrDefault(typeName, UNKNOWN);
    }
}
