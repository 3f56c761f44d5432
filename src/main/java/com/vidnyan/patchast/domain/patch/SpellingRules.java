package com.vidnyan.patchast.domain.patch;

import com.vidnyan.patchast.domain.model.ConstantValue;
import com.vidnyan.patchast.domain.model.Diagnostic;
import com.vidnyan.patchast.domain.model.NodeKind;
import com.vidnyan.patchast.domain.model.Operator;
import com.vidnyan.patchast.domain.model.Region;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Spelling rule of every node kind: the ordered tokens, sentinels and child
 * nodes the node is written as. Rules that must look at the source ask the
 * owning {@link RegionPatcher}.
 */
@Slf4j
final class SpellingRules {

    private static final List<String> QUOTES = List.of("\"\"\"", "'''", "\"", "'");

    private static final Comparator<SyntaxNode> SOURCE_ORDER = Comparator
            .comparingInt((SyntaxNode node) -> positioned(node).line())
            .thenComparingInt(node -> positioned(node).column());

    private final RegionPatcher patcher;
    private final Map<NodeKind, Function<SyntaxNode, Spelling>> rules = new EnumMap<>(NodeKind.class);

    /** Format specs met so far and their literal parts; both are spelled as raw string text. */
    private final Set<SyntaxNode> formatSpecs = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<SyntaxNode> formatSpecParts = Collections.newSetFromMap(new IdentityHashMap<>());

    SpellingRules(RegionPatcher patcher) {
        this.patcher = patcher;
        registerRoots();
        registerStatements();
        registerExpressions();
        registerAuxiliary();
        registerPatterns();
        registerLegacy();
    }

    Optional<Spelling> spell(SyntaxNode node) {
        Function<SyntaxNode, Spelling> rule = rules.get(node.kind());
        return rule == null ? Optional.empty() : Optional.of(rule.apply(node));
    }

    private void registerRoots() {
        rules.put(NodeKind.MODULE, node -> new Spelling().nodes(node.nodes("body")).eatSpaces());
        rules.put(NodeKind.EXPRESSION, node -> new Spelling().node(node.node("body")).eatSpaces());
    }

    private void registerStatements() {
        rules.put(NodeKind.FUNCTION_DEF, node -> functionDef(node, false));
        rules.put(NodeKind.ASYNC_FUNCTION_DEF, node -> functionDef(node, true));
        rules.put(NodeKind.CLASS_DEF, this::classDef);
        rules.put(NodeKind.RETURN, node -> new Spelling().token("return").node(node.node("value")));
        rules.put(NodeKind.DELETE, node -> new Spelling().token("del").joined(node.nodes("targets"), ","));
        rules.put(NodeKind.ASSIGN, node -> new Spelling()
                .joined(node.nodes("targets"), "=")
                .token("=")
                .node(node.node("value")));
        rules.put(NodeKind.AUG_ASSIGN, node -> new Spelling()
                .node(node.node("target"))
                .tokens(operator(node, "op"))
                .token("=")
                .node(node.node("value")));
        rules.put(NodeKind.ANN_ASSIGN, this::annAssign);
        rules.put(NodeKind.FOR, node -> forLoop(node, false));
        rules.put(NodeKind.ASYNC_FOR, node -> forLoop(node, true));
        rules.put(NodeKind.WHILE, node -> withElse(new Spelling()
                .token("while").node(node.node("test")).token(":")
                .nodes(node.nodes("body")), node));
        rules.put(NodeKind.IF, this::ifStatement);
        rules.put(NodeKind.WITH, node -> withStatement(node, false));
        rules.put(NodeKind.ASYNC_WITH, node -> withStatement(node, true));
        rules.put(NodeKind.MATCH, node -> new Spelling()
                .token("match").node(node.node("subject")).token(":")
                .nodes(node.nodes("cases")));
        rules.put(NodeKind.RAISE, this::raise);
        rules.put(NodeKind.TRY, this::tryStatement);
        rules.put(NodeKind.TRY_STAR, this::tryStatement);
        rules.put(NodeKind.ASSERT, this::assertStatement);
        rules.put(NodeKind.IMPORT, node -> new Spelling().token("import").joined(node.nodes("names"), ","));
        rules.put(NodeKind.IMPORT_FROM, this::importFrom);
        rules.put(NodeKind.GLOBAL, node -> new Spelling().token("global").joined(node.strings("names"), ","));
        rules.put(NodeKind.NONLOCAL, node -> new Spelling().token("nonlocal").joined(node.strings("names"), ","));
        rules.put(NodeKind.EXPR, node -> new Spelling().node(node.node("value")));
        rules.put(NodeKind.PASS, node -> new Spelling().token("pass"));
        rules.put(NodeKind.BREAK, node -> new Spelling().token("break"));
        rules.put(NodeKind.CONTINUE, node -> new Spelling().token("continue"));
    }

    private void registerExpressions() {
        rules.put(NodeKind.BOOL_OP, node -> new Spelling()
                .joined(node.nodes("values"), operator(node, "op").get(0)));
        rules.put(NodeKind.NAMED_EXPR, node -> new Spelling()
                .node(node.node("target")).token(":=").node(node.node("value")));
        rules.put(NodeKind.BIN_OP, node -> new Spelling()
                .node(node.node("left"))
                .tokens(operator(node, "op"))
                .node(node.node("right")));
        rules.put(NodeKind.UNARY_OP, node -> new Spelling()
                .tokens(operator(node, "op"))
                .node(node.node("operand")));
        rules.put(NodeKind.LAMBDA, node -> new Spelling()
                .token("lambda").node(node.node("args")).token(":").node(node.node("body")));
        rules.put(NodeKind.IF_EXP, node -> new Spelling()
                .node(node.node("body")).token("if").node(node.node("test"))
                .token("else").node(node.node("orelse")));
        rules.put(NodeKind.DICT, this::dict);
        rules.put(NodeKind.SET, this::set);
        rules.put(NodeKind.LIST_COMP, node -> comprehension(node, "[", "]"));
        rules.put(NodeKind.SET_COMP, node -> comprehension(node, "{", "}"));
        rules.put(NodeKind.DICT_COMP, node -> new Spelling()
                .token("{").node(node.node("key")).token(":").node(node.node("value"))
                .nodes(node.nodes("generators"))
                .token("}"));
        rules.put(NodeKind.GENERATOR_EXP, node -> new Spelling()
                .node(node.node("elt")).nodes(node.nodes("generators")).eatParens());
        rules.put(NodeKind.AWAIT, node -> new Spelling().token("await").node(node.node("value")));
        rules.put(NodeKind.YIELD, node -> new Spelling().token("yield").node(node.node("value")));
        rules.put(NodeKind.YIELD_FROM, node -> new Spelling().tokens("yield", "from").node(node.node("value")));
        rules.put(NodeKind.COMPARE, this::compare);
        rules.put(NodeKind.CALL, this::call);
        rules.put(NodeKind.FORMATTED_VALUE, this::formattedValue);
        rules.put(NodeKind.JOINED_STR, this::joinedStr);
        rules.put(NodeKind.CONSTANT, this::constant);
        rules.put(NodeKind.ATTRIBUTE, node -> new Spelling()
                .node(node.node("value")).token(".").token(node.text("attr")));
        rules.put(NodeKind.SUBSCRIPT, node -> new Spelling()
                .node(node.node("value")).token("[").node(node.node("slice")).token("]"));
        rules.put(NodeKind.STARRED, node -> new Spelling().token("*").node(node.node("value")));
        rules.put(NodeKind.NAME, node -> new Spelling().token(node.text("id")));
        rules.put(NodeKind.LIST, node -> new Spelling().token("[").joined(node.nodes("elts"), ",").token("]"));
        rules.put(NodeKind.TUPLE, this::tuple);
        rules.put(NodeKind.SLICE, this::slice);
    }

    private void registerAuxiliary() {
        rules.put(NodeKind.COMPREHENSION, this::comprehensionClause);
        rules.put(NodeKind.EXCEPT_HANDLER, this::exceptHandler);
        rules.put(NodeKind.ARGUMENTS, this::arguments);
        rules.put(NodeKind.ARG, node -> {
            Spelling spelling = new Spelling().token(node.text("arg"));
            if (node.node("annotation") != null) {
                spelling.token(":").node(node.node("annotation"));
            }
            return spelling;
        });
        rules.put(NodeKind.KEYWORD, node -> {
            if (node.text("arg") == null) {
                return new Spelling().token("**").node(node.node("value"));
            }
            return new Spelling().token(node.text("arg")).token("=").node(node.node("value"));
        });
        rules.put(NodeKind.ALIAS, node -> {
            Spelling spelling = new Spelling().token(node.text("name"));
            if (node.text("asname") != null) {
                spelling.tokens("as", node.text("asname"));
            }
            return spelling;
        });
        rules.put(NodeKind.WITH_ITEM, node -> {
            Spelling spelling = new Spelling().node(node.node("context_expr"));
            if (node.node("optional_vars") != null) {
                spelling.token("as").node(node.node("optional_vars"));
            }
            return spelling;
        });
        rules.put(NodeKind.MATCH_CASE, node -> {
            Spelling spelling = new Spelling().token("case").node(node.node("pattern"));
            if (node.node("guard") != null) {
                spelling.token("if").node(node.node("guard"));
            }
            return spelling.token(":").nodes(node.nodes("body"));
        });
    }

    private void registerPatterns() {
        rules.put(NodeKind.MATCH_VALUE, node -> new Spelling().node(node.node("value")));
        rules.put(NodeKind.MATCH_SINGLETON, node -> new Spelling().token(pythonLiteral(node.get("value"))));
        rules.put(NodeKind.MATCH_SEQUENCE, this::matchSequence);
        rules.put(NodeKind.MATCH_MAPPING, this::matchMapping);
        rules.put(NodeKind.MATCH_CLASS, this::matchClass);
        rules.put(NodeKind.MATCH_STAR, node -> new Spelling()
                .token("*").token(node.text("name") == null ? "_" : node.text("name")));
        rules.put(NodeKind.MATCH_AS, node -> {
            if (node.node("pattern") != null) {
                return new Spelling().node(node.node("pattern")).token("as").token(node.text("name"));
            }
            return new Spelling().token(node.text("name") == null ? "_" : node.text("name"));
        });
        rules.put(NodeKind.MATCH_OR, node -> new Spelling().joined(node.nodes("patterns"), "|"));
    }

    private void registerLegacy() {
        rules.put(NodeKind.EXEC, this::exec);
        rules.put(NodeKind.PRINT, this::print);
        rules.put(NodeKind.TRY_EXCEPT, this::tryStatement);
        rules.put(NodeKind.TRY_FINALLY, this::tryFinally);
        rules.put(NodeKind.NUM, node -> new Spelling().sentinel(Sentinel.NUMBER));
        rules.put(NodeKind.STR, node -> new Spelling().sentinel(Sentinel.STRING));
        rules.put(NodeKind.BYTES, node -> new Spelling().sentinel(Sentinel.STRING));
        rules.put(NodeKind.NAME_CONSTANT, node -> new Spelling().token(pythonLiteral(node.get("value"))));
        rules.put(NodeKind.ELLIPSIS, node -> new Spelling().token("..."));
        rules.put(NodeKind.INDEX, node -> new Spelling().node(node.node("value")));
        rules.put(NodeKind.EXT_SLICE, node -> new Spelling().joined(node.nodes("dims"), ","));
        rules.put(NodeKind.REPR, node -> new Spelling().token("`").node(node.node("value")).token("`"));
    }

    private Spelling functionDef(SyntaxNode node, boolean async) {
        Spelling spelling = decorators(node);
        if (async) {
            spelling.token("async");
        }
        spelling.tokens("def", node.text("name"), "(").node(node.node("args")).token(")");
        if (node.node("returns") != null) {
            spelling.token("->").node(node.node("returns"));
        }
        return spelling.token(":").nodes(node.nodes("body"));
    }

    private Spelling classDef(SyntaxNode node) {
        Spelling spelling = decorators(node).tokens("class", node.text("name"));
        List<SyntaxNode> bases = new ArrayList<>(node.nodes("bases"));
        bases.addAll(node.nodes("keywords"));
        if (!bases.isEmpty()) {
            bases.sort(SOURCE_ORDER);
            spelling.token("(").joined(bases, ",").token(")");
        }
        return spelling.token(":").nodes(node.nodes("body"));
    }

    private Spelling decorators(SyntaxNode node) {
        Spelling spelling = new Spelling();
        for (SyntaxNode decorator : node.nodes("decorator_list")) {
            spelling.token("@").node(decorator);
        }
        return spelling;
    }

    private Spelling annAssign(SyntaxNode node) {
        Spelling spelling = new Spelling()
                .node(node.node("target")).token(":").node(node.node("annotation"));
        if (node.node("value") != null) {
            spelling.token("=").node(node.node("value"));
        }
        return spelling;
    }

    private Spelling forLoop(SyntaxNode node, boolean async) {
        Spelling spelling = new Spelling();
        if (async) {
            spelling.token("async");
        }
        spelling.token("for").node(node.node("target"))
                .token("in").node(node.node("iter")).token(":")
                .nodes(node.nodes("body"));
        return withElse(spelling, node);
    }

    private Spelling withElse(Spelling spelling, SyntaxNode node) {
        List<SyntaxNode> orelse = node.nodes("orelse");
        if (!orelse.isEmpty()) {
            spelling.tokens("else", ":").nodes(orelse);
        }
        return spelling;
    }

    private Spelling ifStatement(SyntaxNode node) {
        Spelling spelling = new Spelling()
                .token(patcher.isElif(node) ? "elif" : "if")
                .node(node.node("test")).token(":")
                .nodes(node.nodes("body"));
        List<SyntaxNode> orelse = node.nodes("orelse");
        if (!orelse.isEmpty()) {
            if (orelse.size() != 1 || !patcher.isElif(orelse.get(0))) {
                spelling.tokens("else", ":");
            }
            spelling.nodes(orelse);
        }
        return spelling;
    }

    private Spelling withStatement(SyntaxNode node, boolean async) {
        Spelling spelling = new Spelling();
        if (async) {
            spelling.token("async");
        }
        for (SyntaxNode item : node.nodes("items")) {
            spelling.sentinel(Sentinel.WITH_OR_COMMA).node(item);
        }
        return spelling.token(":").nodes(node.nodes("body"));
    }

    private Spelling raise(SyntaxNode node) {
        Spelling spelling = new Spelling().token("raise").node(node.node("exc"));
        if (node.node("cause") != null) {
            spelling.token("from").node(node.node("cause"));
        }
        return spelling;
    }

    private Spelling tryStatement(SyntaxNode node) {
        Spelling spelling = new Spelling()
                .tokens("try", ":")
                .nodes(node.nodes("body"))
                .nodes(node.nodes("handlers"));
        withElse(spelling, node);
        List<SyntaxNode> finalbody = node.nodes("finalbody");
        if (!finalbody.isEmpty()) {
            spelling.tokens("finally", ":").nodes(finalbody);
        }
        return spelling;
    }

    /**
     * Older trees wrap {@code try/except/finally} as a {@code TryFinally} around a
     * {@code TryExcept} at the same position; the {@code try:} then belongs to the inner node.
     */
    private Spelling tryFinally(SyntaxNode node) {
        List<SyntaxNode> body = node.nodes("body");
        boolean wrapsTryExcept = body.size() == 1 && body.get(0) != null
                && body.get(0).is(NodeKind.TRY_EXCEPT)
                && body.get(0).line() == node.line()
                && body.get(0).column() == node.column();
        Spelling spelling = new Spelling();
        if (!wrapsTryExcept) {
            spelling.tokens("try", ":");
        }
        return spelling.nodes(body).tokens("finally", ":").nodes(node.nodes("finalbody"));
    }

    private Spelling assertStatement(SyntaxNode node) {
        Spelling spelling = new Spelling().token("assert").node(node.node("test"));
        if (node.node("msg") != null) {
            spelling.token(",").node(node.node("msg"));
        }
        return spelling;
    }

    private Spelling importFrom(SyntaxNode node) {
        Spelling spelling = new Spelling().token("from");
        int level = node.integer("level");
        if (level > 0) {
            spelling.token(".".repeat(level));
        }
        String module = node.text("module");
        return spelling.token(module == null ? "" : module)
                .token("import")
                .joined(node.nodes("names"), ",");
    }

    private Spelling dict(SyntaxNode node) {
        Spelling spelling = new Spelling().token("{");
        List<SyntaxNode> keys = node.nodes("keys");
        List<SyntaxNode> values = node.nodes("values");
        for (int i = 0; i < keys.size() && i < values.size(); i++) {
            if (i > 0) {
                spelling.token(",");
            }
            if (keys.get(i) == null) {
                spelling.token("**").node(values.get(i));
            } else {
                spelling.node(keys.get(i)).token(":").node(values.get(i));
            }
        }
        return spelling.token("}");
    }

    private Spelling set(SyntaxNode node) {
        List<SyntaxNode> elements = node.nodes("elts");
        if (!elements.isEmpty()) {
            return new Spelling().token("{").joined(elements, ",").token("}");
        }
        log.warn("Tried to handle empty <Set> literal; please report!");
        patcher.addDiagnostic(new Diagnostic(Diagnostic.Kind.EMPTY_SET_LITERAL, node.typeName(),
                "Set without elements spelled as set()"));
        return new Spelling().tokens("set(", ")");
    }

    private Spelling comprehension(SyntaxNode node, String open, String close) {
        return new Spelling()
                .token(open).node(node.node("elt"))
                .nodes(node.nodes("generators"))
                .token(close);
    }

    private Spelling comprehensionClause(SyntaxNode node) {
        Spelling spelling = new Spelling();
        if (node.flag("is_async")) {
            spelling.token("async");
        }
        spelling.token("for").node(node.node("target")).token("in").node(node.node("iter"));
        for (SyntaxNode condition : node.nodes("ifs")) {
            spelling.token("if").node(condition);
        }
        return spelling;
    }

    private Spelling compare(SyntaxNode node) {
        Spelling spelling = new Spelling().node(node.node("left"));
        List<String> ops = node.strings("ops");
        List<SyntaxNode> comparators = node.nodes("comparators");
        for (int i = 0; i < ops.size() && i < comparators.size(); i++) {
            Operator op = Operator.fromTag(ops.get(i));
            if (op == Operator.NOT_EQ) {
                spelling.sentinel(Sentinel.NOT_EQUAL);
            } else {
                spelling.tokens(op.tokens());
            }
            spelling.node(comparators.get(i));
        }
        return spelling;
    }

    private Spelling call(SyntaxNode node) {
        List<SyntaxNode> arguments = new ArrayList<>(node.nodes("args"));
        arguments.addAll(node.nodes("keywords"));
        arguments.sort(SOURCE_ORDER);
        return new Spelling()
                .node(node.node("func"))
                .token("(")
                .joined(arguments, ",")
                .token(")");
    }

    /**
     * Keywords are placed by their value; older trees give keywords no position.
     */
    private static SyntaxNode positioned(SyntaxNode node) {
        if (node.is(NodeKind.KEYWORD) && node.node("value") != null) {
            return node.node("value");
        }
        return node;
    }

    private Spelling arguments(SyntaxNode node) {
        List<SyntaxNode> positional = new ArrayList<>(node.nodes("posonlyargs"));
        int positionalOnly = positional.size();
        positional.addAll(node.nodes("args"));
        List<SyntaxNode> defaults = node.nodes("defaults");
        int firstDefault = positional.size() - defaults.size();

        List<List<Object>> parameters = new ArrayList<>();
        for (int i = 0; i < positional.size(); i++) {
            parameters.add(parameter(null, positional.get(i), i >= firstDefault ? defaults.get(i - firstDefault) : null));
            if (i == positionalOnly - 1) {
                parameters.add(List.of("/"));
            }
        }
        SyntaxNode vararg = node.node("vararg");
        List<SyntaxNode> keywordOnly = node.nodes("kwonlyargs");
        if (vararg != null) {
            parameters.add(parameter("*", vararg, null));
        } else if (!keywordOnly.isEmpty()) {
            parameters.add(List.of("*"));
        }
        List<SyntaxNode> keywordDefaults = node.nodes("kw_defaults");
        for (int i = 0; i < keywordOnly.size(); i++) {
            parameters.add(parameter(null, keywordOnly.get(i), i < keywordDefaults.size() ? keywordDefaults.get(i) : null));
        }
        if (node.node("kwarg") != null) {
            parameters.add(parameter("**", node.node("kwarg"), null));
        }

        Spelling spelling = new Spelling();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                spelling.token(",");
            }
            parameters.get(i).forEach(spelling::item);
        }
        return spelling;
    }

    private static List<Object> parameter(String prefix, SyntaxNode arg, SyntaxNode defaultValue) {
        List<Object> items = new ArrayList<>();
        if (prefix != null) {
            items.add(prefix);
        }
        items.add(arg);
        if (defaultValue != null) {
            items.add("=");
            items.add(defaultValue);
        }
        return items;
    }

    private Spelling tuple(SyntaxNode node) {
        List<SyntaxNode> elements = node.nodes("elts");
        if (elements.isEmpty()) {
            return new Spelling().sentinel(Sentinel.EMPTY_TUPLE);
        }
        return new Spelling().joined(elements, ",").eatParens();
    }

    private Spelling slice(SyntaxNode node) {
        Spelling spelling = new Spelling().node(node.node("lower")).token(":").node(node.node("upper"));
        if (node.node("step") != null) {
            spelling.token(":").node(node.node("step"));
        }
        return spelling;
    }

    private Spelling exceptHandler(SyntaxNode node) {
        Spelling spelling = new Spelling().token("except").node(node.node("type"));
        if (node.get("name") != null) {
            spelling.sentinel(Sentinel.EXCEPT_AS_OR_COMMA).item(node.get("name"));
        }
        return spelling.token(":").nodes(node.nodes("body"));
    }

    private Spelling constant(SyntaxNode node) {
        if (formatSpecParts.contains(node)) {
            return new Spelling().insideString().token(stringText(node));
        }
        return literal(node.get("value"));
    }

    private Spelling formattedValue(SyntaxNode node) {
        Spelling spelling = new Spelling().insideString().token("{").node(node.node("value"));
        SyntaxNode formatSpec = node.node("format_spec");
        if (formatSpec != null) {
            formatSpecs.add(formatSpec);
            spelling.token(":").node(formatSpec);
        }
        return spelling.token("}");
    }

    /**
     * The literal is measured first so the quotes that open and close it can
     * be expected around its replacement fields.
     */
    private Spelling joinedStr(SyntaxNode node) {
        if (formatSpecs.contains(node)) {
            return formatSpec(node);
        }
        Region literal = patcher.peekString();
        String source = patcher.source();
        Spelling spelling = new Spelling().insideString().token(openingQuote(source, literal));
        for (SyntaxNode part : node.nodes("values")) {
            if (part != null && part.is(NodeKind.FORMATTED_VALUE)) {
                spelling.node(part);
            }
        }
        return spelling.token(closingQuote(source, literal));
    }

    /**
     * Text after the colon of a replacement field: literal parts and nested
     * replacement fields, with no quotes of its own.
     */
    private Spelling formatSpec(SyntaxNode node) {
        Spelling spelling = new Spelling().insideString();
        for (SyntaxNode part : node.nodes("values")) {
            if (part != null && part.is(NodeKind.CONSTANT)) {
                formatSpecParts.add(part);
            }
            spelling.node(part);
        }
        return spelling;
    }

    /** Prefix and quote up to the earliest quote; the shorter quote wins a tie. */
    private static String openingQuote(String source, Region literal) {
        int bestPosition = -1;
        String bestQuote = null;
        for (String quote : QUOTES) {
            int position = source.indexOf(quote, literal.start());
            if (position < 0 || position + quote.length() > literal.end()) {
                continue;
            }
            if (bestQuote == null || position < bestPosition
                    || (position == bestPosition && quote.compareTo(bestQuote) < 0)) {
                bestPosition = position;
                bestQuote = quote;
            }
        }
        if (bestQuote == null) {
            throw new IllegalStateException("No quote in string literal at " + literal);
        }
        return source.substring(literal.start(), bestPosition + bestQuote.length());
    }

    /** Closing quote sized as the longest quote found in the literal. */
    private static String closingQuote(String source, Region literal) {
        int bestPosition = -1;
        String bestQuote = null;
        for (String quote : QUOTES) {
            int position = source.lastIndexOf(quote, literal.end() - quote.length());
            if (position < literal.start()) {
                continue;
            }
            if (bestQuote == null
                    || quote.length() > bestQuote.length()
                    || (quote.length() == bestQuote.length() && position > bestPosition)) {
                bestPosition = position;
                bestQuote = quote;
            }
        }
        if (bestQuote == null) {
            throw new IllegalStateException("No quote in string literal at " + literal);
        }
        return source.substring(literal.end() - bestQuote.length(), literal.end());
    }

    private Spelling matchSequence(SyntaxNode node) {
        List<SyntaxNode> patterns = node.nodes("patterns");
        if (isBracketed(node, patterns)) {
            return new Spelling().token("[").joined(patterns, ",").token("]");
        }
        return new Spelling().joined(patterns, ",").eatParens();
    }

    /**
     * A sequence pattern is bracketed when its own position holds {@code [}
     * and its first element does not start there too; {@code case [a], b:}
     * is a bare sequence whose first element is a list.
     */
    private boolean isBracketed(SyntaxNode node, List<SyntaxNode> patterns) {
        if (!node.hasPosition()) {
            return patcher.nextSignificantChar() == '[';
        }
        int offset = patcher.offsetOf(node);
        String source = patcher.source();
        if (offset >= source.length() || source.charAt(offset) != '[') {
            return false;
        }
        SyntaxNode first = patterns.isEmpty() ? null : patterns.get(0);
        return first == null || !first.hasPosition() || patcher.offsetOf(first) != offset;
    }

    private Spelling matchMapping(SyntaxNode node) {
        Spelling spelling = new Spelling().token("{");
        List<SyntaxNode> keys = node.nodes("keys");
        List<SyntaxNode> patterns = node.nodes("patterns");
        for (int i = 0; i < keys.size() && i < patterns.size(); i++) {
            if (i > 0) {
                spelling.token(",");
            }
            spelling.node(keys.get(i)).token(":").node(patterns.get(i));
        }
        String rest = node.text("rest");
        if (rest != null) {
            if (!keys.isEmpty()) {
                spelling.token(",");
            }
            spelling.tokens("**", rest);
        }
        return spelling.token("}");
    }

    private Spelling matchClass(SyntaxNode node) {
        List<SyntaxNode> patterns = node.nodes("patterns");
        List<String> attributes = node.strings("kwd_attrs");
        List<SyntaxNode> keywordPatterns = node.nodes("kwd_patterns");
        Spelling spelling = new Spelling()
                .node(node.node("cls"))
                .token("(")
                .joined(patterns, ",");
        for (int i = 0; i < attributes.size() && i < keywordPatterns.size(); i++) {
            if (i > 0 || !patterns.isEmpty()) {
                spelling.token(",");
            }
            spelling.tokens(attributes.get(i), "=").node(keywordPatterns.get(i));
        }
        return spelling.token(")");
    }

    private Spelling exec(SyntaxNode node) {
        Spelling spelling = new Spelling()
                .token("exec")
                .sentinel(Sentinel.EXEC_OPEN_PAREN_OR_SPACE)
                .node(node.node("body"));
        if (node.node("globals") != null) {
            spelling.sentinel(Sentinel.EXEC_IN_OR_COMMA).node(node.node("globals"));
        }
        if (node.node("locals") != null) {
            spelling.token(",").node(node.node("locals"));
        }
        return spelling.sentinel(Sentinel.EXEC_CLOSE_PAREN_OR_SPACE);
    }

    private Spelling print(SyntaxNode node) {
        Spelling spelling = new Spelling().token("print");
        List<SyntaxNode> values = node.nodes("values");
        if (node.node("dest") != null) {
            spelling.token(">>").node(node.node("dest"));
            if (!values.isEmpty()) {
                spelling.token(",");
            }
        }
        spelling.joined(values, ",");
        if (!node.flag("nl")) {
            spelling.token(",");
        }
        return spelling;
    }

    private Spelling literal(Object value) {
        if (value instanceof ConstantValue constant) {
            if (constant.isString()) {
                return new Spelling().sentinel(Sentinel.STRING);
            }
            if (constant.isNumber()) {
                return new Spelling().sentinel(Sentinel.NUMBER);
            }
            if (constant.kind() == ConstantValue.Kind.ELLIPSIS) {
                return new Spelling().token("...");
            }
            return new Spelling().token(constant.repr());
        }
        if (value instanceof String) {
            return new Spelling().sentinel(Sentinel.STRING);
        }
        if (value instanceof Number) {
            return new Spelling().sentinel(Sentinel.NUMBER);
        }
        return new Spelling().token(pythonLiteral(value));
    }

    /**
     * Source spelling of {@code True}, {@code False} and {@code None} values.
     */
    private static String pythonLiteral(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        if (value instanceof ConstantValue constant) {
            return constant.repr();
        }
        return value.toString();
    }

    private static String stringText(SyntaxNode constant) {
        Object value = constant.get(constant.is(NodeKind.STR) ? "s" : "value");
        if (value instanceof ConstantValue string) {
            return string.text();
        }
        return value == null ? null : value.toString();
    }

    private static List<String> operator(SyntaxNode node, String field) {
        return Operator.fromTag(node.text(field)).tokens();
    }
}
