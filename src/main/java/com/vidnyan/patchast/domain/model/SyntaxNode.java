package com.vidnyan.patchast.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A node of an externally parsed syntax tree.
 * Nodes are compared by identity; regions and fragments live in side tables
 * of {@link PatchedTree}, never on the node itself.
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final String typeName;
    private final int line;
    private final int column;
    private final Map<String, Object> fields;

    private SyntaxNode(Builder builder) {
        this.kind = builder.kind;
        this.typeName = builder.typeName;
        this.line = builder.line;
        this.column = builder.column;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind, kind.typeName());
    }

    /**
     * Builder for a node read under the given Python type name.
     */
    public static Builder builder(String typeName) {
        return new Builder(NodeKind.fromTypeName(typeName), typeName);
    }

    public NodeKind kind() {
        return kind;
    }

    public String typeName() {
        return typeName;
    }

    /** 1-based line of the first token, 0 when the parser gave none. */
    public int line() {
        return line;
    }

    /** 0-based column of the first token. */
    public int column() {
        return column;
    }

    public boolean hasPosition() {
        return line > 0;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    /**
     * The nested node stored in {@code field}, or null.
     */
    public SyntaxNode node(String field) {
        Object value = fields.get(field);
        return value instanceof SyntaxNode child ? child : null;
    }

    /**
     * Node entries of a list-valued field; null entries are kept.
     */
    public List<SyntaxNode> nodes(String field) {
        Object value = fields.get(field);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<SyntaxNode> result = new ArrayList<>(list.size());
        for (Object entry : list) {
            result.add(entry instanceof SyntaxNode child ? child : null);
        }
        return result;
    }

    /**
     * String entries of a list-valued field such as {@code Global.names}.
     */
    public List<String> strings(String field) {
        Object value = fields.get(field);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object entry : list) {
            result.add(entry == null ? null : entry.toString());
        }
        return result;
    }

    public String text(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public int integer(String field) {
        Object value = fields.get(field);
        return value instanceof Number number ? number.intValue() : 0;
    }

    public boolean flag(String field) {
        Object value = fields.get(field);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value instanceof Number number && number.intValue() != 0;
    }

    @Override
    public String toString() {
        return typeName + "@" + line + ":" + column;
    }

    public static final class Builder {
        private final NodeKind kind;
        private final String typeName;
        private int line;
        private int column;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(NodeKind kind, String typeName) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.typeName = Objects.requireNonNull(typeName, "typeName");
        }

        public Builder at(int line, int column) {
            this.line = line;
            this.column = column;
            return this;
        }

        public Builder field(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        public SyntaxNode build() {
            return new SyntaxNode(this);
        }
    }
}
