package com.vidnyan.patchast.adapter.out.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.patchast.application.port.out.ExternalParserException;
import com.vidnyan.patchast.domain.model.ConstantValue;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts the JSON form of a Python AST into {@link SyntaxNode}s.
 *
 * <p>Nodes are objects with a {@code _type} member, optional {@code lineno} and
 * {@code col_offset}, and one member per field in declaration order. Constant
 * values are objects with {@code kind} and {@code repr}. The dump script wraps
 * the tree as {@code {"tree": ...}} or reports {@code {"error": {"msg": ...}}}.
 */
@Component
@RequiredArgsConstructor
public class JsonAstReader {

    private static final String TYPE = "_type";
    private static final String LINENO = "lineno";
    private static final String COL_OFFSET = "col_offset";
    private static final Set<String> POSITION_MEMBERS = Set.of(TYPE, LINENO, COL_OFFSET);

    private final ObjectMapper objectMapper;

    /**
     * Reads the dump script's output.
     * @throws ExternalParserException rejected when the output reports a syntax error
     */
    public SyntaxNode readEnvelope(String json) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw ExternalParserException.failed("Unreadable parser output: " + e.getOriginalMessage(), e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw ExternalParserException.failed("Parser output is not a JSON object");
        }
        JsonNode error = envelope.get("error");
        if (error != null && !error.isNull()) {
            throw ExternalParserException.rejected(error.path("msg").asText("invalid syntax"));
        }
        JsonNode tree = envelope.get("tree");
        if (tree == null || tree.isNull()) {
            throw ExternalParserException.failed("Parser output has no tree");
        }
        return read(tree);
    }

    public SyntaxNode read(JsonNode json) {
        if (!json.isObject() || !json.hasNonNull(TYPE)) {
            throw ExternalParserException.failed("Expected an AST node but found " + json.getNodeType());
        }
        SyntaxNode.Builder builder = SyntaxNode.builder(json.get(TYPE).asText());
        if (json.hasNonNull(LINENO) && json.hasNonNull(COL_OFFSET)) {
            builder.at(json.get(LINENO).asInt(), json.get(COL_OFFSET).asInt());
        }
        Iterator<Map.Entry<String, JsonNode>> members = json.fields();
        while (members.hasNext()) {
            Map.Entry<String, JsonNode> member = members.next();
            if (!POSITION_MEMBERS.contains(member.getKey())) {
                builder.field(member.getKey(), value(member.getValue()));
            }
        }
        return builder.build();
    }

    private Object value(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return null;
        }
        if (json.isObject()) {
            if (json.has(TYPE)) {
                return read(json);
            }
            return constant(json);
        }
        if (json.isArray()) {
            List<Object> entries = new ArrayList<>(json.size());
            json.forEach(entry -> entries.add(value(entry)));
            return Collections.unmodifiableList(entries);
        }
        if (json.isBoolean()) {
            return json.booleanValue();
        }
        if (json.isIntegralNumber()) {
            return json.intValue();
        }
        if (json.isNumber()) {
            return json.doubleValue();
        }
        return json.asText();
    }

    private ConstantValue constant(JsonNode json) {
        if (!json.hasNonNull("kind") || !json.hasNonNull("repr")) {
            throw ExternalParserException.failed("Unrecognized value object " + json);
        }
        ConstantValue.Kind kind;
        try {
            kind = ConstantValue.Kind.valueOf(json.get("kind").asText());
        } catch (IllegalArgumentException e) {
            throw ExternalParserException.failed("Unknown constant kind " + json.get("kind").asText(), e);
        }
        String text = json.hasNonNull("text") ? json.get("text").asText() : null;
        return new ConstantValue(kind, json.get("repr").asText(), text);
    }
}
