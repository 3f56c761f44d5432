package com.vidnyan.patchast.adapter.out.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.patchast.application.port.out.ExternalParserException;
import com.vidnyan.patchast.domain.model.ConstantValue;
import com.vidnyan.patchast.domain.model.NodeKind;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonAstReaderTest {

    private final JsonAstReader reader = new JsonAstReader(new ObjectMapper());

    @Test
    void readEnvelope_ShouldBuildNodesWithPositionsAndFields() {
        // Arrange
        String json = """
                {"tree": {"_type": "Module", "body": [
                  {"_type": "Assign", "lineno": 1, "col_offset": 0,
                   "targets": [{"_type": "Name", "lineno": 1, "col_offset": 0, "id": "x", "ctx": "Store"}],
                   "value": {"_type": "Constant", "lineno": 1, "col_offset": 4,
                             "value": {"kind": "STR", "repr": "'hi'", "text": "hi"}, "kind": null},
                   "type_comment": null}],
                 "type_ignores": []}}
                """;

        // Act
        SyntaxNode root = reader.readEnvelope(json);

        // Assert
        assertEquals(NodeKind.MODULE, root.kind());
        assertFalse(root.hasPosition());
        SyntaxNode assign = root.nodes("body").get(0);
        assertEquals(NodeKind.ASSIGN, assign.kind());
        assertEquals(List.of("targets", "value", "type_comment"), List.copyOf(assign.fieldNames()));
        assertEquals("x", assign.nodes("targets").get(0).text("id"));
        SyntaxNode constant = assign.node("value");
        assertEquals(1, constant.line());
        assertEquals(4, constant.column());
        assertEquals(ConstantValue.ofString("hi", "'hi'"), constant.get("value"));
        assertNull(assign.get("type_comment"));
    }

    @Test
    void readEnvelope_ShouldReadTerminalValues() {
        // Arrange
        String json = """
                {"tree": {"_type": "ImportFrom", "lineno": 1, "col_offset": 0, "module": null,
                          "names": [{"_type": "alias", "name": "a", "asname": null}],
                          "level": 2, "is_async": true}}
                """;

        // Act
        SyntaxNode node = reader.readEnvelope(json);

        // Assert
        assertEquals(2, node.integer("level"));
        assertTrue(node.flag("is_async"));
        assertNull(node.get("module"));
        assertEquals(NodeKind.ALIAS, node.nodes("names").get(0).kind());
    }

    @Test
    void readEnvelope_ShouldKeepTypeNameOfUnknownNodes() {
        SyntaxNode node = reader.readEnvelope("{\"tree\": {\"_type\": \"TypeAlias\", \"lineno\": 3, \"col_offset\": 0}}");

        assertEquals(NodeKind.UNKNOWN, node.kind());
        assertEquals("TypeAlias", node.typeName());
        assertEquals(3, node.line());
    }

    @Test
    void readEnvelope_ShouldReportSyntaxErrorAsRejected() {
        ExternalParserException error = assertThrows(ExternalParserException.class,
                () -> reader.readEnvelope("{\"error\": {\"msg\": \"invalid syntax\"}}"));

        assertTrue(error.isSourceRejected());
        assertEquals("invalid syntax", error.getMessage());
    }

    @Test
    void readEnvelope_ShouldReportMalformedOutputAsFailure() {
        // Act
        ExternalParserException unreadable = assertThrows(ExternalParserException.class,
                () -> reader.readEnvelope("Traceback (most recent call last):"));
        ExternalParserException notObject = assertThrows(ExternalParserException.class,
                () -> reader.readEnvelope("[1, 2]"));
        ExternalParserException noTree = assertThrows(ExternalParserException.class,
                () -> reader.readEnvelope("{}"));
        ExternalParserException badConstant = assertThrows(ExternalParserException.class,
                () -> reader.readEnvelope("{\"tree\": {\"_type\": \"Constant\", \"value\": {\"kind\": \"DECIMAL\", \"repr\": \"1\"}}}"));

        // Assert
        assertFalse(unreadable.isSourceRejected());
        assertFalse(notObject.isSourceRejected());
        assertFalse(noTree.isSourceRejected());
        assertFalse(badConstant.isSourceRejected());
    }
}
