package com.vidnyan.patchast.application.port.out;

import com.vidnyan.patchast.domain.model.SyntaxNode;

/**
 * Port for the external Python parser.
 * Implemented by adapters (e.g., a Python interpreter process).
 */
public interface PythonParser {

    /**
     * Parse normalized source into its syntax tree.
     * @param source source with {@code \n} line endings and a trailing newline
     * @param filename name reported in errors
     * @throws ExternalParserException if the source is rejected or the parser fails
     */
    SyntaxNode parse(String source, String filename);
}
