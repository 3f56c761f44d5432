package com.vidnyan.patchast.application.service;

import com.vidnyan.patchast.PatchAstProperties;
import com.vidnyan.patchast.application.port.in.SourceSyntaxException;
import com.vidnyan.patchast.application.port.out.ExternalParserException;
import com.vidnyan.patchast.application.port.out.PythonParser;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Normalizes source text and hands it to the external parser.
 * Regions are always computed against the normalized text returned here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParserAdapter {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final PythonParser pythonParser;
    private final PatchAstProperties properties;

    /**
     * Rewrites {@code \r\n} and bare {@code \r} to {@code \n} and appends a final newline.
     */
    public static String normalize(String source) {
        String normalized = source;
        if (normalized.indexOf('\r') >= 0) {
            normalized = normalized.replace("\r\n", "\n").replace('\r', '\n');
        }
        if (!normalized.endsWith("\n")) {
            normalized = normalized + "\n";
        }
        return normalized;
    }

    /**
     * Decodes UTF-8, dropping a leading byte order mark, then normalizes.
     */
    public static String normalize(byte[] source) {
        String decoded = new String(source, StandardCharsets.UTF_8);
        if (!decoded.isEmpty() && decoded.charAt(0) == BYTE_ORDER_MARK) {
            decoded = decoded.substring(1);
        }
        return normalize(decoded);
    }

    public ParsedSource parse(String source, String filename) {
        return parseNormalized(normalize(source), filename);
    }

    public ParsedSource parse(byte[] source, String filename) {
        return parseNormalized(normalize(source), filename);
    }

    private ParsedSource parseNormalized(String normalized, String filename) {
        String name = filename == null ? properties.getDefaultFilename() : filename;
        try {
            SyntaxNode root = pythonParser.parse(normalized, name);
            return new ParsedSource(normalized, root);
        } catch (ExternalParserException e) {
            if (!e.isSourceRejected()) {
                throw e;
            }
            log.debug("Parser rejected {}: {}", name, e.getMessage());
            throw new SourceSyntaxException(name, e.getMessage(), e);
        }
    }

    /**
     * Normalized source and the tree parsed from it.
     */
    public record ParsedSource(String source, SyntaxNode root) {
    }
}
