package com.vidnyan.patchast.domain.model;

/**
 * Non-fatal anomaly recorded while patching.
 */
public record Diagnostic(Kind kind, String nodeType, String message) {

    public enum Kind {
        /** No spelling rule for the node; it got a zero-width region. */
        UNREGISTERED_NODE_KIND,
        /** The node already had a region and was left unchanged. */
        REENTRANT_PATCH,
        /** A set with no elements was spelled as {@code set()}. */
        EMPTY_SET_LITERAL
    }
}
