package org.dxworks.docframe.model;

/**
 * A temporary span pointing to some other node of the document by id or label.
 * The rewrite phase replaces it with a resolved link or with an invalid span.
 */
public interface Reference extends Span, Temporary {

    /**
     * The markup the reference was parsed from, used as fallback when it cannot be resolved.
     */
    String source();
}
