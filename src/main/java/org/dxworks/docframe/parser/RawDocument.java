package org.dxworks.docframe.parser;

import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.rewrite.RewriteRule;

import java.util.List;
import java.util.Objects;

/**
 * The tree produced by a parser, possibly still holding temporary elements, together with
 * the dialect rules that resolve them.
 */
public record RawDocument(Document document, List<RewriteRule> rewriteRules) {

    public RawDocument {
        Objects.requireNonNull(document, "document");
        rewriteRules = List.copyOf(rewriteRules);
    }

    public RawDocument(Document document) {
        this(document, List.of());
    }
}
