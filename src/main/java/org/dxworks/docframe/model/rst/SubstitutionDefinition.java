package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Definition;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementRewriter;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;

import java.util.List;
import java.util.Objects;

/**
 * The definition of a substitution, {@code .. |name| replace:: text}.
 */
public record SubstitutionDefinition(String name, Span content, Options options) implements Definition {

    public SubstitutionDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(options, "options");
    }

    public SubstitutionDefinition(String name, Span content) {
        this(name, content, Options.NONE);
    }

    @Override
    public List<Element> children() {
        return List.of(content);
    }

    @Override
    public SubstitutionDefinition rewriteChildren(ElementRewriter rewriter) {
        return new SubstitutionDefinition(name, rewriter.rewriteRequired(content, Span.class), options);
    }
}
