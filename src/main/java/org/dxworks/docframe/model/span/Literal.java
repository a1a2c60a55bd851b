package org.dxworks.docframe.model.span;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.TextContainer;

import java.util.Objects;

/**
 * Inline text that is not parsed any further.
 */
public record Literal(String content, Options options) implements Span, TextContainer {

    public Literal {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(options, "options");
    }

    public Literal(String content) {
        this(content, Options.NONE);
    }
}
