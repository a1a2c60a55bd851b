package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.LinkTarget;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.TextContainer;

import java.util.Objects;

/**
 * Text inside a paragraph that is itself a link target, like {@code _`name`} in reStructuredText.
 */
public record InlineTarget(String content, Options options) implements Span, TextContainer, LinkTarget {

    public InlineTarget {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(options, "options");
    }

    public InlineTarget(String content, String id) {
        this(content, Options.id(id));
    }

    @Override
    public InlineTarget withOptions(Options options) {
        return new InlineTarget(content, options);
    }
}
