package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;
import org.dxworks.docframe.model.Temporary;

import java.util.List;
import java.util.Objects;

/**
 * A header whose level is not known yet. The rewrite phase assigns levels by decoration:
 * the first decoration found in the document is level 1, the second distinct one level 2, and so on.
 */
public record DecoratedHeader(HeaderDecoration decoration, List<Span> content, Options options)
        implements Block, Temporary, SpanContainer<DecoratedHeader> {

    public DecoratedHeader {
        Objects.requireNonNull(decoration, "decoration");
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public DecoratedHeader(HeaderDecoration decoration, List<Span> content) {
        this(decoration, content, Options.NONE);
    }

    @Override
    public DecoratedHeader withContent(List<Span> content) {
        return new DecoratedHeader(decoration, content, options);
    }

    public DecoratedHeader withOptions(Options options) {
        return new DecoratedHeader(decoration, content, options);
    }
}
