package org.dxworks.docframe.model.span;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

/**
 * Groups spans where the API expects a single element. Can be used both as a span and as a block.
 */
public record SpanSequence(List<Span> content, Options options) implements Block, Span, SpanContainer<SpanSequence> {

    public SpanSequence {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public SpanSequence(List<Span> content) {
        this(content, Options.NONE);
    }

    @Override
    public SpanSequence withContent(List<Span> content) {
        return new SpanSequence(content, options);
    }
}
