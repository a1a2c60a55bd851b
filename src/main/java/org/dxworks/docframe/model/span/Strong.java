package org.dxworks.docframe.model.span;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

public record Strong(List<Span> content, Options options) implements Span, SpanContainer<Strong> {

    public Strong {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Strong(List<Span> content) {
        this(content, Options.NONE);
    }

    @Override
    public Strong withContent(List<Span> content) {
        return new Strong(content, options);
    }
}
