package org.dxworks.docframe.model.span;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

public record Emphasized(List<Span> content, Options options) implements Span, SpanContainer<Emphasized> {

    public Emphasized {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Emphasized(List<Span> content) {
        this(content, Options.NONE);
    }

    @Override
    public Emphasized withContent(List<Span> content) {
        return new Emphasized(content, options);
    }
}
