package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

public record Line(List<Span> content, Options options) implements Block, SpanContainer<Line> {

    public Line {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Line(List<Span> content) {
        this(content, Options.NONE);
    }

    @Override
    public Line withContent(List<Span> content) {
        return new Line(content, options);
    }
}
