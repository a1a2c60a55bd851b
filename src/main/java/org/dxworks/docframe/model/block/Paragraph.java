package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

public record Paragraph(List<Span> content, Options options) implements Block, SpanContainer<Paragraph> {

    public Paragraph {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Paragraph(List<Span> content) {
        this(content, Options.NONE);
    }

    @Override
    public Paragraph withContent(List<Span> content) {
        return new Paragraph(content, options);
    }
}
