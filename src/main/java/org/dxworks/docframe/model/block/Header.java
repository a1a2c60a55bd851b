package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

/**
 * A header with a level, 1 being the top level of the document.
 */
public record Header(int level, List<Span> content, Options options) implements Block, SpanContainer<Header> {

    public Header {
        if (level < 1) throw new IllegalArgumentException("Header level must be positive: " + level);
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Header(int level, List<Span> content) {
        this(level, content, Options.NONE);
    }

    @Override
    public Header withContent(List<Span> content) {
        return new Header(level, content, options);
    }

    public Header withOptions(Options options) {
        return new Header(level, content, options);
    }
}
