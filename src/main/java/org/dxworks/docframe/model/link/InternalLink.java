package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Link;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

/**
 * A link to an element of the same document, identified by its id.
 */
public record InternalLink(List<Span> content, String targetId, String title, Options options)
        implements Link, SpanContainer<InternalLink> {

    public InternalLink {
        content = List.copyOf(content);
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(options, "options");
    }

    public InternalLink(List<Span> content, String targetId) {
        this(content, targetId, null, Options.NONE);
    }

    @Override
    public InternalLink withContent(List<Span> content) {
        return new InternalLink(content, targetId, title, options);
    }
}
