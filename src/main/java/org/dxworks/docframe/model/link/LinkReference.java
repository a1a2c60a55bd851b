package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Reference;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

/**
 * A link whose target is only known by id, resolved by the rewrite phase.
 */
public record LinkReference(List<Span> content, String id, String source, Options options)
        implements Reference, SpanContainer<LinkReference> {

    public LinkReference {
        content = List.copyOf(content);
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
    }

    public LinkReference(List<Span> content, String id, String source) {
        this(content, id, source, Options.NONE);
    }

    @Override
    public LinkReference withContent(List<Span> content) {
        return new LinkReference(content, id, source, options);
    }
}
