package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Link;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;

import java.util.List;
import java.util.Objects;

/**
 * A link to an external resource, the content being the link text.
 */
public record ExternalLink(List<Span> content, String url, String title, Options options)
        implements Link, SpanContainer<ExternalLink> {

    public ExternalLink {
        content = List.copyOf(content);
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(options, "options");
    }

    public ExternalLink(List<Span> content, String url) {
        this(content, url, null, Options.NONE);
    }

    @Override
    public ExternalLink withContent(List<Span> content) {
        return new ExternalLink(content, url, title, options);
    }
}
