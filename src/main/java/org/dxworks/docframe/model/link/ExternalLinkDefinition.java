package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Definition;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;

import java.util.Objects;

/**
 * An external link target, removed by the rewrite rule that resolves link and image references.
 *
 * @param title optional title, may be {@code null}
 */
public record ExternalLinkDefinition(String id, String url, String title, Options options) implements Definition, Span {

    public ExternalLinkDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(options, "options");
    }

    public ExternalLinkDefinition(String id, String url) {
        this(id, url, null, Options.NONE);
    }

    public ExternalLinkDefinition withId(String id) {
        return new ExternalLinkDefinition(id, url, title, options);
    }
}
