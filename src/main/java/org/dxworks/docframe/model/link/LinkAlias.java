package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Definition;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;

import java.util.Objects;

/**
 * A link target pointing to another link target.
 */
public record LinkAlias(String id, String target, Options options) implements Definition, Span {

    public LinkAlias {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(options, "options");
    }

    public LinkAlias(String id, String target) {
        this(id, target, Options.NONE);
    }
}
