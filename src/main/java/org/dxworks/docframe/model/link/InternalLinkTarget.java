package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.LinkTarget;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;

import java.util.Objects;

/**
 * Makes the following element a target for links, the id is taken from the options.
 */
public record InternalLinkTarget(Options options) implements Block, Span, LinkTarget {

    public InternalLinkTarget {
        Objects.requireNonNull(options, "options");
    }

    public static InternalLinkTarget withId(String id) {
        return new InternalLinkTarget(Options.id(id));
    }

    @Override
    public InternalLinkTarget withOptions(Options options) {
        return new InternalLinkTarget(options);
    }
}
