package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.TextContainer;

import java.util.Objects;

/**
 * A comment that renderers may omit.
 */
public record Comment(String content, Options options) implements Block, TextContainer {

    public Comment {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(options, "options");
    }

    public Comment(String content) {
        this(content, Options.NONE);
    }
}
