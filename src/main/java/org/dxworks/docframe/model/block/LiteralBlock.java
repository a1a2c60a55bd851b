package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.TextContainer;

import java.util.Objects;

/**
 * A block of preformatted text.
 */
public record LiteralBlock(String content, Options options) implements Block, TextContainer {

    public LiteralBlock {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(options, "options");
    }

    public LiteralBlock(String content) {
        this(content, Options.NONE);
    }
}
