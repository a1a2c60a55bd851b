package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Invalid;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.SystemMessage;

import java.util.Objects;

/**
 * Groups a block that could not be parsed or resolved with a system message.
 */
public record InvalidBlock(SystemMessage message, Block fallback, Options options) implements Block, Invalid<Block> {

    public InvalidBlock {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(fallback, "fallback");
        Objects.requireNonNull(options, "options");
    }

    public InvalidBlock(SystemMessage message, Block fallback) {
        this(message, fallback, Options.NONE);
    }
}
