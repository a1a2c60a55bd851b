package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.TextContainer;
import org.dxworks.docframe.model.block.LiteralBlock;

import java.util.Objects;

/**
 * An interactive Python session, starting with {@code >>>}. Renderers without special
 * support show it as a literal block.
 */
public record DoctestBlock(String content, Options options) implements Block, TextContainer {

    public DoctestBlock {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(options, "options");
    }

    public static DoctestBlock of(String content) {
        return new DoctestBlock(content, Options.fallback(new LiteralBlock(content, Options.withStyles("doctest"))));
    }
}
