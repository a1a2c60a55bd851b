package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * Lines that keep their line breaks, holding {@link Line} elements and nested line blocks.
 */
public record LineBlock(List<Block> content, Options options) implements Block, BlockContainer<LineBlock> {

    public LineBlock {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public LineBlock(List<Block> content) {
        this(content, Options.NONE);
    }

    @Override
    public LineBlock withContent(List<Block> content) {
        return new LineBlock(content, options);
    }
}
