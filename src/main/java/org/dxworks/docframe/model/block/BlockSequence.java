package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * Groups blocks where the API expects a single element. Renderers usually render the
 * children as part of the enclosing flow.
 */
public record BlockSequence(List<Block> content, Options options) implements Block, BlockContainer<BlockSequence> {

    public BlockSequence {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public BlockSequence(List<Block> content) {
        this(content, Options.NONE);
    }

    @Override
    public BlockSequence withContent(List<Block> content) {
        return new BlockSequence(content, options);
    }
}
