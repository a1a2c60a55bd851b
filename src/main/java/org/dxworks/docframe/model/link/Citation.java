package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.LinkTarget;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

public record Citation(String label, List<Block> content, Options options)
        implements Block, LinkTarget, BlockContainer<Citation> {

    public Citation {
        Objects.requireNonNull(label, "label");
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    @Override
    public Citation withContent(List<Block> content) {
        return new Citation(label, content, options);
    }

    @Override
    public Citation withOptions(Options options) {
        return new Citation(label, content, options);
    }
}
