package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.LinkTarget;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * A footnote with resolved id and label.
 */
public record Footnote(String label, List<Block> content, Options options)
        implements Block, LinkTarget, BlockContainer<Footnote> {

    public Footnote {
        Objects.requireNonNull(label, "label");
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    @Override
    public Footnote withContent(List<Block> content) {
        return new Footnote(label, content, options);
    }

    @Override
    public Footnote withOptions(Options options) {
        return new Footnote(label, content, options);
    }
}
