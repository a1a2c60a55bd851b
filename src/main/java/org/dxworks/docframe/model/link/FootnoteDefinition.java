package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Definition;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * A footnote whose final label and id are assigned by the rewrite phase.
 */
public record FootnoteDefinition(FootnoteLabel label, List<Block> content, Options options)
        implements Definition, BlockContainer<FootnoteDefinition> {

    public FootnoteDefinition {
        Objects.requireNonNull(label, "label");
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public FootnoteDefinition(FootnoteLabel label, List<Block> content) {
        this(label, content, Options.NONE);
    }

    @Override
    public FootnoteDefinition withContent(List<Block> content) {
        return new FootnoteDefinition(label, content, options);
    }
}
