package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementRewriter;
import org.dxworks.docframe.model.LinkTarget;
import org.dxworks.docframe.model.Options;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A section with its header and the blocks following it up to the next header of the same
 * or a higher level. Sections nest according to the levels of their headers.
 */
public record Section(Header header, List<Block> content, Options options) implements Block, BlockContainer<Section>, LinkTarget {

    public Section {
        Objects.requireNonNull(header, "header");
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Section(Header header, List<Block> content) {
        this(header, content, Options.NONE);
    }

    @Override
    public Section withContent(List<Block> content) {
        return new Section(header, content, options);
    }

    @Override
    public Section withOptions(Options options) {
        return new Section(header, content, options);
    }

    @Override
    public List<Element> children() {
        List<Element> children = new ArrayList<>();
        children.add(header);
        children.addAll(content);
        return children;
    }

    @Override
    public Section rewriteChildren(ElementRewriter rewriter) {
        return new Section(rewriter.rewriteRequired(header, Header.class),
                rewriter.rewriteAll(content, Block.class), options);
    }
}
