package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementRewriter;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A quoted block with an attribution that may be empty.
 */
public record QuotedBlock(List<Block> content, List<Span> attribution, Options options)
        implements Block, BlockContainer<QuotedBlock> {

    public QuotedBlock {
        content = List.copyOf(content);
        attribution = List.copyOf(attribution);
        Objects.requireNonNull(options, "options");
    }

    public QuotedBlock(List<Block> content, List<Span> attribution) {
        this(content, attribution, Options.NONE);
    }

    @Override
    public QuotedBlock withContent(List<Block> content) {
        return new QuotedBlock(content, attribution, options);
    }

    @Override
    public List<Element> children() {
        List<Element> children = new ArrayList<>(content);
        children.addAll(attribution);
        return children;
    }

    @Override
    public QuotedBlock rewriteChildren(ElementRewriter rewriter) {
        return new QuotedBlock(rewriter.rewriteAll(content, Block.class),
                rewriter.rewriteAll(attribution, Span.class), options);
    }
}
