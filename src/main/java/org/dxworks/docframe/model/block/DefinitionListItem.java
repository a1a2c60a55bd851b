package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementRewriter;
import org.dxworks.docframe.model.ListItem;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single term with its definition as content.
 */
public record DefinitionListItem(List<Span> term, List<Block> content, Options options)
        implements ListItem, BlockContainer<DefinitionListItem> {

    public DefinitionListItem {
        term = List.copyOf(term);
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public DefinitionListItem(List<Span> term, List<Block> content) {
        this(term, content, Options.NONE);
    }

    @Override
    public DefinitionListItem withContent(List<Block> content) {
        return new DefinitionListItem(term, content, options);
    }

    @Override
    public List<Element> children() {
        List<Element> children = new ArrayList<>(term);
        children.addAll(content);
        return children;
    }

    @Override
    public DefinitionListItem rewriteChildren(ElementRewriter rewriter) {
        return new DefinitionListItem(rewriter.rewriteAll(term, Span.class),
                rewriter.rewriteAll(content, Block.class), options);
    }
}
