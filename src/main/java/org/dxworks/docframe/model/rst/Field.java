package org.dxworks.docframe.model.rst;

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

public record Field(List<Span> name, List<Block> content, Options options)
        implements ListItem, BlockContainer<Field> {

    public Field {
        name = List.copyOf(name);
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Field(List<Span> name, List<Block> content) {
        this(name, content, Options.NONE);
    }

    @Override
    public Field withContent(List<Block> content) {
        return new Field(name, content, options);
    }

    @Override
    public List<Element> children() {
        List<Element> children = new ArrayList<>(name);
        children.addAll(content);
        return children;
    }

    @Override
    public Field rewriteChildren(ElementRewriter rewriter) {
        return new Field(rewriter.rewriteAll(name, Span.class), rewriter.rewriteAll(content, Block.class), options);
    }
}
