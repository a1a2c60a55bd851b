package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementRewriter;
import org.dxworks.docframe.model.ListItem;
import org.dxworks.docframe.model.Options;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One or more synonymous options, like {@code -o FILE, --output=FILE}, and their description.
 */
public record OptionListItem(List<ProgramOption> programOptions, List<Block> content, Options options)
        implements ListItem, BlockContainer<OptionListItem> {

    public OptionListItem {
        programOptions = List.copyOf(programOptions);
        if (programOptions.isEmpty()) throw new IllegalArgumentException("An option list item needs at least one option");
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public OptionListItem(List<ProgramOption> programOptions, List<Block> content) {
        this(programOptions, content, Options.NONE);
    }

    @Override
    public OptionListItem withContent(List<Block> content) {
        return new OptionListItem(programOptions, content, options);
    }

    @Override
    public List<Element> children() {
        List<Element> children = new ArrayList<>(programOptions);
        children.addAll(content);
        return children;
    }

    @Override
    public OptionListItem rewriteChildren(ElementRewriter rewriter) {
        return new OptionListItem(rewriter.rewriteAll(programOptions, ProgramOption.class),
                rewriter.rewriteAll(content, Block.class), options);
    }
}
