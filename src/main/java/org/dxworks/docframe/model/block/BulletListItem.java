package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.ListItem;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

public record BulletListItem(List<Block> content, BulletFormat format, Options options)
        implements ListItem, BlockContainer<BulletListItem> {

    public BulletListItem {
        content = List.copyOf(content);
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(options, "options");
    }

    public BulletListItem(List<Block> content, BulletFormat format) {
        this(content, format, Options.NONE);
    }

    @Override
    public BulletListItem withContent(List<Block> content) {
        return new BulletListItem(content, format, options);
    }
}
