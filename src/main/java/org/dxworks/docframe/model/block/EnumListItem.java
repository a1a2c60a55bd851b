package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.ListItem;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

public record EnumListItem(List<Block> content, EnumFormat format, int position, Options options)
        implements ListItem, BlockContainer<EnumListItem> {

    public EnumListItem {
        content = List.copyOf(content);
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(options, "options");
    }

    public EnumListItem(List<Block> content, EnumFormat format, int position) {
        this(content, format, position, Options.NONE);
    }

    @Override
    public EnumListItem withContent(List<Block> content) {
        return new EnumListItem(content, format, position, options);
    }
}
