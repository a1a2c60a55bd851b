package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.ListContainer;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

public record EnumList(List<EnumListItem> content, EnumFormat format, int start, Options options)
        implements Block, ListContainer<EnumListItem, EnumList> {

    public EnumList {
        content = List.copyOf(content);
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(options, "options");
    }

    public EnumList(List<EnumListItem> content, EnumFormat format, int start) {
        this(content, format, start, Options.NONE);
    }

    @Override
    public Class<EnumListItem> childType() {
        return EnumListItem.class;
    }

    @Override
    public EnumList withContent(List<EnumListItem> content) {
        return new EnumList(content, format, start, options);
    }
}
