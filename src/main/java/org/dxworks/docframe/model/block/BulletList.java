package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.ListContainer;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

public record BulletList(List<BulletListItem> content, BulletFormat format, Options options)
        implements Block, ListContainer<BulletListItem, BulletList> {

    public BulletList {
        content = List.copyOf(content);
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(options, "options");
    }

    public BulletList(List<BulletListItem> content, BulletFormat format) {
        this(content, format, Options.NONE);
    }

    @Override
    public Class<BulletListItem> childType() {
        return BulletListItem.class;
    }

    @Override
    public BulletList withContent(List<BulletListItem> content) {
        return new BulletList(content, format, options);
    }
}
