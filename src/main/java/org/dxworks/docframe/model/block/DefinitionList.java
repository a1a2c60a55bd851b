package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.ListContainer;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * A list of terms and their definitions.
 */
public record DefinitionList(List<DefinitionListItem> content, Options options)
        implements Block, ListContainer<DefinitionListItem, DefinitionList> {

    public DefinitionList {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public DefinitionList(List<DefinitionListItem> content) {
        this(content, Options.NONE);
    }

    @Override
    public Class<DefinitionListItem> childType() {
        return DefinitionListItem.class;
    }

    @Override
    public DefinitionList withContent(List<DefinitionListItem> content) {
        return new DefinitionList(content, options);
    }
}
