package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.ListContainer;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * A list of command line options with their descriptions.
 */
public record OptionList(List<OptionListItem> content, Options options)
        implements Block, ListContainer<OptionListItem, OptionList> {

    public OptionList {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public OptionList(List<OptionListItem> content) {
        this(content, Options.NONE);
    }

    @Override
    public Class<OptionListItem> childType() {
        return OptionListItem.class;
    }

    @Override
    public OptionList withContent(List<OptionListItem> content) {
        return new OptionList(content, options);
    }
}
