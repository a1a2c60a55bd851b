package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.ListContainer;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * A list of {@code :name: body} fields, like bibliographic fields or directive options.
 */
public record FieldList(List<Field> content, Options options) implements Block, ListContainer<Field, FieldList> {

    public FieldList {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public FieldList(List<Field> content) {
        this(content, Options.NONE);
    }

    @Override
    public Class<Field> childType() {
        return Field.class;
    }

    @Override
    public FieldList withContent(List<Field> content) {
        return new FieldList(content, options);
    }
}
