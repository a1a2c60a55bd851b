package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.Options;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The column specification of a table.
 */
public record Columns(List<Column> content, Options options) implements TableContainer<Column, Columns> {

    public Columns {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Columns(List<Column> content) {
        this(content, Options.NONE);
    }

    public static Columns options(Options... columnOptions) {
        return new Columns(Arrays.stream(columnOptions).map(Column::new).toList());
    }

    @Override
    public Class<Column> childType() {
        return Column.class;
    }

    @Override
    public Columns withContent(List<Column> content) {
        return new Columns(content, options);
    }
}
