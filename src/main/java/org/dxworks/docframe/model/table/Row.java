package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * A table row. When cells of previous rows span several rows, it holds fewer cells
 * than the table has columns.
 */
public record Row(List<Cell> content, Options options) implements TableContainer<Cell, Row> {

    public Row {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public Row(List<Cell> content) {
        this(content, Options.NONE);
    }

    @Override
    public Class<Cell> childType() {
        return Cell.class;
    }

    @Override
    public Row withContent(List<Cell> content) {
        return new Row(content, options);
    }
}
