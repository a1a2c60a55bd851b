package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * A single cell, potentially spanning several rows or columns.
 */
public record Cell(CellType type, List<Block> content, int colspan, int rowspan, Options options)
        implements TableElement, BlockContainer<Cell> {

    public Cell {
        Objects.requireNonNull(type, "type");
        content = List.copyOf(content);
        if (colspan < 1 || rowspan < 1) {
            throw new IllegalArgumentException("Cell spans must be at least 1: " + colspan + "x" + rowspan);
        }
        Objects.requireNonNull(options, "options");
    }

    public Cell(CellType type, List<Block> content) {
        this(type, content, 1, 1, Options.NONE);
    }

    @Override
    public Cell withContent(List<Block> content) {
        return new Cell(type, content, colspan, rowspan, options);
    }
}
