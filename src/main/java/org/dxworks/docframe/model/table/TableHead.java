package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

public record TableHead(List<Row> content, Options options) implements TableContainer<Row, TableHead> {

    public TableHead {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public TableHead(List<Row> content) {
        this(content, Options.NONE);
    }

    @Override
    public Class<Row> childType() {
        return Row.class;
    }

    @Override
    public TableHead withContent(List<Row> content) {
        return new TableHead(content, options);
    }
}
