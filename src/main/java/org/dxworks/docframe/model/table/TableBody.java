package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

public record TableBody(List<Row> content, Options options) implements TableContainer<Row, TableBody> {

    public TableBody {
        content = List.copyOf(content);
        Objects.requireNonNull(options, "options");
    }

    public TableBody(List<Row> content) {
        this(content, Options.NONE);
    }

    @Override
    public Class<Row> childType() {
        return Row.class;
    }

    @Override
    public TableBody withContent(List<Row> content) {
        return new TableBody(content, options);
    }
}
