package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.Options;

import java.util.Objects;

public record Column(Options options) implements TableElement {

    public Column {
        Objects.requireNonNull(options, "options");
    }
}
