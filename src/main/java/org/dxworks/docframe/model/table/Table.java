package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementRewriter;
import org.dxworks.docframe.model.Options;

import java.util.List;
import java.util.Objects;

/**
 * A table with head and body rows and an optional column specification.
 */
public record Table(TableHead head, TableBody body, Columns columns, Options options) implements Block {

    public Table {
        Objects.requireNonNull(head, "head");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(options, "options");
    }

    public Table(TableHead head, TableBody body) {
        this(head, body, new Columns(List.of()), Options.NONE);
    }

    @Override
    public List<Element> children() {
        return List.of(head, body, columns);
    }

    @Override
    public Table rewriteChildren(ElementRewriter rewriter) {
        return new Table(rewriter.rewriteRequired(head, TableHead.class),
                rewriter.rewriteRequired(body, TableBody.class),
                rewriter.rewriteRequired(columns, Columns.class), options);
    }
}
