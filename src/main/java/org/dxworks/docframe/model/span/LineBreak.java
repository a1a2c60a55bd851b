package org.dxworks.docframe.model.span;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;

import java.util.Objects;

public record LineBreak(Options options) implements Span {

    public LineBreak {
        Objects.requireNonNull(options, "options");
    }

    public LineBreak() {
        this(Options.NONE);
    }
}
