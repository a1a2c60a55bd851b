package org.dxworks.docframe.model.span;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.TextContainer;

import java.util.Objects;

public record Text(String content, Options options) implements Span, TextContainer {

    public Text {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(options, "options");
    }

    public Text(String content) {
        this(content, Options.NONE);
    }
}
