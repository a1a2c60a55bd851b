package org.dxworks.docframe.model;

import java.util.Objects;

/**
 * A message produced while parsing or rewriting, usually placed next to the element that
 * caused it. It is both a span and a block so it fits into either kind of sequence.
 */
public record SystemMessage(MessageLevel level, String content, Options options) implements Span, Block, TextContainer {

    public SystemMessage {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(options, "options");
    }

    public SystemMessage(MessageLevel level, String content) {
        this(level, content, Options.NONE);
    }
}
