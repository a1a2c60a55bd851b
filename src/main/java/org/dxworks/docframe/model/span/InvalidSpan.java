package org.dxworks.docframe.model.span;

import org.dxworks.docframe.model.Invalid;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SystemMessage;

import java.util.Objects;

/**
 * Groups a span that could not be parsed or resolved with a system message.
 */
public record InvalidSpan(SystemMessage message, Span fallback, Options options) implements Span, Invalid<Span> {

    public InvalidSpan {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(fallback, "fallback");
        Objects.requireNonNull(options, "options");
    }

    public InvalidSpan(SystemMessage message, Span fallback) {
        this(message, fallback, Options.NONE);
    }

    /**
     * An error level invalid span showing the given source text as fallback.
     */
    public static InvalidSpan error(String message, String fallbackText) {
        return new InvalidSpan(new SystemMessage(MessageLevel.ERROR, message), new Text(fallbackText));
    }
}
