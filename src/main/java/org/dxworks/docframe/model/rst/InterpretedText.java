package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Reference;
import org.dxworks.docframe.model.TextContainer;

import java.util.Objects;

/**
 * Text with a role, {@code :role:`text`} or {@code `text`:role:}. The role is looked up
 * during rewriting and turns the text into a span.
 */
public record InterpretedText(String role, String content, String source, Options options)
        implements Reference, TextContainer {

    public InterpretedText {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
    }

    public InterpretedText(String role, String content, String source) {
        this(role, content, source, Options.NONE);
    }
}
