package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Definition;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;

import java.util.Objects;
import java.util.function.Function;

/**
 * A text role defined by a {@code role} directive in the document.
 */
public record CustomizedTextRole(String name, Function<String, Span> roleFunction, Options options)
        implements Definition {

    public CustomizedTextRole {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(roleFunction, "roleFunction");
        Objects.requireNonNull(options, "options");
    }

    public CustomizedTextRole(String name, Function<String, Span> roleFunction) {
        this(name, roleFunction, Options.NONE);
    }
}
