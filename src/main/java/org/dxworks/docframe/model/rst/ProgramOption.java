package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Element;

import java.util.Objects;

/**
 * A single option of an option list item.
 *
 * @param name      the option with its prefix, like {@code -a}, {@code --all} or {@code /V}
 * @param delimiter the text between name and argument, a space or {@code =}; {@code null} without argument
 * @param argument  the argument placeholder, {@code null} when the option takes none
 */
public record ProgramOption(String name, String delimiter, String argument) implements Element {

    public ProgramOption {
        Objects.requireNonNull(name, "name");
        if ((delimiter == null) != (argument == null)) {
            throw new IllegalArgumentException("Delimiter and argument have to be given together");
        }
    }

    public ProgramOption(String name) {
        this(name, null, null);
    }
}
