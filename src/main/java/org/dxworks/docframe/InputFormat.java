package org.dxworks.docframe;

import java.util.Optional;

public enum InputFormat {
    MARKDOWN("markdown"),
    RESTRUCTURED_TEXT("rst"),
    ASCIIDOC("asciidoc");

    private final String name;

    InputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Optional<InputFormat> fromName(String name) {
        for (InputFormat format : values()) {
            if (format.name.equalsIgnoreCase(name) || format.name().equalsIgnoreCase(name)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
