package org.dxworks.docframe;

import java.util.Optional;

public enum OutputFormat {
    HTML("html"),
    DOCBOOK("docbook"),
    PDF("pdf"),
    PRETTY_PRINT("dump");

    private final String name;

    OutputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Optional<OutputFormat> fromName(String name) {
        for (OutputFormat format : values()) {
            if (format.name.equalsIgnoreCase(name) || format.name().equalsIgnoreCase(name)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
