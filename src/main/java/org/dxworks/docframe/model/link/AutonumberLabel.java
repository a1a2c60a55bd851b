package org.dxworks.docframe.model.link;

import java.util.Objects;

/**
 * Automatic numbering combined with an explicit name, {@code [#name]}.
 */
public record AutonumberLabel(String label) implements FootnoteLabel {

    public AutonumberLabel {
        Objects.requireNonNull(label, "label");
    }
}
