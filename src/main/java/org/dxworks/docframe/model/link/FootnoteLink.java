package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Link;
import org.dxworks.docframe.model.Options;

import java.util.Objects;

public record FootnoteLink(String id, String label, Options options) implements Link {

    public FootnoteLink {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(options, "options");
    }

    public FootnoteLink(String id, String label) {
        this(id, label, Options.NONE);
    }
}
