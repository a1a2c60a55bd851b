package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Link;
import org.dxworks.docframe.model.Options;

import java.util.Objects;

public record CitationLink(String id, String label, Options options) implements Link {

    public CitationLink {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(options, "options");
    }

    public CitationLink(String id, String label) {
        this(id, label, Options.NONE);
    }
}
