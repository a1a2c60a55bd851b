package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Reference;

import java.util.Objects;

public record CitationReference(String label, String source, Options options) implements Reference {

    public CitationReference {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
    }

    public CitationReference(String label, String source) {
        this(label, source, Options.NONE);
    }
}
