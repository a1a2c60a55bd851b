package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Reference;

import java.util.Objects;

public record ImageReference(String text, String id, String source, Options options) implements Reference {

    public ImageReference {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
    }

    public ImageReference(String text, String id, String source) {
        this(text, id, source, Options.NONE);
    }
}
