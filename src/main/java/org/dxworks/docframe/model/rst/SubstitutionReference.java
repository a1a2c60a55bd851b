package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Reference;

import java.util.Objects;

public record SubstitutionReference(String name, Options options) implements Reference {

    public SubstitutionReference {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(options, "options");
    }

    public SubstitutionReference(String name) {
        this(name, Options.NONE);
    }

    @Override
    public String source() {
        return "|" + name + "|";
    }
}
