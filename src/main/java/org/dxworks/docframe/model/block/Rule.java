package org.dxworks.docframe.model.block;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;

import java.util.Objects;

/**
 * A horizontal rule (transition).
 */
public record Rule(Options options) implements Block {

    public Rule {
        Objects.requireNonNull(options, "options");
    }

    public Rule() {
        this(Options.NONE);
    }
}
