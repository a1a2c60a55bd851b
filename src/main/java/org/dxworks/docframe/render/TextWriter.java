package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Element;

import java.util.function.Consumer;

/**
 * Plain text output indented with {@code ". "} per level.
 */
public class TextWriter extends OutputWriter<TextWriter> {

    public TextWriter(Appendable out, Consumer<Element> render) {
        super(out, render, ". ");
    }

    @Override
    protected TextWriter self() {
        return this;
    }
}
