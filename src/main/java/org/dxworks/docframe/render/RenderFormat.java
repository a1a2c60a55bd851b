package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Element;

import java.util.function.Consumer;

/**
 * An output format: the writer it works with and the default rendering of single elements.
 * Implementations render one element and pass its children back to the writer, never
 * rendering them directly.
 */
public interface RenderFormat<W extends OutputWriter<W>> {

    W newWriter(Appendable out, Consumer<Element> render);

    void renderElement(W writer, Element element);
}
