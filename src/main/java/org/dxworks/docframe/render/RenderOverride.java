package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Element;

/**
 * Custom rendering for some elements, tried before the default rendering of the format.
 */
@FunctionalInterface
public interface RenderOverride<W extends OutputWriter<W>> {

    /**
     * @return {@code true} if the element was rendered, {@code false} to fall back to the format
     */
    boolean render(W writer, Element element);
}
