package org.dxworks.docframe.model;

import java.util.List;

/**
 * An element that could not be parsed or resolved. Renderers show the fallback, the
 * message or both, depending on the message level they are configured with.
 */
public interface Invalid<E extends Element> extends Element {

    SystemMessage message();

    E fallback();

    @Override
    default List<Element> children() {
        return List.of(message(), fallback());
    }
}
