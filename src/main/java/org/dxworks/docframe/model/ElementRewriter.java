package org.dxworks.docframe.model;

import java.util.List;

/**
 * Callback through which containers hand their children to the rewrite phase.
 */
public interface ElementRewriter {

    /**
     * Rewrites each element of the list. Elements removed by a rule are dropped,
     * the order of the remaining ones is preserved.
     *
     * @throws IllegalStateException if a rule replaced an element with one that is not of the given kind
     */
    <E extends Element> List<E> rewriteAll(List<E> elements, Class<E> kind);

    /**
     * Rewrites a child that has to stay in place, like the header of a section.
     *
     * @throws IllegalStateException if a rule removed the element or changed its kind
     */
    <E extends Element> E rewriteRequired(E element, Class<E> kind);
}
