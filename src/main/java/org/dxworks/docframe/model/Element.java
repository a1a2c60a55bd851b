package org.dxworks.docframe.model;

import java.util.List;

/**
 * Base type of every node in the document tree.
 * <p>
 * The catalogue of element types is open. Renderers and rewrite rules have to expect
 * types they do not know and deal with them through {@link #children()} and, for
 * {@link Customizable} elements, the fallback carried in their {@link Options}.
 */
public interface Element {

    /**
     * All element-valued children in document order.
     */
    default List<Element> children() {
        return List.of();
    }

    /**
     * Returns a copy of this element with every child passed through the rewriter,
     * or this element itself when it has no children to rewrite.
     */
    default Element rewriteChildren(ElementRewriter rewriter) {
        return this;
    }
}
