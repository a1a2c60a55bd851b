package org.dxworks.docframe.model;

import java.util.Collections;
import java.util.List;

/**
 * An element holding an ordered sequence of children of one kind.
 * <p>
 * Traversal and rewriting are implemented here once for every container; concrete
 * elements only provide {@link #withContent(List)} and, when they hold element-valued
 * fields besides their content, override {@link #children()} and {@link #rewriteChildren}.
 *
 * @param <E> the kind of the children
 * @param <S> the concrete container type
 */
public interface ElementContainer<E extends Element, S extends ElementContainer<E, S>> extends Container<List<E>> {

    /**
     * The runtime kind of the children, used to check replacements during rewriting.
     */
    Class<E> childType();

    S withContent(List<E> content);

    @Override
    default List<Element> children() {
        return Collections.unmodifiableList(content());
    }

    @Override
    default Element rewriteChildren(ElementRewriter rewriter) {
        return withContent(rewriter.rewriteAll(content(), childType()));
    }
}
