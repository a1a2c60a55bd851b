package org.dxworks.docframe.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;

/**
 * Read-only traversal helpers working on {@link Element#children()}, so they apply to
 * every element type including ones unknown to this library.
 */
public final class ElementTraversal {

    private ElementTraversal() {
        // utility class
    }

    /**
     * All elements of the tree in document order, the root first.
     */
    public static Stream<Element> stream(Element root) {
        List<Element> result = new ArrayList<>();
        Deque<Element> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Element current = pending.pop();
            result.add(current);
            List<Element> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return result.stream();
    }

    public static <T> List<T> collect(Element root, Class<T> type) {
        return stream(root).filter(type::isInstance).map(type::cast).toList();
    }
}
