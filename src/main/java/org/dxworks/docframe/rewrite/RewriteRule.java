package org.dxworks.docframe.rewrite;

import org.dxworks.docframe.model.Element;

/**
 * A partial substitution over elements. Rules are tried in order for every element of
 * the tree and the first one returning a matched action wins.
 */
@FunctionalInterface
public interface RewriteRule {

    RewriteAction apply(Element element);
}
