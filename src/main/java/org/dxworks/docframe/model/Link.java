package org.dxworks.docframe.model;

/**
 * A resolved link that renderers know how to deal with.
 */
public interface Link extends Span {
}
