package org.dxworks.docframe.model.block;

/**
 * The decoration of a {@link DecoratedHeader}. Concrete decorations are provided by the parsers.
 */
public interface HeaderDecoration {
}
