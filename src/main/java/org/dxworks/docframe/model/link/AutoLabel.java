package org.dxworks.docframe.model.link;

/**
 * Labels assigned automatically in document order.
 */
public enum AutoLabel implements FootnoteLabel {
    /** {@code [#]} */
    NUMBER,
    /** {@code [*]} */
    SYMBOL
}
