package org.dxworks.docframe.model.block;

/**
 * Numbering style of an enumerated list.
 */
public enum EnumType {
    /** 1, 2, 3 ... */
    ARABIC,
    /** a, b, c ... */
    LOWER_ALPHA,
    /** A, B, C ... */
    UPPER_ALPHA,
    /** i, ii, iii ... */
    LOWER_ROMAN,
    /** I, II, III ... */
    UPPER_ROMAN
}
