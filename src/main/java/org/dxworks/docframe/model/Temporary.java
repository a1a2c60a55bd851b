package org.dxworks.docframe.model;

/**
 * Marks an element that only exists in the raw tree produced by a parser.
 * The rewrite phase removes or replaces every temporary element, so renderers never see one.
 */
public interface Temporary extends Element {
}
