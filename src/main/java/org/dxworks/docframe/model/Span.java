package org.dxworks.docframe.model;

/**
 * Base type for all inline elements.
 */
public interface Span extends Customizable {
}
