package org.dxworks.docframe.model;

/**
 * Base type for all block level elements.
 */
public interface Block extends Customizable {
}
