package org.dxworks.docframe.model;

/**
 * A temporary block that defines something references can be resolved against.
 */
public interface Definition extends Block, Temporary {
}
