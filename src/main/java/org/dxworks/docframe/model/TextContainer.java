package org.dxworks.docframe.model;

/**
 * A leaf element holding a single string.
 */
public interface TextContainer extends Container<String> {
}
