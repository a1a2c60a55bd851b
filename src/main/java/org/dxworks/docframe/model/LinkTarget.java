package org.dxworks.docframe.model;

/**
 * An element references can point to. Its id is unique across all link targets of a document.
 */
public interface LinkTarget extends Customizable {

    /**
     * A copy with other options, used to strip an id that is already taken.
     */
    LinkTarget withOptions(Options options);
}
