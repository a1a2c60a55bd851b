package org.dxworks.docframe.model;

/**
 * A container of list items, usually a block itself.
 */
public interface ListContainer<E extends ListItem, S extends ListContainer<E, S>> extends ElementContainer<E, S> {
}
