package org.dxworks.docframe.model.table;

/**
 * The part of the table a cell belongs to.
 */
public enum CellType {
    HEAD,
    BODY
}
