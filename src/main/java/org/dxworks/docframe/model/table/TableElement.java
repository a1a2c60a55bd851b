package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.Customizable;

/**
 * A part of a table, like a row, a cell or a column.
 */
public interface TableElement extends Customizable {
}
