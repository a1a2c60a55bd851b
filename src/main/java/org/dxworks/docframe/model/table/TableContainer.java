package org.dxworks.docframe.model.table;

import org.dxworks.docframe.model.ElementContainer;

public interface TableContainer<E extends TableElement, S extends TableContainer<E, S>>
        extends TableElement, ElementContainer<E, S> {
}
