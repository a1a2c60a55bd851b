package org.dxworks.docframe.model;

public interface ListItem extends Customizable {
}
