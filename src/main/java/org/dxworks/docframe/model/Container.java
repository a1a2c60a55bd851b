package org.dxworks.docframe.model;

public interface Container<T> extends Element {
    T content();
}
