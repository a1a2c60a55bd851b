package org.dxworks.docframe.model;

/**
 * An element carrying {@link Options} (id, styles, fallback).
 */
public interface Customizable extends Element {
    Options options();
}
