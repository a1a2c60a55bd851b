package org.dxworks.docframe.model;

public interface SpanContainer<S extends SpanContainer<S>> extends ElementContainer<Span, S> {

    @Override
    default Class<Span> childType() {
        return Span.class;
    }
}
