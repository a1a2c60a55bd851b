package org.dxworks.docframe.model;

public interface BlockContainer<S extends BlockContainer<S>> extends ElementContainer<Block, S> {

    @Override
    default Class<Block> childType() {
        return Block.class;
    }
}
