package org.dxworks.docframe.model;

import java.util.List;

/**
 * The root of a document tree.
 */
public record Document(List<Block> content) implements BlockContainer<Document> {

    public Document {
        content = List.copyOf(content);
    }

    @Override
    public Document withContent(List<Block> content) {
        return new Document(content);
    }
}
