package org.dxworks.docframe.parser;

public interface MarkupParser {

    /**
     * Parses the whole input. Markup that is not recognized ends up as plain text, so
     * this never fails for any input.
     */
    RawDocument parse(String source);
}
