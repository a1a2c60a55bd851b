package org.dxworks.docframe.parser.rst;

import java.util.List;

@FunctionalInterface
interface BlockParser {

    /**
     * @return the block starting at line {@code pos}, or {@code null} if this parser does not apply
     */
    BlockMatch parse(List<String> lines, int pos);
}
