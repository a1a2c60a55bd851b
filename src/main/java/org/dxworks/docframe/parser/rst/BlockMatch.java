package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Block;

/**
 * A parsed block and the index of the first line after it.
 */
record BlockMatch(Block block, int next) {
}
