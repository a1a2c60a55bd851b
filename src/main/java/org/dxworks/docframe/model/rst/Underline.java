package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.block.HeaderDecoration;

/**
 * A header decorated with an underline only.
 */
public record Underline(char character) implements HeaderDecoration {
}
