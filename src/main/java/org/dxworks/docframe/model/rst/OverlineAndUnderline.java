package org.dxworks.docframe.model.rst;

import org.dxworks.docframe.model.block.HeaderDecoration;

/**
 * A header decorated with an overline and an underline of the same character. It counts
 * as a different decoration than an underline only with that character.
 */
public record OverlineAndUnderline(char character) implements HeaderDecoration {
}
