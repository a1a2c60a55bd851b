package org.dxworks.docframe.model.link;

/**
 * The label of a footnote definition or reference, see {@link AutoLabel},
 * {@link NumericLabel} and {@link AutonumberLabel}.
 */
public interface FootnoteLabel {
}
