package org.dxworks.docframe.model.link;

public record NumericLabel(int number) implements FootnoteLabel {
}
