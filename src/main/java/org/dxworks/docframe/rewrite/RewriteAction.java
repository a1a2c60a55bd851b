package org.dxworks.docframe.rewrite;

import org.dxworks.docframe.model.Element;

import java.util.Objects;

/**
 * The outcome of applying a {@link RewriteRule} to one element.
 */
public final class RewriteAction {

    enum Kind { UNMATCHED, REPLACE, EXPAND, REMOVE }

    private static final RewriteAction UNMATCHED = new RewriteAction(Kind.UNMATCHED, null);
    private static final RewriteAction REMOVE = new RewriteAction(Kind.REMOVE, null);

    private final Kind kind;
    private final Element replacement;

    private RewriteAction(Kind kind, Element replacement) {
        this.kind = kind;
        this.replacement = replacement;
    }

    /** The rule does not apply, the next rule is tried. */
    public static RewriteAction unmatched() {
        return UNMATCHED;
    }

    /** Replaces the element. The replacement is taken as it is. */
    public static RewriteAction replace(Element replacement) {
        return new RewriteAction(Kind.REPLACE, Objects.requireNonNull(replacement, "replacement"));
    }

    /**
     * Replaces the element with one whose children still have to be rewritten, for
     * replacements holding content that comes from elsewhere in the document.
     */
    public static RewriteAction expand(Element replacement) {
        return new RewriteAction(Kind.EXPAND, Objects.requireNonNull(replacement, "replacement"));
    }

    public static RewriteAction remove() {
        return REMOVE;
    }

    Kind kind() {
        return kind;
    }

    Element replacement() {
        return replacement;
    }

    public boolean isMatched() {
        return kind != Kind.UNMATCHED;
    }

    @Override
    public String toString() {
        return replacement == null ? kind.name() : kind + "(" + replacement + ")";
    }
}
