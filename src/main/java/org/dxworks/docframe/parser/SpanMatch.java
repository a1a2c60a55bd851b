package org.dxworks.docframe.parser;

/**
 * A successful {@link SpanParser} result.
 *
 * @param end            index after the last character consumed
 * @param consumedBefore number of characters taken from the end of the pending text
 */
public record SpanMatch<E>(E element, int end, int consumedBefore) {

    public SpanMatch {
        if (consumedBefore < 0) throw new IllegalArgumentException("consumedBefore must not be negative");
    }

    public static <E> SpanMatch<E> of(E element, int end) {
        return new SpanMatch<>(element, end, 0);
    }
}
