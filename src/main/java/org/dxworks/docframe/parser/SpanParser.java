package org.dxworks.docframe.parser;

/**
 * Parses one inline element starting right after its trigger character.
 *
 * @param <E> the kind of result, a span or plain text for nested text parsing
 */
@FunctionalInterface
public interface SpanParser<E> {

    /**
     * @param source  the complete input
     * @param offset  index of the first character after the trigger character
     * @param pending the plain text collected since the last element, for parsers that
     *                need to look back (it never reaches into an earlier element)
     * @return the match, or {@code null} when the input at this position is not this kind of element
     */
    SpanMatch<E> parse(String source, int offset, CharSequence pending);
}
