package org.dxworks.docframe.parser;

import org.dxworks.docframe.model.Span;

import java.util.List;
import java.util.Map;

/**
 * The inline engine shared by all markup dialects.
 * <p>
 * Input is scanned as runs of plain text up to the next character that has a parser in the
 * dispatch map. That parser is tried right after the trigger character; when it fails the
 * trigger is kept as plain text and scanning continues with the next character. Parsing
 * therefore never fails and every input character ends up either in an element or in text.
 */
public final class InlineParsers {

    private InlineParsers() {
        // utility class
    }

    /**
     * Recognizes the end of a nested text run.
     */
    @FunctionalInterface
    public interface EndDelimiter {

        /**
         * @return the length of the delimiter found at {@code index}, or -1 when there is none
         */
        int match(String source, int index);

        static EndDelimiter literal(String delimiter) {
            return (source, index) -> source.startsWith(delimiter, index) ? delimiter.length() : -1;
        }
    }

    public static List<Span> parseSpans(String source, Map<Character, ? extends SpanParser<? extends Span>> parsers) {
        return parse(source, 0, parsers, new ResultBuilder.SpanBuilder());
    }

    /**
     * Parses from {@code start} to the end of the source.
     */
    public static <E, R> R parse(String source, int start,
                                 Map<Character, ? extends SpanParser<? extends E>> parsers,
                                 ResultBuilder<E, R> builder) {
        int i = start;
        while (i < source.length()) {
            i = step(source, i, parsers, builder);
        }
        return builder.result();
    }

    /**
     * Parses text up to the given delimiter, with the nested parsers applied to the text
     * in between (usually only escapes). The text is never empty: a delimiter directly at
     * {@code start} is taken as content.
     *
     * @return the text and the index after the delimiter, or {@code null} when the delimiter does not occur
     */
    public static SpanMatch<String> parseText(String source, int start, EndDelimiter end,
                                              Map<Character, ? extends SpanParser<String>> nested) {
        ResultBuilder.TextBuilder builder = new ResultBuilder.TextBuilder();
        int i = start;
        while (i < source.length()) {
            if (i > start) {
                int length = end.match(source, i);
                if (length >= 0) return SpanMatch.of(builder.result(), i + length);
            }
            i = step(source, i, nested, builder);
        }
        return null;
    }

    private static <E, R> int step(String source, int i,
                                   Map<Character, ? extends SpanParser<? extends E>> parsers,
                                   ResultBuilder<E, R> builder) {
        char c = source.charAt(i);
        SpanParser<? extends E> parser = parsers.get(c);
        if (parser != null) {
            SpanMatch<? extends E> match = parser.parse(source, i + 1, builder.pending());
            if (match != null && match.end() > i) {
                builder.dropPending(match.consumedBefore());
                builder.add(match.element());
                return match.end();
            }
        }
        builder.addText(c);
        return i + 1;
    }
}
