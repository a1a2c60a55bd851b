package org.dxworks.docframe.parser;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.docframe.parser.InlineParsers.EndDelimiter.literal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class InlineParsersTest {

    private static final SpanParser<Span> BANG = (source, offset, pending) -> {
        String before = pending.toString();
        String word = before.substring(before.lastIndexOf(' ') + 1);
        if (word.isEmpty()) return null;
        return new SpanMatch<>(new Strong(List.of(new Text(word))), offset, word.length());
    };

    private static final SpanParser<Span> PLUS = (source, offset, pending) -> {
        SpanMatch<String> text = InlineParsers.parseText(source, offset, literal("+"), Map.of());
        if (text == null) return null;
        return SpanMatch.of(new Emphasized(List.of(new Text(text.element()))), text.end());
    };

    @Test
    void parseText_StopsAtDelimiter() {
        SpanMatch<String> match = InlineParsers.parseText("abc]def", 0, literal("]"), Map.of());

        assertEquals("abc", match.element());
        assertEquals(4, match.end());
    }

    @Test
    void parseText_DelimiterAtStartIsContent() {
        SpanMatch<String> match = InlineParsers.parseText("]x]", 0, literal("]"), Map.of());

        assertEquals("]x", match.element());
        assertEquals(3, match.end());
    }

    @Test
    void parseText_MissingDelimiter() {
        assertNull(InlineParsers.parseText("no end", 0, literal("]"), Map.of()));
    }

    @Test
    void parseSpans_FailedParserKeepsTrigger() {
        List<Span> spans = InlineParsers.parseSpans("a +b c", Map.of('+', PLUS));

        assertEquals(List.of(new Text("a +b c")), spans);
    }

    @Test
    void parseSpans_MixesTextAndElements() {
        List<Span> spans = InlineParsers.parseSpans("a +b+ c", Map.of('+', PLUS));

        assertEquals(List.of(new Text("a "), new Emphasized(List.of(new Text("b"))), new Text(" c")), spans);
    }

    @Test
    void parseSpans_ParserTakesPendingText() {
        List<Span> spans = InlineParsers.parseSpans("say hello!", Map.of('!', BANG));

        assertEquals(List.of(new Text("say "), new Strong(List.of(new Text("hello")))), spans);
    }

    @Test
    void mergeAdjacentText_KeepsStyledText() {
        Text styled = new Text("c", Options.withStyles("x"));
        List<Span> merged = ResultBuilder.SpanBuilder.mergeAdjacentText(List.of(
                new Text("a"), new Text("b"), new Strong(List.of()), styled));

        assertEquals(List.of(new Text("ab"), new Strong(List.of()), styled), merged);
    }

    @Test
    void referenceNames_ToId() {
        assertEquals("getting-started", ReferenceNames.toId("Getting Started!"));
        assertEquals("a-b", ReferenceNames.toId("  A  b "));
    }
}
