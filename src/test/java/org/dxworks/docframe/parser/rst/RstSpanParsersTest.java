package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.link.AutoLabel;
import org.dxworks.docframe.model.link.AutonumberLabel;
import org.dxworks.docframe.model.link.CitationReference;
import org.dxworks.docframe.model.link.ExternalLink;
import org.dxworks.docframe.model.link.FootnoteReference;
import org.dxworks.docframe.model.link.InlineTarget;
import org.dxworks.docframe.model.link.LinkReference;
import org.dxworks.docframe.model.link.NumericLabel;
import org.dxworks.docframe.model.rst.InterpretedText;
import org.dxworks.docframe.model.rst.SubstitutionReference;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.Literal;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeout;

public class RstSpanParsersTest {

    private final RstSpanParsers parsers = new RstSpanParsers();

    @Test
    void parse_Emphasis() {
        assertEquals(List.of(new Text("some "), new Emphasized(List.of(new Text("text"))), new Text(" here")),
                parsers.parse("some *text* here"));
    }

    @Test
    void parse_Strong() {
        assertEquals(List.of(new Strong(List.of(new Text("bold")))), parsers.parse("**bold**"));
    }

    @Test
    void parse_StarsBetweenSpacesAreText() {
        assertEquals(List.of(new Text("2 * 3 * 4")), parsers.parse("2 * 3 * 4"));
    }

    @Test
    void parse_InlineLiteral() {
        assertEquals(List.of(new Text("use "), new Literal("x + y"), new Text(" here")),
                parsers.parse("use ``x + y`` here"));
    }

    @Test
    void parse_InterpretedTextWithDefaultRole() {
        assertEquals(List.of(new InterpretedText("title-reference", "Title", "`Title`")), parsers.parse("`Title`"));
    }

    @Test
    void parse_InterpretedTextWithRolePrefix() {
        assertEquals(List.of(new InterpretedText("strong", "x", ":strong:`x`")), parsers.parse(":strong:`x`"));
    }

    @Test
    void parse_InterpretedTextWithRoleSuffix() {
        assertEquals(List.of(new InterpretedText("literal", "x", "`x`:literal:")), parsers.parse("`x`:literal:"));
    }

    @Test
    void parse_SubstitutionReference() {
        assertEquals(List.of(new Text("a "), new SubstitutionReference("name"), new Text(" b")),
                parsers.parse("a |name| b"));
    }

    @Test
    void parse_FootnoteReferences() {
        List<Span> spans = parsers.parse("see [1]_ and [#note]_ or [#]_");

        assertEquals(List.of(
                new Text("see "),
                new FootnoteReference(new NumericLabel(1), "[1]_"),
                new Text(" and "),
                new FootnoteReference(new AutonumberLabel("note"), "[#note]_"),
                new Text(" or "),
                new FootnoteReference(AutoLabel.NUMBER, "[#]_")), spans);
    }

    @Test
    void parse_CitationReference() {
        assertEquals(List.of(new Text("see "), new CitationReference("CIT2002", "[CIT2002]_"), new Text(".")),
                parsers.parse("see [CIT2002]_."));
    }

    @Test
    void parse_SimpleReferenceTakesNameFromPrecedingText() {
        assertEquals(List.of(
                new Text("see "),
                new LinkReference(List.of(new Text("docs")), "docs", "docs_"),
                new Text(" now")), parsers.parse("see docs_ now"));
    }

    @Test
    void parse_PhraseReference() {
        assertEquals(List.of(new LinkReference(List.of(new Text("Some Title")), "some-title", "`Some Title`_")),
                parsers.parse("`Some Title`_"));
    }

    @Test
    void parse_PhraseReferenceWithEmbeddedUri() {
        assertEquals(List.of(new ExternalLink(List.of(new Text("Python")), "http://python.org")),
                parsers.parse("`Python <http://python.org>`_"));
    }

    @Test
    void parse_InlineTarget() {
        assertEquals(List.of(new Text("a "), new InlineTarget("Target", "target")),
                parsers.parse("a _`Target`"));
    }

    @Test
    void parse_EscapedMarkup() {
        assertEquals(List.of(new Text("*not emphasis*")), parsers.parse("\\*not emphasis\\*"));
    }

    @Test
    void parse_UnclosedMarkupIsText() {
        String source = "*open and `tick and |bar";

        assertEquals(List.of(new Text(source)), parsers.parse(source));
    }

    @Test
    void parse_ManyUnclosedBracketsStayText() {
        String text = "[x ".repeat(20000);

        List<Span> spans = assertTimeout(Duration.ofSeconds(5), () -> parsers.parse(text));

        assertEquals(List.of(new Text(text)), spans);
    }
}
