package org.dxworks.docframe.rewrite;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.ElementTraversal;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.block.InvalidBlock;
import org.dxworks.docframe.model.block.Paragraph;
import org.dxworks.docframe.model.link.CitationLink;
import org.dxworks.docframe.model.link.ExternalLink;
import org.dxworks.docframe.model.link.ExternalLinkDefinition;
import org.dxworks.docframe.model.link.Footnote;
import org.dxworks.docframe.model.link.FootnoteLink;
import org.dxworks.docframe.model.link.Image;
import org.dxworks.docframe.model.link.ImageReference;
import org.dxworks.docframe.model.link.InlineTarget;
import org.dxworks.docframe.model.link.InternalLink;
import org.dxworks.docframe.model.link.InternalLinkTarget;
import org.dxworks.docframe.model.span.InvalidSpan;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.parser.RawDocument;
import org.dxworks.docframe.parser.rst.RstParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

public class LinkResolverTest {

    private static Document resolve(String source) {
        return RewriteEngine.rewrite(new RstParser().parse(source));
    }

    private static List<Span> firstParagraph(Document document) {
        return ElementTraversal.collect(document, Paragraph.class).get(0).content();
    }

    @Test
    void resolve_ExternalLinkDefinition() {
        Document document = resolve("See Python_ for details.\n\n.. _Python: http://www.python.org\n");

        assertEquals(1, document.content().size());
        assertEquals(List.of(
                new Text("See "),
                new ExternalLink(List.of(new Text("Python")), "http://www.python.org"),
                new Text(" for details.")), firstParagraph(document));
    }

    @Test
    void resolve_AliasChain() {
        String source = "Go to docs_.\n\n.. _docs: manual_\n.. _manual: http://example.org/manual\n";

        ExternalLink link = ElementTraversal.collect(resolve(source), ExternalLink.class).get(0);

        assertEquals("http://example.org/manual", link.url());
    }

    @Test
    void resolve_CircularAlias() {
        String source = "Go to a_.\n\n.. _a: b_\n.. _b: a_\n";

        InvalidSpan invalid = ElementTraversal.collect(resolve(source), InvalidSpan.class).get(0);

        assertEquals("circular link reference: a", invalid.message().content());
        assertEquals(new Text("a_"), invalid.fallback());
    }

    @Test
    void resolve_UnresolvedLinkReference() {
        InvalidSpan invalid = assertInstanceOf(InvalidSpan.class,
                firstParagraph(resolve("See Missing_ here.\n")).get(1));

        assertEquals(MessageLevel.ERROR, invalid.message().level());
        assertEquals("unresolved link reference: missing", invalid.message().content());
        assertEquals(new Text("Missing_"), invalid.fallback());
    }

    @Test
    void resolve_InternalTarget() {
        String source = ".. _anchor:\n\nSome text.\n\nGo to anchor_.\n";

        Document document = resolve(source);

        assertEquals(InternalLinkTarget.withId("anchor"), document.content().get(0));
        InternalLink link = ElementTraversal.collect(document, InternalLink.class).get(0);
        assertEquals("anchor", link.targetId());
    }

    @Test
    void resolve_LinkToHeader() {
        String source = "Getting Started\n===============\n\nSee `Getting Started`_.\n";

        InternalLink link = ElementTraversal.collect(resolve(source), InternalLink.class).get(0);

        assertEquals("getting-started", link.targetId());
    }

    @Test
    void resolve_DuplicateTargetBecomesInvalid() {
        Document document = resolve(".. _dup:\n\npara\n\n.. _dup:\n\npara2\n");

        List<Block> blocks = document.content();
        assertEquals(InternalLinkTarget.withId("dup"), blocks.get(0));
        InvalidBlock invalid = assertInstanceOf(InvalidBlock.class, blocks.get(2));
        assertEquals("duplicate target id: dup", invalid.message().content());
        assertEquals(new InternalLinkTarget(Options.NONE), invalid.fallback());
    }

    @Test
    void resolve_InlineTarget() {
        Document document = resolve("A _`Point` here.\n\nSee Point_.\n");

        assertEquals(new InlineTarget("Point", "point"), firstParagraph(document).get(1));
        assertEquals("point", ElementTraversal.collect(document, InternalLink.class).get(0).targetId());
    }

    @Test
    void resolve_InlineTargetWithTakenId() {
        Document document = resolve(".. _intro:\n\nSee _`intro` here.\n");

        assertEquals(InternalLinkTarget.withId("intro"), document.content().get(0));
        InvalidSpan invalid = assertInstanceOf(InvalidSpan.class, firstParagraph(document).get(1));
        assertEquals("duplicate target id: intro", invalid.message().content());
        assertEquals(new InlineTarget("intro", Options.NONE), invalid.fallback());
    }

    @Test
    void resolve_AutoNumberedFootnotes() {
        String source = "Text [#]_ and [#]_.\n\n.. [#] First.\n.. [#] Second.\n";

        Document document = resolve(source);

        assertEquals(List.of(new FootnoteLink("footnote-1", "1"), new FootnoteLink("footnote-2", "2")),
                ElementTraversal.collect(document, FootnoteLink.class));
        List<Footnote> footnotes = ElementTraversal.collect(document, Footnote.class);
        assertEquals(2, footnotes.size());
        assertEquals("1", footnotes.get(0).label());
        assertEquals(Options.id("footnote-1"), footnotes.get(0).options());
        assertEquals("2", footnotes.get(1).label());
    }

    @Test
    void resolve_NumberedFootnotesSkipExplicitNumbers() {
        String source = "A [1]_ and [#]_.\n\n.. [1] Explicit.\n.. [#] Automatic.\n";

        List<FootnoteLink> links = ElementTraversal.collect(resolve(source), FootnoteLink.class);

        assertEquals(List.of(new FootnoteLink("footnote-1", "1"), new FootnoteLink("footnote-2", "2")), links);
    }

    @Test
    void resolve_NamedAndSymbolFootnotes() {
        String source = "A [#note]_ and [*]_.\n\n.. [#note] Named.\n.. [*] Symbol.\n";

        List<FootnoteLink> links = ElementTraversal.collect(resolve(source), FootnoteLink.class);

        assertEquals(List.of(new FootnoteLink("note", "1"), new FootnoteLink("footnote-s1", "*")), links);
    }

    @Test
    void resolve_UnresolvedFootnote() {
        InvalidSpan invalid = ElementTraversal.collect(resolve("A [3]_.\n"), InvalidSpan.class).get(0);

        assertEquals("unresolved footnote reference: [3]_", invalid.message().content());
    }

    @Test
    void resolve_Citation() {
        String source = "See [CIT2002]_.\n\n.. [CIT2002] A citation.\n";

        assertEquals(List.of(new CitationLink("cit2002", "CIT2002")),
                ElementTraversal.collect(resolve(source), CitationLink.class));
    }

    @Test
    void resolve_ImageReference() {
        Document document = new Document(List.of(
                new Paragraph(List.of(new ImageReference("logo", "logo", "logo_"), new ImageReference("x", "x", "x_"))),
                new ExternalLinkDefinition("logo", "logo.png")));

        List<Span> spans = firstParagraph(RewriteEngine.rewrite(new RawDocument(document)));

        assertEquals(new Image("logo", "logo.png"), spans.get(0));
        InvalidSpan invalid = assertInstanceOf(InvalidSpan.class, spans.get(1));
        assertEquals("unresolved link reference: x", invalid.message().content());
    }

    @Test
    void symbol_RepeatsAfterTen() {
        assertEquals("*", LinkResolver.symbol(0));
        assertEquals("♣", LinkResolver.symbol(9));
        assertEquals("**", LinkResolver.symbol(10));
    }
}
