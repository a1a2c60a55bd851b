package org.dxworks.docframe.parser.markdown;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.ElementTraversal;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.block.BulletList;
import org.dxworks.docframe.model.block.EnumList;
import org.dxworks.docframe.model.block.Header;
import org.dxworks.docframe.model.block.InvalidBlock;
import org.dxworks.docframe.model.block.LiteralBlock;
import org.dxworks.docframe.model.block.Paragraph;
import org.dxworks.docframe.model.block.QuotedBlock;
import org.dxworks.docframe.model.block.Rule;
import org.dxworks.docframe.model.block.Section;
import org.dxworks.docframe.model.block.StringBullet;
import org.dxworks.docframe.model.link.ExternalLink;
import org.dxworks.docframe.model.link.Image;
import org.dxworks.docframe.model.link.InternalLink;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.Literal;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.model.table.CellType;
import org.dxworks.docframe.model.table.Table;
import org.dxworks.docframe.rewrite.RewriteEngine;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkdownParserTest {

    private final MarkdownParser parser = new MarkdownParser();

    private List<Block> parse(String source) {
        return parser.parse(source).document().content();
    }

    @Test
    void parse_HeadingAndInlineMarkup() {
        List<Block> blocks = parse("# Title\n\nSome *em* and **strong** `code`.\n");

        assertEquals(List.of(
                new Header(1, List.of(new Text("Title")), Options.id("title")),
                new Paragraph(List.of(
                        new Text("Some "),
                        new Emphasized(List.of(new Text("em"))),
                        new Text(" and "),
                        new Strong(List.of(new Text("strong"))),
                        new Text(" "),
                        new Literal("code"),
                        new Text(".")))), blocks);
    }

    @Test
    void parse_SoftLineBreakStaysInText() {
        assertEquals(List.of(new Paragraph(List.of(new Text("line one\nline two")))), parse("line one\nline two\n"));
    }

    @Test
    void parse_BulletList() {
        BulletList list = assertInstanceOf(BulletList.class, parse("- a\n- b\n").get(0));

        assertEquals(new StringBullet("-"), list.format());
        assertEquals(2, list.content().size());
        assertEquals(List.of(new Paragraph(List.of(new Text("b")))), list.content().get(1).content());
    }

    @Test
    void parse_OrderedListKeepsStartNumber() {
        EnumList list = assertInstanceOf(EnumList.class, parse("3. x\n4. y\n").get(0));

        assertEquals(3, list.start());
        assertEquals(".", list.format().suffix());
        assertEquals(4, list.content().get(1).position());
    }

    @Test
    void parse_FencedCodeBlock() {
        assertEquals(List.of(new LiteralBlock("int x;", Options.withStyles("java"))), parse("```java\nint x;\n```\n"));
    }

    @Test
    void parse_Links() {
        List<Block> blocks = parse("[docs](http://x.org) and [here](#intro) and ![logo](logo.png)\n");

        ExternalLink external = ElementTraversal.collect(blocks.get(0), ExternalLink.class).get(0);
        assertEquals("http://x.org", external.url());
        assertEquals(List.of(new Text("docs")), external.content());
        InternalLink internal = ElementTraversal.collect(blocks.get(0), InternalLink.class).get(0);
        assertEquals("intro", internal.targetId());
        Image image = ElementTraversal.collect(blocks.get(0), Image.class).get(0);
        assertEquals("logo", image.text());
        assertEquals("logo.png", image.url());
    }

    @Test
    void parse_Table() {
        Table table = assertInstanceOf(Table.class, parse("| a | b |\n|---|--:|\n| 1 | 2 |\n").get(0));

        assertEquals(1, table.head().content().size());
        assertEquals(CellType.HEAD, table.head().content().get(0).content().get(0).type());
        assertEquals(1, table.body().content().size());
        assertEquals(Options.withStyles("align-right"), table.columns().content().get(1).options());
    }

    @Test
    void parse_FrontMatterIsSkipped() {
        assertEquals(List.of(new Paragraph(List.of(new Text("Text")))), parse("---\ntitle: x\n---\n\nText\n"));
    }

    @Test
    void parse_QuoteAndRule() {
        List<Block> blocks = parse("> quoted\n\n---\n");

        assertEquals(List.of(new QuotedBlock(List.of(new Paragraph(List.of(new Text("quoted")))), List.of()), new Rule()),
                blocks);
    }

    @Test
    void resolve_GuideSample() throws Exception {
        String source = Files.readString(Paths.get("src/test/resources/samples/markdown/Guide.md"), StandardCharsets.UTF_8);

        Document document = RewriteEngine.rewrite(parser.parse(source));

        Section guide = assertInstanceOf(Section.class, document.content().get(0));
        assertEquals(Options.id("docframe-guide"), guide.options());
        List<Section> sections = ElementTraversal.collect(document, Section.class);
        assertEquals(List.of("docframe-guide", "getting-started", "formats"),
                sections.stream().map(section -> section.options().id().orElseThrow()).toList());
        assertEquals("getting-started", ElementTraversal.collect(document, InternalLink.class).get(0).targetId());
        assertEquals(1, ElementTraversal.collect(document, Table.class).size());
        assertTrue(ElementTraversal.collect(document, LiteralBlock.class).get(0).options().styles().contains("sh"));
    }

    @Test
    void parse_DeeplyNestedQuotesKeepTheirText() {
        List<Block> blocks = parse("> ".repeat(200) + "text\n");

        Block block = blocks.get(0);
        int depth = 0;
        while (block instanceof QuotedBlock quote) {
            block = quote.content().get(0);
            depth++;
        }

        assertTrue(depth < MarkdownParser.MAX_NESTING);
        InvalidBlock invalid = assertInstanceOf(InvalidBlock.class, block);
        assertEquals(MessageLevel.WARNING, invalid.message().level());
        assertEquals(new LiteralBlock("text"), invalid.fallback());
    }
}
