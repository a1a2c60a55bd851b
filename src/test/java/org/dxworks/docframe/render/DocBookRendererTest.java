package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Customizable;
import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.SystemMessage;
import org.dxworks.docframe.model.block.BulletList;
import org.dxworks.docframe.model.block.BulletListItem;
import org.dxworks.docframe.model.block.Comment;
import org.dxworks.docframe.model.block.EnumFormat;
import org.dxworks.docframe.model.block.EnumList;
import org.dxworks.docframe.model.block.EnumListItem;
import org.dxworks.docframe.model.block.EnumType;
import org.dxworks.docframe.model.block.Header;
import org.dxworks.docframe.model.block.InvalidBlock;
import org.dxworks.docframe.model.block.LiteralBlock;
import org.dxworks.docframe.model.block.Paragraph;
import org.dxworks.docframe.model.block.Section;
import org.dxworks.docframe.model.block.StringBullet;
import org.dxworks.docframe.model.link.ExternalLink;
import org.dxworks.docframe.model.link.FootnoteLink;
import org.dxworks.docframe.model.link.LinkReference;
import org.dxworks.docframe.model.rst.DoctestBlock;
import org.dxworks.docframe.model.rst.Field;
import org.dxworks.docframe.model.rst.FieldList;
import org.dxworks.docframe.model.rst.OptionList;
import org.dxworks.docframe.model.rst.OptionListItem;
import org.dxworks.docframe.model.rst.ProgramOption;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.InvalidSpan;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.model.table.Cell;
import org.dxworks.docframe.model.table.CellType;
import org.dxworks.docframe.model.table.Columns;
import org.dxworks.docframe.model.table.Row;
import org.dxworks.docframe.model.table.Table;
import org.dxworks.docframe.model.table.TableBody;
import org.dxworks.docframe.model.table.TableHead;
import org.dxworks.docframe.parser.rst.RstParser;
import org.dxworks.docframe.rewrite.RewriteEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocBookRendererTest {

    private record CustomBlock(Options options) implements Block, Customizable {
    }

    private static String render(Element element) {
        return new Renderer<>(new DocBookRenderer()).renderToString(element);
    }

    private static String render(Element element, MessageLevel level) {
        return new Renderer<>(new DocBookRenderer().withMessageLevel(level)).renderToString(element);
    }

    private static Paragraph paragraph(String text) {
        return new Paragraph(List.of(new Text(text)));
    }

    private static Cell cell(String text) {
        return new Cell(CellType.BODY, List.of(paragraph(text)));
    }

    @Test
    void render_Document() {
        Document document = new Document(List.of(
                new Section(new Header(1, List.of(new Text("Intro"))), List.of(paragraph("Hello")), Options.id("intro"))));

        String output = new Renderer<>(new DocBookRenderer().withTitle("Guide")).renderToString(document);

        assertEquals(DocBookRenderer.DOCTYPE + "\n"
                + "<article>\n"
                + "  <artheader><title>Guide</title></artheader>\n"
                + "  <section id=\"intro\">\n"
                + "    <title>Intro</title>\n"
                + "    <para>Hello</para>\n"
                + "  </section>\n"
                + "</article>", output);
    }

    @Test
    void render_EscapesText() {
        assertEquals("<para>a &lt; b &amp; &quot;c&quot;</para>", render(paragraph("a < b & \"c\"")));
    }

    @Test
    void render_InlineMarkup() {
        Paragraph paragraph = new Paragraph(List.of(
                new Emphasized(List.of(new Text("em"))),
                new Strong(List.of(new Text("strong"))),
                new ExternalLink(List.of(new Text("site")), "http://example.org?a=1&b=2"),
                new FootnoteLink("footnote-1", "1")));

        assertEquals("<para><emphasis>em</emphasis><emphasis role=\"strong\">strong</emphasis>"
                + "<ulink url=\"http://example.org?a=1&amp;b=2\">site</ulink>"
                + "<footnoteref linkend=\"footnote-1\" label=\"1\"/></para>", render(paragraph));
    }

    @Test
    void render_StyledTextAsPhrase() {
        assertEquals("<phrase role=\"custom\">x</phrase>", render(new Text("x", Options.withStyles("custom"))));
    }

    @Test
    void render_Lists() {
        StringBullet bullet = new StringBullet("*");
        BulletList bullets = new BulletList(List.of(new BulletListItem(List.of(paragraph("one")), bullet)), bullet);
        EnumFormat format = new EnumFormat(EnumType.LOWER_ALPHA, "", ".");
        EnumList enumerated = new EnumList(List.of(new EnumListItem(List.of(paragraph("first")), format, 1)), format, 1);

        assertEquals("<itemizedlist>\n  <listitem><para>one</para></listitem>\n</itemizedlist>", render(bullets));
        assertEquals("<orderedlist numeration=\"loweralpha\">\n  <listitem><para>first</para></listitem>\n</orderedlist>",
                render(enumerated));
    }

    @Test
    void render_LiteralBlockKeepsWhitespace() {
        assertEquals("<programlisting>if x &lt; 1:\n    y</programlisting>", render(new LiteralBlock("if x < 1:\n    y")));
    }

    @Test
    void render_Comment() {
        assertEquals("<!-- a - - b -->", render(new Comment("a -- b")));
    }

    @Test
    void render_TableColumnCountFromFirstBodyRow() {
        Table table = new Table(new TableHead(List.of()),
                new TableBody(List.of(new Row(List.of(cell("a"), cell("b"), cell("c"))))));

        String output = render(table);

        assertTrue(output.startsWith("<informaltable>"));
        assertTrue(output.contains("<tgroup cols=\"3\">"));
        assertTrue(output.contains("<entry><para>a</para></entry>"));
        assertFalse(output.contains("<thead>"));
    }

    @Test
    void render_UnknownSubstitutionShowsSourceText() {
        Document document = RewriteEngine.rewrite(new RstParser().parse("The |undefined| here.\n"));

        assertTrue(render(document).contains("<para>The |undefined| here.</para>"));
        assertTrue(render(document, MessageLevel.ERROR).contains(
                "<para>The <phrase role=\"system-message error\">unknown substitution id: undefined</phrase> |undefined| here.</para>"));
    }

    @Test
    void render_SystemMessagesBelowLevelAreLeftOut() {
        InvalidSpan invalid = new InvalidSpan(new SystemMessage(MessageLevel.WARNING, "odd"), new Text("fallback"));

        assertEquals("fallback", render(invalid));
        assertEquals("fallback", render(invalid, MessageLevel.ERROR));
        assertEquals("<phrase role=\"system-message warning\">odd</phrase> fallback", render(invalid, MessageLevel.WARNING));
    }

    @Test
    void render_InvalidBlock() {
        InvalidBlock invalid = new InvalidBlock(new SystemMessage(MessageLevel.ERROR, "bad"), paragraph("fallback"));

        assertEquals("<para>fallback</para>", render(invalid));
        assertEquals("<warning><para>bad</para></warning>\n<para>fallback</para>", render(invalid, MessageLevel.INFO));
    }

    @Test
    void render_UnresolvedReferenceFallsBackToSource() {
        Paragraph paragraph = new Paragraph(List.of(new LinkReference(List.of(new Text("x")), "x", "x_")));

        assertEquals("<para>x_</para>", render(paragraph));
        assertEquals("<para><phrase role=\"system-message error\">unresolved reference: x_</phrase> x_</para>",
                render(paragraph, MessageLevel.ERROR));
    }

    @Test
    void render_UnknownElementUsesFallback() {
        CustomBlock block = new CustomBlock(Options.fallback(paragraph("fallback")));

        assertEquals("<para>fallback</para>", render(block));
        assertEquals("<programlisting role=\"doctest\">&gt;&gt;&gt; 1</programlisting>", render(DoctestBlock.of(">>> 1")));
    }

    @Test
    void render_TemporaryElementFails() {
        Document document = new RstParser().parse("Title\n=====\n").document();

        assertThrows(IllegalStateException.class, () -> render(document));
    }

    @Test
    void render_OverrideTakesPrecedence() {
        Renderer<XmlWriter> renderer = new Renderer<>(new DocBookRenderer()).withOverride((out, element) -> {
            if (!(element instanceof Emphasized emphasized)) return false;
            out.startTag("citetitle", Options.NONE).elements(emphasized.content()).endTag("citetitle");
            return true;
        });

        assertEquals("<para><citetitle>t</citetitle></para>",
                renderer.renderToString(new Paragraph(List.of(new Emphasized(List.of(new Text("t")))))));
    }

    @Test
    void render_DropsCharactersXmlDoesNotAllow() {
        assertEquals("<para>abc\td</para>", render(paragraph("a\u0001b\u0000c\td")));
        assertEquals("<!-- x- -y a- - -b -->", render(new Comment("x\u0002--y a---b")));
    }

    @Test
    void render_FieldList() {
        FieldList list = new FieldList(List.of(new Field(List.of(new Text("Author")), List.of(paragraph("Jane")))));

        assertEquals("<variablelist role=\"field-list\">\n"
                + "  <varlistentry>\n"
                + "    <term>Author</term>\n"
                + "    <listitem><para>Jane</para></listitem>\n"
                + "  </varlistentry>\n"
                + "</variablelist>", render(list));
    }

    @Test
    void render_OptionList() {
        OptionList list = new OptionList(List.of(new OptionListItem(
                List.of(new ProgramOption("-f", " ", "FILE"), new ProgramOption("--all")), List.of(paragraph("x")))));

        assertEquals("<variablelist role=\"option-list\">\n"
                + "  <varlistentry>\n"
                + "    <term><option>-f</option> <replaceable>FILE</replaceable>, <option>--all</option></term>\n"
                + "    <listitem><para>x</para></listitem>\n"
                + "  </varlistentry>\n"
                + "</variablelist>", render(list));
    }

    @Test
    void render_GridTable() {
        String source = String.join("\n",
                "+-----+-----+",
                "| a   | b   |",
                "+=====+=====+",
                "| 1   | 2   |",
                "+-----+-----+",
                "| 3         |",
                "+-----------+",
                "");

        Element table = new RstParser().parse(source).document().content().get(0);

        assertEquals("<informaltable>\n"
                + "  <tgroup cols=\"2\">\n"
                + "    <colspec colname=\"c1\"/>\n"
                + "    <colspec colname=\"c2\"/>\n"
                + "    <thead>\n"
                + "      <row>\n"
                + "        <entry><para>a</para></entry>\n"
                + "        <entry><para>b</para></entry>\n"
                + "      </row>\n"
                + "    </thead>\n"
                + "    <tbody>\n"
                + "      <row>\n"
                + "        <entry><para>1</para></entry>\n"
                + "        <entry><para>2</para></entry>\n"
                + "      </row>\n"
                + "      <row>\n"
                + "        <entry namest=\"c1\" nameend=\"c2\"><para>3</para></entry>\n"
                + "      </row>\n"
                + "    </tbody>\n"
                + "  </tgroup>\n"
                + "</informaltable>", render(table));
    }

    @Test
    void render_SpanningCellsSkipColumnsTakenFromAbove() {
        Cell tall = new Cell(CellType.BODY, List.of(paragraph("a")), 1, 2, Options.NONE);
        Cell wide = new Cell(CellType.BODY, List.of(paragraph("d")), 2, 1, Options.NONE);
        Table table = new Table(new TableHead(List.of()),
                new TableBody(List.of(new Row(List.of(tall, cell("b"), cell("c"))), new Row(List.of(wide)))),
                Columns.options(Options.NONE, Options.NONE, Options.NONE), Options.NONE);

        String output = render(table);

        assertTrue(output.contains("<tgroup cols=\"3\">"));
        assertTrue(output.contains("<entry morerows=\"1\"><para>a</para></entry>"));
        assertTrue(output.contains("<entry namest=\"c2\" nameend=\"c3\"><para>d</para></entry>"));
    }
}
