package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.block.Header;
import org.dxworks.docframe.model.block.Paragraph;
import org.dxworks.docframe.model.block.QuotedBlock;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.Text;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PrettyPrintRendererTest {

    private static String render(Element element) {
        return new Renderer<>(new PrettyPrintRenderer()).renderToString(element);
    }

    @Test
    void render_Tree() {
        Document document = new Document(List.of(new Paragraph(List.of(
                new Text("some "), new Emphasized(List.of(new Text("text")))))));

        assertEquals("Document - Blocks: 1\n"
                + ". Paragraph - Spans: 2\n"
                + ". . Text - 'some '\n"
                + ". . Emphasized - Spans: 1\n"
                + ". . . Text - 'text'", render(document));
    }

    @Test
    void render_AttributesAndOptions() {
        Header header = new Header(1, List.of(new Text("T")), Options.id("t"));

        assertEquals("Header(1,Id(t)) - Spans: 1\n. Text - 'T'", render(header));
    }

    @Test
    void render_ElementListsAsGroups() {
        QuotedBlock quote = new QuotedBlock(List.of(new Paragraph(List.of(new Text("q")))), List.of(new Text("me")));

        assertEquals("QuotedBlock - Blocks: 1\n"
                + ". Paragraph - Spans: 1\n"
                + ". . Text - 'q'\n"
                + ". Attribution - Spans: 1\n"
                + ". . Text - 'me'", render(quote));
    }

    @Test
    void abbreviate_LongText() {
        PrettyPrintRenderer renderer = new PrettyPrintRenderer(10);

        assertEquals("abcde [...] lmnop", renderer.abbreviate("abcdefghijklmnop"));
        assertEquals("a|b", renderer.abbreviate("a\nb"));
    }

    @Test
    void maxTextWidthMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new PrettyPrintRenderer(0));
    }
}
