package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.BlockContainer;
import org.dxworks.docframe.model.Customizable;
import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.Invalid;
import org.dxworks.docframe.model.ListContainer;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Reference;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;
import org.dxworks.docframe.model.SystemMessage;
import org.dxworks.docframe.model.Temporary;
import org.dxworks.docframe.model.TextContainer;
import org.dxworks.docframe.model.block.BlockSequence;
import org.dxworks.docframe.model.block.BulletList;
import org.dxworks.docframe.model.block.BulletListItem;
import org.dxworks.docframe.model.block.Comment;
import org.dxworks.docframe.model.block.DefinitionList;
import org.dxworks.docframe.model.block.DefinitionListItem;
import org.dxworks.docframe.model.block.EnumList;
import org.dxworks.docframe.model.block.EnumListItem;
import org.dxworks.docframe.model.block.Header;
import org.dxworks.docframe.model.block.InvalidBlock;
import org.dxworks.docframe.model.block.Line;
import org.dxworks.docframe.model.block.LineBlock;
import org.dxworks.docframe.model.block.LiteralBlock;
import org.dxworks.docframe.model.block.Paragraph;
import org.dxworks.docframe.model.block.QuotedBlock;
import org.dxworks.docframe.model.block.Rule;
import org.dxworks.docframe.model.block.Section;
import org.dxworks.docframe.model.link.Citation;
import org.dxworks.docframe.model.link.CitationLink;
import org.dxworks.docframe.model.link.ExternalLink;
import org.dxworks.docframe.model.link.Footnote;
import org.dxworks.docframe.model.link.FootnoteLink;
import org.dxworks.docframe.model.link.Image;
import org.dxworks.docframe.model.link.InlineTarget;
import org.dxworks.docframe.model.link.InternalLink;
import org.dxworks.docframe.model.link.InternalLinkTarget;
import org.dxworks.docframe.model.rst.Field;
import org.dxworks.docframe.model.rst.FieldList;
import org.dxworks.docframe.model.rst.OptionList;
import org.dxworks.docframe.model.rst.OptionListItem;
import org.dxworks.docframe.model.rst.ProgramOption;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.InvalidSpan;
import org.dxworks.docframe.model.span.LineBreak;
import org.dxworks.docframe.model.span.Literal;
import org.dxworks.docframe.model.span.SpanSequence;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.model.table.Cell;
import org.dxworks.docframe.model.table.Column;
import org.dxworks.docframe.model.table.Columns;
import org.dxworks.docframe.model.table.Row;
import org.dxworks.docframe.model.table.Table;
import org.dxworks.docframe.model.table.TableBody;
import org.dxworks.docframe.model.table.TableElement;
import org.dxworks.docframe.model.table.TableHead;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Renders documents as DocBook 4.5 articles.
 * <p>
 * Elements are dispatched by capability: system messages, tables, unresolved references and
 * invalid elements first, then containers of blocks, spans, list items and text, then plain
 * blocks and spans. Elements this format does not know render their fallback when their
 * options carry one, otherwise a generic wrapper around their children.
 * <p>
 * System messages are only written when a message level is configured and the message is at
 * least as severe. Without a level, invalid elements show their fallback only.
 */
public class DocBookRenderer implements RenderFormat<XmlWriter> {

    static final String DOCTYPE = "<!DOCTYPE article PUBLIC \"-//OASIS//DTD DocBook XML V4.5//EN\" "
            + "\"http://www.oasis-open.org/docbook/xml/4.5/docbookx.dtd\">";

    private final MessageLevel messageLevel;
    private final String title;

    public DocBookRenderer() {
        this(null, "");
    }

    private DocBookRenderer(MessageLevel messageLevel, String title) {
        this.messageLevel = messageLevel;
        this.title = title;
    }

    /**
     * The minimum level of the system messages written to the output.
     */
    public DocBookRenderer withMessageLevel(MessageLevel level) {
        return new DocBookRenderer(level, title);
    }

    public DocBookRenderer withTitle(String title) {
        return new DocBookRenderer(messageLevel, title == null ? "" : title);
    }

    @Override
    public XmlWriter newWriter(Appendable out, Consumer<Element> render) {
        return new XmlWriter(out, render);
    }

    @Override
    public void renderElement(XmlWriter out, Element element) {
        if (element instanceof SystemMessage message) {
            renderSystemMessage(out, message);
        } else if (element instanceof Table table) {
            renderTable(out, table);
        } else if (element instanceof TableElement tableElement) {
            renderTableElement(out, tableElement);
        } else if (element instanceof Reference reference) {
            out.element(InvalidSpan.error("unresolved reference: " + reference.source(), reference.source()));
        } else if (element instanceof Invalid<?> invalid) {
            renderInvalid(out, invalid);
        } else if (element instanceof Temporary) {
            throw new IllegalStateException(element.getClass().getSimpleName() + " has to be removed before rendering");
        } else if (element instanceof BlockContainer<?> container) {
            renderBlockContainer(out, container);
        } else if (element instanceof SpanContainer<?> container) {
            renderSpanContainer(out, container);
        } else if (element instanceof ListContainer<?, ?> container) {
            renderListContainer(out, container);
        } else if (element instanceof TextContainer container) {
            renderTextContainer(out, container);
        } else if (element instanceof Block block) {
            renderSimpleBlock(out, block);
        } else if (element instanceof Span span) {
            renderSimpleSpan(out, span);
        } else {
            renderUnknown(out, element);
        }
    }

    private boolean include(SystemMessage message) {
        return messageLevel != null && message.level().isAtLeast(messageLevel);
    }

    private static Optional<Element> fallback(Element element) {
        if (element instanceof Customizable customizable) return customizable.options().fallback();
        return Optional.empty();
    }

    /**
     * A single paragraph or span sequence becomes one {@code para}, other content is indented
     * on its own lines.
     */
    private static void renderBlocks(XmlWriter out, List<Block> blocks, String tag) {
        if (blocks.size() == 1 && blocks.get(0) instanceof Paragraph paragraph) {
            out.startTag("para", paragraph.options()).elements(paragraph.content()).endTag("para").endTag(tag);
        } else if (blocks.size() == 1 && blocks.get(0) instanceof SpanSequence sequence) {
            out.startTag("para", sequence.options()).elements(sequence.content()).endTag("para").endTag(tag);
        } else {
            out.indented(blocks).newLine().endTag(tag);
        }
    }

    private void renderSystemMessage(XmlWriter out, SystemMessage message) {
        if (!include(message)) return;
        out.startTag("warning", message.options()).startTag("para", Options.NONE)
                .escaped(message.content())
                .endTag("para").endTag("warning");
    }

    private void renderInvalid(XmlWriter out, Invalid<?> invalid) {
        SystemMessage message = invalid.message();
        if (!include(message)) {
            out.element(invalid.fallback());
        } else if (invalid instanceof InvalidBlock) {
            out.element(message).newLine().element(invalid.fallback());
        } else {
            Options styles = Options.withStyles("system-message", message.level().name().toLowerCase(Locale.ROOT));
            out.startTag("phrase", styles).escaped(message.content()).endTag("phrase")
                    .text(" ").element(invalid.fallback());
        }
    }

    private static void renderTable(XmlWriter out, Table table) {
        List<Element> children = new ArrayList<>();
        if (!table.columns().content().isEmpty()) children.add(table.columns());
        if (!table.head().content().isEmpty()) children.add(table.head());
        if (!table.body().content().isEmpty()) children.add(table.body());

        out.startTag("informaltable", table.options())
                .indented(() -> out.newLine().startTag("tgroup", Options.NONE, "cols", String.valueOf(columnCount(table)))
                        .indented(children)
                        .newLine().endTag("tgroup"))
                .newLine().endTag("informaltable");
    }

    /**
     * The number of column definitions. Tables without them count the columns spanned by the
     * first body row, or by the first head row for tables without body.
     */
    static int columnCount(Table table) {
        if (!table.columns().content().isEmpty()) return table.columns().content().size();
        if (!table.body().content().isEmpty()) return spannedColumns(table.body().content().get(0));
        if (!table.head().content().isEmpty()) return spannedColumns(table.head().content().get(0));
        return 0;
    }

    private static int spannedColumns(Row row) {
        return row.content().stream().mapToInt(Cell::colspan).sum();
    }

    private static void renderTableElement(XmlWriter out, TableElement element) {
        if (element instanceof Columns columns) {
            for (int i = 0; i < columns.content().size(); i++) {
                if (i > 0) out.newLine();
                out.emptyTag("colspec", columns.content().get(i).options(), "colname", "c" + (i + 1));
            }
        } else if (element instanceof Column column) {
            out.emptyTag("colspec", column.options());
        } else if (element instanceof TableHead head) {
            out.startTag("thead", head.options()).indented(() -> renderRows(out, head.content())).newLine().endTag("thead");
        } else if (element instanceof TableBody body) {
            out.startTag("tbody", body.options()).indented(() -> renderRows(out, body.content())).newLine().endTag("tbody");
        } else if (element instanceof Row row) {
            out.startTag("row", row.options()).indented(row.content()).newLine().endTag("row");
        } else if (element instanceof Cell cell) {
            renderCell(out, cell, -1);
        } else {
            renderUnknown(out, element);
        }
    }

    /**
     * Rows with the column of every cell tracked, skipping the columns that cells of the rows
     * above still span.
     */
    private static void renderRows(XmlWriter out, List<Row> rows) {
        List<Integer> spanned = new ArrayList<>();
        for (Row row : rows) {
            out.newLine().startTag("row", row.options()).indented(() -> {
                int column = 0;
                for (Cell cell : row.content()) {
                    while (column < spanned.size() && spanned.get(column) > 0) column++;
                    out.newLine();
                    renderCell(out, cell, column);
                    for (int c = column; c < column + cell.colspan(); c++) {
                        while (spanned.size() <= c) spanned.add(0);
                        spanned.set(c, cell.rowspan());
                    }
                    column += cell.colspan();
                }
            }).newLine().endTag("row");
            spanned.replaceAll(remaining -> Math.max(0, remaining - 1));
        }
    }

    /**
     * @param column the first column of the cell, negative when unknown
     */
    private static void renderCell(XmlWriter out, Cell cell, int column) {
        boolean named = cell.colspan() > 1 && column >= 0;
        String start = named ? "c" + (column + 1) : null;
        String end = named ? "c" + (column + cell.colspan()) : null;
        String moreRows = cell.rowspan() > 1 ? String.valueOf(cell.rowspan() - 1) : null;
        out.startTag("entry", cell.options(), "namest", start, "nameend", end, "morerows", moreRows);
        renderBlocks(out, cell.content(), "entry");
    }

    private void renderBlockContainer(XmlWriter out, BlockContainer<?> container) {
        if (container instanceof Document document) {
            out.text(DOCTYPE).newLine().text("<article>")
                    .indented(() -> out.newLine().text("<artheader><title>").escaped(title).text("</title></artheader>"))
                    .indented(document.content())
                    .newLine().text("</article>");
        } else if (container instanceof Section section) {
            Header header = section.header();
            out.startTag("section", section.options())
                    .indented(() -> out.newLine().startTag("title", Options.NONE).elements(header.content()).endTag("title"))
                    .indented(section.content())
                    .newLine().endTag("section");
        } else if (container instanceof QuotedBlock quote) {
            List<Block> content = new ArrayList<>(quote.content());
            if (!quote.attribution().isEmpty()) content.add(new Paragraph(quote.attribution(), Options.withStyles("attribution")));
            out.startTag("blockquote", quote.options());
            renderBlocks(out, content, "blockquote");
        } else if (container instanceof BulletListItem item) {
            out.startTag("listitem", item.options());
            renderBlocks(out, item.content(), "listitem");
        } else if (container instanceof EnumListItem item) {
            out.startTag("listitem", item.options());
            renderBlocks(out, item.content(), "listitem");
        } else if (container instanceof DefinitionListItem item) {
            out.startTag("glossentry", item.options())
                    .indented(() -> out.newLine().startTag("glossterm", Options.NONE).elements(item.term()).endTag("glossterm")
                            .newLine().startTag("glossdef", Options.NONE))
                    .indented(() -> renderBlocks(out, item.content(), "glossdef"))
                    .newLine().endTag("glossentry");
        } else if (container instanceof Field field) {
            out.startTag("varlistentry", field.options())
                    .indented(() -> out.newLine().startTag("term", Options.NONE).elements(field.name()).endTag("term")
                            .newLine().startTag("listitem", Options.NONE))
                    .indented(() -> renderBlocks(out, field.content(), "listitem"))
                    .newLine().endTag("varlistentry");
        } else if (container instanceof OptionListItem item) {
            out.startTag("varlistentry", item.options())
                    .indented(() -> {
                        out.newLine().startTag("term", Options.NONE);
                        renderProgramOptions(out, item.programOptions());
                        out.endTag("term").newLine().startTag("listitem", Options.NONE);
                    })
                    .indented(() -> renderBlocks(out, item.content(), "listitem"))
                    .newLine().endTag("varlistentry");
        } else if (container instanceof LineBlock lineBlock) {
            out.startTag("literallayout", lineBlock.options());
            renderLines(out, lineBlock, "", true);
            out.endTag("literallayout");
        } else if (container instanceof Footnote footnote) {
            out.startTag("footnote", footnote.options(), "label", footnote.label());
            renderBlocks(out, footnote.content(), "footnote");
        } else if (container instanceof Citation citation) {
            out.startTag("blockquote", citation.options().plus(Options.withStyles("citation")))
                    .indented(() -> out.newLine().startTag("title", Options.NONE).escaped("[" + citation.label() + "]").endTag("title"))
                    .indented(citation.content())
                    .newLine().endTag("blockquote");
        } else if (container instanceof BlockSequence sequence && sequence.options().isEmpty()) {
            List<Block> content = sequence.content();
            for (int i = 0; i < content.size(); i++) {
                if (i > 0) out.newLine();
                out.element(content.get(i));
            }
        } else if (fallback(container).isPresent()) {
            out.element(fallback(container).get());
        } else {
            Options options = container instanceof Customizable customizable ? customizable.options() : Options.NONE;
            out.startTag("informalexample", options).indented(container.content()).newLine().endTag("informalexample");
        }
    }

    private static void renderProgramOptions(XmlWriter out, List<ProgramOption> options) {
        for (int i = 0; i < options.size(); i++) {
            ProgramOption option = options.get(i);
            if (i > 0) out.text(", ");
            out.startTag("option", Options.NONE).escaped(option.name()).endTag("option");
            if (option.argument() != null) {
                out.escaped(option.delimiter())
                        .startTag("replaceable", Options.NONE).escaped(option.argument()).endTag("replaceable");
            }
        }
    }

    /**
     * Lines of a line block, nested blocks indented by four spaces. Whitespace is significant
     * inside {@code literallayout}, so line breaks are written without writer indentation.
     */
    private static void renderLines(XmlWriter out, LineBlock lineBlock, String indent, boolean first) {
        boolean firstLine = first;
        for (Block block : lineBlock.content()) {
            if (block instanceof LineBlock nested) {
                renderLines(out, nested, indent + "    ", firstLine);
            } else {
                if (!firstLine) out.text("\n");
                out.text(indent);
                if (block instanceof Line line) {
                    out.elements(line.content());
                } else {
                    out.element(block);
                }
            }
            firstLine = false;
        }
    }

    private void renderSpanContainer(XmlWriter out, SpanContainer<?> container) {
        if (container instanceof Paragraph paragraph) {
            out.startTag("para", paragraph.options()).elements(paragraph.content()).endTag("para");
        } else if (container instanceof Emphasized emphasized) {
            out.startTag("emphasis", emphasized.options()).elements(emphasized.content()).endTag("emphasis");
        } else if (container instanceof Strong strong) {
            out.startTag("emphasis", strong.options().plus(Options.withStyles("strong"))).elements(strong.content()).endTag("emphasis");
        } else if (container instanceof Header header) {
            String level = String.valueOf(Math.min(header.level(), 5));
            out.startTag("bridgehead", header.options(), "renderas", "sect" + level)
                    .elements(header.content()).endTag("bridgehead");
        } else if (container instanceof Line line) {
            out.elements(line.content());
        } else if (container instanceof ExternalLink link) {
            out.startTag("ulink", link.options(), "url", link.url()).elements(link.content()).endTag("ulink");
        } else if (container instanceof InternalLink link) {
            out.startTag("link", link.options(), "linkend", link.targetId()).elements(link.content()).endTag("link");
        } else if (container instanceof SpanSequence sequence && sequence.options().isEmpty()) {
            out.elements(sequence.content());
        } else if (fallback(container).isPresent()) {
            out.element(fallback(container).get());
        } else if (container instanceof Customizable customizable && !customizable.options().isEmpty()) {
            out.startTag("phrase", customizable.options()).elements(container.content()).endTag("phrase");
        } else {
            out.elements(container.content());
        }
    }

    private static void renderListContainer(XmlWriter out, ListContainer<?, ?> container) {
        if (container instanceof BulletList list) {
            out.startTag("itemizedlist", list.options()).indented(list.content()).newLine().endTag("itemizedlist");
        } else if (container instanceof EnumList list) {
            out.startTag("orderedlist", list.options(), "numeration", numeration(list))
                    .indented(list.content()).newLine().endTag("orderedlist");
        } else if (container instanceof DefinitionList list) {
            out.startTag("glosslist", list.options()).indented(list.content()).newLine().endTag("glosslist");
        } else if (container instanceof FieldList list) {
            out.startTag("variablelist", list.options().plus(Options.withStyles("field-list")))
                    .indented(list.content()).newLine().endTag("variablelist");
        } else if (container instanceof OptionList list) {
            out.startTag("variablelist", list.options().plus(Options.withStyles("option-list")))
                    .indented(list.content()).newLine().endTag("variablelist");
        } else if (fallback(container).isPresent()) {
            out.element(fallback(container).get());
        } else {
            Options options = container instanceof Customizable customizable ? customizable.options() : Options.NONE;
            out.startTag("informalexample", options).indented(container.content()).newLine().endTag("informalexample");
        }
    }

    private static String numeration(EnumList list) {
        return switch (list.format().type()) {
            case ARABIC -> null;
            case LOWER_ALPHA -> "loweralpha";
            case UPPER_ALPHA -> "upperalpha";
            case LOWER_ROMAN -> "lowerroman";
            case UPPER_ROMAN -> "upperroman";
        };
    }

    private static void renderTextContainer(XmlWriter out, TextContainer container) {
        if (container instanceof Text text) {
            if (text.options().isEmpty()) {
                out.escaped(text.content());
            } else {
                out.startTag("phrase", text.options()).escaped(text.content()).endTag("phrase");
            }
        } else if (container instanceof InlineTarget target) {
            out.startTag("phrase", target.options().plus(Options.withStyles("target"))).escaped(target.content()).endTag("phrase");
        } else if (container instanceof Literal literal) {
            out.startTag("literal", literal.options()).preformatted(literal.content()).endTag("literal");
        } else if (container instanceof LiteralBlock block) {
            out.startTag("programlisting", block.options()).preformatted(block.content()).endTag("programlisting");
        } else if (container instanceof Comment comment) {
            out.comment(comment.content());
        } else if (fallback(container).isPresent()) {
            out.element(fallback(container).get());
        } else {
            out.escaped(container.content());
        }
    }

    private static void renderSimpleBlock(XmlWriter out, Block block) {
        if (block instanceof Rule rule) {
            out.emptyTag("para", rule.options().plus(Options.withStyles("rule")));
        } else if (block instanceof InternalLinkTarget target) {
            out.emptyTag("anchor", target.options());
        } else if (fallback(block).isPresent()) {
            out.element(fallback(block).get());
        } else {
            renderUnknown(out, block);
        }
    }

    private static void renderSimpleSpan(XmlWriter out, Span span) {
        if (span instanceof CitationLink link) {
            out.startTag("link", link.options(), "linkend", link.id()).escaped("[" + link.label() + "]").endTag("link");
        } else if (span instanceof FootnoteLink link) {
            out.emptyTag("footnoteref", link.options(), "linkend", link.id(), "label", link.label());
        } else if (span instanceof Image image) {
            out.startTag("inlinemediaobject", image.options())
                    .text("<imageobject>").emptyTag("imagedata", Options.NONE, "fileref", image.url()).text("</imageobject>")
                    .text("<textobject><phrase>").escaped(image.text()).text("</phrase></textobject>")
                    .endTag("inlinemediaobject");
        } else if (span instanceof LineBreak) {
            // DocBook has no inline line break
        } else if (fallback(span).isPresent()) {
            out.element(fallback(span).get());
        } else {
            renderUnknown(out, span);
        }
    }

    /**
     * Elements without a rendering of their own keep their children.
     */
    private static void renderUnknown(XmlWriter out, Element element) {
        List<Element> children = element.children();
        if (children.isEmpty()) return;
        if (element instanceof Block) {
            out.text("<informalexample>").indented(children).newLine().text("</informalexample>");
        } else {
            out.elements(children);
        }
    }
}
