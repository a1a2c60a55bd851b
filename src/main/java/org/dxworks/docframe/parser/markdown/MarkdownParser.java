package org.dxworks.docframe.parser.markdown;

import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.Code;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.Parser;
import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SystemMessage;
import org.dxworks.docframe.model.block.BulletList;
import org.dxworks.docframe.model.block.BulletListItem;
import org.dxworks.docframe.model.block.EnumFormat;
import org.dxworks.docframe.model.block.EnumList;
import org.dxworks.docframe.model.block.EnumListItem;
import org.dxworks.docframe.model.block.EnumType;
import org.dxworks.docframe.model.block.Header;
import org.dxworks.docframe.model.block.InvalidBlock;
import org.dxworks.docframe.model.block.LiteralBlock;
import org.dxworks.docframe.model.block.Paragraph;
import org.dxworks.docframe.model.block.QuotedBlock;
import org.dxworks.docframe.model.block.Rule;
import org.dxworks.docframe.model.block.StringBullet;
import org.dxworks.docframe.model.link.ExternalLink;
import org.dxworks.docframe.model.link.Image;
import org.dxworks.docframe.model.link.InternalLink;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.InvalidSpan;
import org.dxworks.docframe.model.span.LineBreak;
import org.dxworks.docframe.model.span.Literal;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.model.table.Cell;
import org.dxworks.docframe.model.table.CellType;
import org.dxworks.docframe.model.table.Columns;
import org.dxworks.docframe.model.table.Row;
import org.dxworks.docframe.model.table.Table;
import org.dxworks.docframe.model.table.TableBody;
import org.dxworks.docframe.model.table.TableHead;
import org.dxworks.docframe.parser.MarkupParser;
import org.dxworks.docframe.parser.RawDocument;
import org.dxworks.docframe.parser.ReferenceNames;
import org.dxworks.docframe.parser.ResultBuilder.SpanBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parses Markdown with commonmark, GFM tables and YAML front matter enabled, and maps the
 * commonmark tree to document elements. Link references are resolved by commonmark, so the
 * result carries no dialect rewrite rules.
 */
public class MarkdownParser implements MarkupParser {

    static final int MAX_NESTING = 64;

    private final Parser parser;

    public MarkdownParser() {
        this.parser = Parser.builder()
                .extensions(List.of(
                        TablesExtension.create(),
                        YamlFrontMatterExtension.create()
                ))
                .build();
    }

    @Override
    public RawDocument parse(String source) {
        Node root = parser.parse(source);
        ElementBuilder builder = new ElementBuilder();
        List<Element> content = builder.collect(root);
        return new RawDocument(new Document(blocks(content)));
    }

    private static List<Block> blocks(List<Element> elements) {
        List<Block> blocks = new ArrayList<>();
        for (Element element : elements) {
            if (element instanceof Block block) {
                blocks.add(block);
            } else if (element instanceof Span span) {
                blocks.add(new Paragraph(List.of(span)));
            }
        }
        return blocks;
    }

    private static List<Span> spans(List<Element> elements) {
        List<Span> spans = new ArrayList<>();
        for (Element element : elements) {
            if (element instanceof Span span) spans.add(span);
        }
        return SpanBuilder.mergeAdjacentText(spans);
    }

    private static String withoutTrailingNewline(String literal) {
        return literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
    }

    /**
     * Visits the commonmark tree, every visited node adds its element to the list on top of
     * the stack. Nodes with children push a fresh list while their children are visited.
     */
    private static class ElementBuilder extends AbstractVisitor {

        private final Deque<List<Element>> stack = new ArrayDeque<>();

        List<Element> collect(Node parent) {
            if (stack.size() >= MAX_NESTING) return flattened(parent);
            stack.push(new ArrayList<>());
            visitChildren(parent);
            return stack.pop();
        }

        /**
         * Content nested too deeply keeps only its text, as a literal block or as plain text
         * depending on what the parent holds.
         */
        private static List<Element> flattened(Node parent) {
            Node first = parent.getFirstChild();
            if (first == null) return List.of();
            String text = plainText(parent);
            SystemMessage message = new SystemMessage(MessageLevel.WARNING, "content nested deeper than " + MAX_NESTING + " levels");
            if (first instanceof org.commonmark.node.Block) {
                return List.of(new InvalidBlock(message, new LiteralBlock(text)));
            }
            return List.of(new InvalidSpan(message, new Text(text)));
        }

        private static String plainText(Node parent) {
            StringBuilder text = new StringBuilder();
            Deque<Node> pending = new ArrayDeque<>();
            pushChildren(pending, parent);
            while (!pending.isEmpty()) {
                Node node = pending.pop();
                if (node instanceof org.commonmark.node.Text t) {
                    text.append(t.getLiteral());
                } else if (node instanceof Code code) {
                    text.append(code.getLiteral());
                } else if (node instanceof FencedCodeBlock code) {
                    separate(text).append(withoutTrailingNewline(code.getLiteral()));
                } else if (node instanceof IndentedCodeBlock code) {
                    separate(text).append(withoutTrailingNewline(code.getLiteral()));
                } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
                    text.append('\n');
                } else {
                    if (node instanceof org.commonmark.node.Paragraph || node instanceof Heading) separate(text);
                    pushChildren(pending, node);
                }
            }
            return text.toString();
        }

        private static StringBuilder separate(StringBuilder text) {
            if (text.length() > 0 && text.charAt(text.length() - 1) != '\n') text.append('\n');
            return text;
        }

        private static void pushChildren(Deque<Node> pending, Node parent) {
            Deque<Node> children = new ArrayDeque<>();
            for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
                children.push(child);
            }
            children.forEach(pending::push);
        }

        private void add(Element element) {
            stack.peek().add(element);
        }

        @Override
        public void visit(Heading heading) {
            List<Span> content = spans(collect(heading));
            String id = ReferenceNames.toId(ReferenceNames.flattenText(content));
            add(new Header(heading.getLevel(), content, id.isEmpty() ? Options.NONE : Options.id(id)));
        }

        @Override
        public void visit(org.commonmark.node.Paragraph paragraph) {
            add(new Paragraph(spans(collect(paragraph))));
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            add(new QuotedBlock(blocks(collect(blockQuote)), List.of()));
        }

        @Override
        public void visit(org.commonmark.node.BulletList bulletList) {
            StringBullet format = new StringBullet(String.valueOf(bulletList.getBulletMarker()));
            List<BulletListItem> items = new ArrayList<>();
            for (Node item = bulletList.getFirstChild(); item != null; item = item.getNext()) {
                items.add(new BulletListItem(blocks(collect(item)), format));
            }
            add(new BulletList(items, format));
        }

        @Override
        public void visit(OrderedList orderedList) {
            EnumFormat format = new EnumFormat(EnumType.ARABIC, "", String.valueOf(orderedList.getDelimiter()));
            int start = orderedList.getStartNumber();
            List<EnumListItem> items = new ArrayList<>();
            for (Node item = orderedList.getFirstChild(); item != null; item = item.getNext()) {
                items.add(new EnumListItem(blocks(collect(item)), format, start + items.size()));
            }
            add(new EnumList(items, format, start));
        }

        @Override
        public void visit(FencedCodeBlock codeBlock) {
            String info = codeBlock.getInfo() == null ? "" : codeBlock.getInfo().strip();
            String language = info.isEmpty() ? "" : info.split("\\s+")[0];
            Options options = language.isEmpty() ? Options.NONE : Options.withStyles(language);
            add(new LiteralBlock(withoutTrailingNewline(codeBlock.getLiteral()), options));
        }

        @Override
        public void visit(IndentedCodeBlock codeBlock) {
            add(new LiteralBlock(withoutTrailingNewline(codeBlock.getLiteral())));
        }

        @Override
        public void visit(ThematicBreak thematicBreak) {
            add(new Rule());
        }

        @Override
        public void visit(HtmlBlock htmlBlock) {
            add(new LiteralBlock(withoutTrailingNewline(htmlBlock.getLiteral()), Options.withStyles("html")));
        }

        @Override
        public void visit(CustomBlock customBlock) {
            if (customBlock instanceof YamlFrontMatterBlock) {
                // front matter is metadata, not content
                return;
            }
            if (customBlock instanceof TableBlock table) {
                add(table(table));
                return;
            }
            super.visit(customBlock);
        }

        @Override
        public void visit(org.commonmark.node.Text text) {
            add(new Text(text.getLiteral()));
        }

        @Override
        public void visit(Code code) {
            add(new Literal(code.getLiteral()));
        }

        @Override
        public void visit(Emphasis emphasis) {
            add(new Emphasized(spans(collect(emphasis))));
        }

        @Override
        public void visit(StrongEmphasis strongEmphasis) {
            add(new Strong(spans(collect(strongEmphasis))));
        }

        @Override
        public void visit(Link link) {
            List<Span> content = spans(collect(link));
            String destination = link.getDestination();
            if (destination.startsWith("#") && destination.length() > 1) {
                add(new InternalLink(content, destination.substring(1), link.getTitle(), Options.NONE));
            } else {
                add(new ExternalLink(content, destination, link.getTitle(), Options.NONE));
            }
        }

        @Override
        public void visit(org.commonmark.node.Image image) {
            String text = ReferenceNames.flattenText(spans(collect(image)));
            add(new Image(text, image.getDestination(), image.getTitle(), Options.NONE));
        }

        @Override
        public void visit(HardLineBreak hardLineBreak) {
            add(new LineBreak());
        }

        @Override
        public void visit(SoftLineBreak softLineBreak) {
            add(new Text("\n"));
        }

        @Override
        public void visit(HtmlInline htmlInline) {
            add(new Literal(htmlInline.getLiteral(), Options.withStyles("html")));
        }

        private Table table(TableBlock table) {
            List<Row> head = new ArrayList<>();
            List<Row> body = new ArrayList<>();
            List<Options> columns = new ArrayList<>();
            for (Node section = table.getFirstChild(); section != null; section = section.getNext()) {
                for (Node row = section.getFirstChild(); row != null; row = row.getNext()) {
                    if (!(row instanceof TableRow)) continue;
                    List<Cell> cells = new ArrayList<>();
                    boolean header = false;
                    for (Node node = row.getFirstChild(); node != null; node = node.getNext()) {
                        if (!(node instanceof TableCell cell)) continue;
                        header = cell.isHeader();
                        if (columns.size() < cells.size() + 1) columns.add(alignment(cell));
                        List<Span> content = spans(collect(cell));
                        List<Block> blocks = content.isEmpty() ? List.of() : List.of(new Paragraph(content));
                        cells.add(new Cell(header ? CellType.HEAD : CellType.BODY, blocks));
                    }
                    (header ? head : body).add(new Row(cells));
                }
            }
            return new Table(new TableHead(head), new TableBody(body), Columns.options(columns.toArray(new Options[0])),
                    Options.NONE);
        }

        private static Options alignment(TableCell cell) {
            if (cell.getAlignment() == null) return Options.NONE;
            return switch (cell.getAlignment()) {
                case LEFT -> Options.withStyles("align-left");
                case CENTER -> Options.withStyles("align-center");
                case RIGHT -> Options.withStyles("align-right");
            };
        }
    }
}
