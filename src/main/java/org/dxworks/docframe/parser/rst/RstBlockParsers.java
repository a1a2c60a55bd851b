package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SystemMessage;
import org.dxworks.docframe.model.block.DecoratedHeader;
import org.dxworks.docframe.model.block.InvalidBlock;
import org.dxworks.docframe.model.block.LiteralBlock;
import org.dxworks.docframe.model.block.Paragraph;
import org.dxworks.docframe.model.block.QuotedBlock;
import org.dxworks.docframe.model.block.Rule;
import org.dxworks.docframe.model.link.ExternalLinkDefinition;
import org.dxworks.docframe.model.link.InternalLinkTarget;
import org.dxworks.docframe.model.link.LinkAlias;
import org.dxworks.docframe.model.rst.DoctestBlock;
import org.dxworks.docframe.model.rst.OverlineAndUnderline;
import org.dxworks.docframe.model.rst.Underline;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.parser.ReferenceNames;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static org.dxworks.docframe.parser.rst.IndentedBlock.indentOf;
import static org.dxworks.docframe.parser.rst.IndentedBlock.isBlank;
import static org.dxworks.docframe.parser.rst.IndentedBlock.skipBlankLines;

/**
 * Block level parsers of reStructuredText, working on lines with tabs already expanded.
 * A new instance is used for every document, as role directives are remembered while parsing.
 */
class RstBlockParsers {

    static final String PUNCTUATION = "!\"#$%&'()[]{}*+,-.:;/<>=?@\\^_`|~";
    static final int MAX_NESTING = 64;

    private static final Predicate<String> ATTRIBUTION_START =
            line -> line.startsWith("--") || line.startsWith("—");

    private final RstSpanParsers spans = new RstSpanParsers();
    private final ListParsers lists = new ListParsers(this);
    private final TableParsers tables = new TableParsers(this);
    private final ExplicitBlockParsers explicit = new ExplicitBlockParsers(this);

    private final List<BlockParser> topLevelBlocks = List.of(
            lists::bulletList,
            lists::enumList,
            lists::fieldList,
            lists::lineBlock,
            lists::optionList,
            explicit::explicitBlock,
            tables::gridTable,
            tables::simpleTable,
            this::doctest,
            this::blockQuote,
            this::headerWithOverline,
            this::transition,
            this::headerWithUnderline,
            lists::definitionList,
            this::paragraph);

    private int depth;

    List<Span> parseInline(String text) {
        return spans.parse(text);
    }

    /**
     * Parses all blocks of the given lines. A paragraph ending with {@code ::} turns the next
     * block into a literal block, and adjacent link targets are folded afterwards.
     * <p>
     * Blocks nested deeper than {@link #MAX_NESTING} levels are kept as literal text.
     */
    List<Block> parseBlocks(List<String> lines) {
        if (depth >= MAX_NESTING) return nestingTooDeep(lines);
        depth++;
        try {
            return parseBlockSequence(lines);
        } finally {
            depth--;
        }
    }

    private static List<Block> nestingTooDeep(List<String> lines) {
        int start = skipBlankLines(lines, 0);
        int end = lines.size();
        while (end > start && isBlank(lines.get(end - 1))) end--;
        if (start == end) return List.of();
        SystemMessage message = new SystemMessage(MessageLevel.WARNING, "blocks nested deeper than " + MAX_NESTING + " levels");
        return List.of(new InvalidBlock(message, new LiteralBlock(String.join("\n", lines.subList(start, end)))));
    }

    static InvalidBlock invalid(String message, String source) {
        return new InvalidBlock(new SystemMessage(MessageLevel.ERROR, message), new LiteralBlock(source));
    }

    private List<Block> parseBlockSequence(List<String> lines) {
        List<Block> blocks = new ArrayList<>();
        int pos = skipBlankLines(lines, 0);
        boolean literalNext = false;
        while (pos < lines.size()) {
            BlockMatch match = literalNext ? literalBlock(lines, pos) : null;
            literalNext = false;
            if (match == null) match = topLevelBlock(lines, pos);

            if (match.block() instanceof Paragraph paragraph) {
                if (isLiteralMarker(paragraph)) {
                    literalNext = true;
                } else {
                    Paragraph stripped = stripLiteralMarker(paragraph);
                    literalNext = stripped != paragraph;
                    blocks.add(stripped);
                }
            } else {
                blocks.add(match.block());
            }
            pos = skipBlankLines(lines, match.next());
        }
        return foldAdjacent(blocks);
    }

    private BlockMatch topLevelBlock(List<String> lines, int pos) {
        for (BlockParser parser : topLevelBlocks) {
            BlockMatch match = parser.parse(lines, pos);
            if (match != null) return match;
        }
        throw new IllegalStateException("No block parser applies at line " + pos);
    }

    private static boolean isLiteralMarker(Paragraph paragraph) {
        return paragraph.content().size() == 1
                && paragraph.content().get(0) instanceof Text text
                && text.content().strip().equals("::");
    }

    /**
     * Removes a trailing {@code ::} and the whitespace before it.
     */
    private static Paragraph stripLiteralMarker(Paragraph paragraph) {
        List<Span> content = paragraph.content();
        if (content.isEmpty() || !(content.get(content.size() - 1) instanceof Text last)) return paragraph;
        String text = last.content().stripTrailing();
        if (!text.endsWith("::")) return paragraph;

        String stripped = text.substring(0, text.length() - 2).stripTrailing();
        List<Span> result = new ArrayList<>(content.subList(0, content.size() - 1));
        if (!stripped.isEmpty()) result.add(new Text(stripped, last.options()));
        return new Paragraph(result, paragraph.options());
    }

    private static List<Block> foldAdjacent(List<Block> blocks) {
        List<Block> result = new ArrayList<>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            Block current = blocks.get(i);
            Block next = i + 1 < blocks.size() ? blocks.get(i + 1) : null;
            if (current instanceof InternalLinkTarget target && target.options().id().isPresent()) {
                String id = target.options().id().get();
                if (next instanceof InternalLinkTarget nextTarget && nextTarget.options().id().isPresent()) {
                    result.add(new LinkAlias(id, nextTarget.options().id().get()));
                    continue;
                }
                if (next instanceof ExternalLinkDefinition definition) {
                    result.add(definition.withId(id));
                    continue;
                }
            }
            if (current instanceof DecoratedHeader header) {
                String id = ReferenceNames.toId(ReferenceNames.flattenText(header.content()));
                result.add(id.isEmpty() ? header : header.withOptions(header.options().plus(Options.id(id))));
                continue;
            }
            result.add(current);
        }
        return result;
    }

    static boolean isPunctuation(char c) {
        return PUNCTUATION.indexOf(c) >= 0;
    }

    /**
     * A line made of one repeated punctuation character.
     */
    static boolean isDecoration(String line) {
        if (line.isEmpty() || !isPunctuation(line.charAt(0))) return false;
        char c = line.charAt(0);
        for (int i = 1; i < line.length(); i++) {
            if (line.charAt(i) != c) return false;
        }
        return true;
    }

    BlockMatch paragraph(List<String> lines, int pos) {
        int end = pos;
        while (end < lines.size() && !isBlank(lines.get(end))) end++;
        return new BlockMatch(new Paragraph(parseInline(String.join("\n", lines.subList(pos, end)))), end);
    }

    BlockMatch headerWithOverline(List<String> lines, int pos) {
        String overline = lines.get(pos);
        if (!isDecoration(overline) || pos + 2 >= lines.size()) return null;
        String title = lines.get(pos + 1);
        if (isBlank(title) || title.length() > overline.length()) return null;
        if (!lines.get(pos + 2).equals(overline)) return null;

        char c = overline.charAt(0);
        return new BlockMatch(new DecoratedHeader(new OverlineAndUnderline(c), parseInline(title.strip())), pos + 3);
    }

    BlockMatch headerWithUnderline(List<String> lines, int pos) {
        String titleLine = lines.get(pos);
        if (indentOf(titleLine) > 0 || pos + 1 >= lines.size()) return null;
        String underline = lines.get(pos + 1);
        String title = titleLine.strip();
        if (!isDecoration(underline) || underline.length() < title.length()) return null;

        char c = underline.charAt(0);
        return new BlockMatch(new DecoratedHeader(new Underline(c), parseInline(title)), pos + 2);
    }

    BlockMatch transition(List<String> lines, int pos) {
        String line = lines.get(pos);
        if (line.length() < 4) return null;
        for (int i = 0; i < line.length(); i++) {
            if (!isPunctuation(line.charAt(i))) return null;
        }
        if (pos + 1 < lines.size() && !isBlank(lines.get(pos + 1))) return null;
        return new BlockMatch(new Rule(), pos + 1);
    }

    BlockMatch doctest(List<String> lines, int pos) {
        String line = lines.get(pos);
        if (!line.startsWith(">>> ") && !line.equals(">>>")) return null;
        int end = pos;
        while (end < lines.size() && !isBlank(lines.get(end))) end++;
        return new BlockMatch(DoctestBlock.of(String.join("\n", lines.subList(pos, end))), end);
    }

    BlockMatch blockQuote(List<String> lines, int pos) {
        if (indentOf(lines.get(pos)) == 0) return null;
        IndentedBlock block = IndentedBlock.collect(lines, pos, 1, false, ATTRIBUTION_START);
        if (block == null) return null;

        List<Span> attribution = List.of();
        int next = block.next();
        int candidate = skipBlankLines(lines, next);
        if (candidate < lines.size()
                && indentOf(lines.get(candidate)) == block.indent()
                && ATTRIBUTION_START.test(lines.get(candidate).strip())) {
            String first = stripAttributionStart(lines.get(candidate).strip());
            IndentedBlock rest = IndentedBlock.collect(lines, candidate + 1, block.indent(), true, line -> false);
            List<String> attributionLines = new ArrayList<>();
            attributionLines.add(first);
            if (rest != null) rest.lines().forEach(line -> attributionLines.add(line.strip()));
            attribution = parseInline(String.join("\n", attributionLines).strip());
            next = rest != null ? rest.next() : candidate + 1;
        }
        return new BlockMatch(new QuotedBlock(parseBlocks(block.dedented()), attribution), next);
    }

    private static String stripAttributionStart(String line) {
        if (line.startsWith("---")) return line.substring(3);
        if (line.startsWith("--")) return line.substring(2);
        return line.substring(1);
    }

    /**
     * An indented literal block, or a quoted one where every line starts with punctuation.
     */
    BlockMatch literalBlock(List<String> lines, int pos) {
        String first = lines.get(pos);
        if (indentOf(first) > 0) {
            IndentedBlock block = IndentedBlock.collect(lines, pos, 1);
            return new BlockMatch(new LiteralBlock(String.join("\n", block.dedented())), block.next());
        }
        if (!isPunctuation(first.charAt(0))) return null;
        int end = pos;
        while (end < lines.size() && !isBlank(lines.get(end)) && isPunctuation(lines.get(end).charAt(0))) end++;
        return new BlockMatch(new LiteralBlock(String.join("\n", lines.subList(pos, end))), end);
    }
}
