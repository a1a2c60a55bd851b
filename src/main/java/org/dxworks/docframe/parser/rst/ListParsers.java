package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.block.BulletList;
import org.dxworks.docframe.model.block.BulletListItem;
import org.dxworks.docframe.model.block.DefinitionList;
import org.dxworks.docframe.model.block.DefinitionListItem;
import org.dxworks.docframe.model.block.EnumFormat;
import org.dxworks.docframe.model.block.EnumList;
import org.dxworks.docframe.model.block.EnumListItem;
import org.dxworks.docframe.model.block.EnumType;
import org.dxworks.docframe.model.block.Line;
import org.dxworks.docframe.model.block.LineBlock;
import org.dxworks.docframe.model.block.StringBullet;
import org.dxworks.docframe.model.rst.Field;
import org.dxworks.docframe.model.rst.FieldList;
import org.dxworks.docframe.model.rst.OptionList;
import org.dxworks.docframe.model.rst.OptionListItem;
import org.dxworks.docframe.model.rst.ProgramOption;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.docframe.parser.rst.IndentedBlock.indentOf;
import static org.dxworks.docframe.parser.rst.IndentedBlock.isBlank;
import static org.dxworks.docframe.parser.rst.IndentedBlock.skipBlankLines;

/**
 * Bullet, enumerated, definition, field and option lists and line blocks.
 */
class ListParsers {

    private static final String BULLETS = "*+-•‣⁃";
    private static final Pattern ENUMERATOR = Pattern.compile("^(\\(?)(\\d{1,9}|#|[a-zA-Z]|[ivxlcdm]+|[IVXLCDM]+)([.)])(?: +|$)");
    private static final Pattern LOWER_ROMAN = Pattern.compile("m{0,3}(cm|cd|d?c{0,3})(xc|xl|l?x{0,3})(ix|iv|v?i{0,3})");
    private static final Pattern FIELD_MARKER = Pattern.compile("^:(?! )((?:[^:\\\\]|\\\\.|:(?! |$))+)(?<! ):(?: +|$)");

    private static final String OPTION_NAME = "(?:--[a-zA-Z0-9][a-zA-Z0-9_-]*|-[a-zA-Z0-9]|\\+[a-zA-Z0-9]|/[a-zA-Z0-9]+)";
    private static final String OPTION_ARGUMENT = "(?:[a-zA-Z][a-zA-Z0-9_-]*|<[^<>]+>)";
    private static final String OPTION = OPTION_NAME + "(?:[ =]" + OPTION_ARGUMENT + ")?";
    private static final Pattern PROGRAM_OPTION = Pattern.compile("(" + OPTION_NAME + ")(?:([ =])(" + OPTION_ARGUMENT + "))?");
    private static final Pattern OPTION_ITEM = Pattern.compile("(" + OPTION + "(?:, " + OPTION + ")*)(?:  +(.*))?");

    private final RstBlockParsers blocks;

    ListParsers(RstBlockParsers blocks) {
        this.blocks = blocks;
    }

    BlockMatch bulletList(List<String> lines, int pos) {
        String first = lines.get(pos);
        if (!isBulletItem(first, first.charAt(0))) return null;
        char bullet = first.charAt(0);
        StringBullet format = new StringBullet(String.valueOf(bullet));

        List<BulletListItem> items = new ArrayList<>();
        int i = pos;
        int end;
        while (true) {
            ItemBody body = itemBody(lines, i, 1);
            items.add(new BulletListItem(blocks.parseBlocks(body.lines()), format));
            end = body.next();
            int candidate = skipBlankLines(lines, end);
            if (candidate >= lines.size() || !isBulletItem(lines.get(candidate), bullet)) break;
            i = candidate;
        }
        return new BlockMatch(new BulletList(items, format), end);
    }

    private static boolean isBulletItem(String line, char bullet) {
        if (line.isEmpty() || line.charAt(0) != bullet || BULLETS.indexOf(bullet) < 0) return false;
        return line.length() == 1 || line.charAt(1) == ' ';
    }

    private record Enumerator(EnumType type, EnumFormat format, int value, int width) {
    }

    BlockMatch enumList(List<String> lines, int pos) {
        Enumerator first = enumerator(lines.get(pos), null);
        if (first == null) return null;
        if (pos + 1 < lines.size()) {
            String following = lines.get(pos + 1);
            if (!isBlank(following) && indentOf(following) == 0 && enumerator(following, first) == null) return null;
        }

        EnumFormat format = first.format();
        int start = first.value();
        List<EnumListItem> items = new ArrayList<>();
        int i = pos;
        int end;
        Enumerator current = first;
        while (true) {
            ItemBody body = itemBody(lines, i, current.width());
            items.add(new EnumListItem(blocks.parseBlocks(body.lines()), format, start + items.size()));
            end = body.next();
            int candidate = skipBlankLines(lines, end);
            if (candidate >= lines.size()) break;
            current = enumerator(lines.get(candidate), first);
            if (current == null) break;
            i = candidate;
        }
        return new BlockMatch(new EnumList(items, format, start), end);
    }

    /**
     * Reads the enumerator at the start of the line. When {@code previous} is given, the
     * enumerator has to continue that list in type and format.
     */
    private static Enumerator enumerator(String line, Enumerator previous) {
        Matcher matcher = ENUMERATOR.matcher(line);
        if (!matcher.find()) return null;
        String prefix = matcher.group(1);
        String value = matcher.group(2);
        String suffix = matcher.group(3);
        if (prefix.equals("(") && !suffix.equals(")")) return null;

        EnumType type;
        if (previous != null) {
            type = previous.type();
            if (!previous.format().prefix().equals(prefix) || !previous.format().suffix().equals(suffix)) return null;
        } else {
            type = detectType(value);
            if (type == null) return null;
        }

        int number;
        if (value.equals("#")) {
            number = previous == null ? 1 : previous.value() + 1;
        } else {
            number = valueOf(value, type);
            if (number < 1) return null;
        }
        return new Enumerator(type, new EnumFormat(type, prefix, suffix), number, matcher.end(3));
    }

    private static EnumType detectType(String value) {
        if (value.equals("#") || Character.isDigit(value.charAt(0))) return EnumType.ARABIC;
        if (value.equals("i")) return EnumType.LOWER_ROMAN;
        if (value.equals("I")) return EnumType.UPPER_ROMAN;
        if (value.length() == 1) {
            return Character.isLowerCase(value.charAt(0)) ? EnumType.LOWER_ALPHA : EnumType.UPPER_ALPHA;
        }
        if (LOWER_ROMAN.matcher(value).matches()) return EnumType.LOWER_ROMAN;
        if (LOWER_ROMAN.matcher(value.toLowerCase()).matches() && value.equals(value.toUpperCase())) {
            return EnumType.UPPER_ROMAN;
        }
        return null;
    }

    /**
     * @return the numeric value, or 0 when the value does not fit the type
     */
    private static int valueOf(String value, EnumType type) {
        return switch (type) {
            case ARABIC -> value.chars().allMatch(Character::isDigit) ? Integer.parseInt(value) : 0;
            case LOWER_ALPHA -> value.length() == 1 && Character.isLowerCase(value.charAt(0)) ? value.charAt(0) - 'a' + 1 : 0;
            case UPPER_ALPHA -> value.length() == 1 && Character.isUpperCase(value.charAt(0)) ? value.charAt(0) - 'A' + 1 : 0;
            case LOWER_ROMAN -> value.equals(value.toLowerCase()) ? romanValue(value) : 0;
            case UPPER_ROMAN -> value.equals(value.toUpperCase()) ? romanValue(value.toLowerCase()) : 0;
        };
    }

    static int romanValue(String roman) {
        if (!LOWER_ROMAN.matcher(roman).matches()) return 0;
        int total = 0;
        int previous = 0;
        for (int i = roman.length() - 1; i >= 0; i--) {
            int digit = switch (roman.charAt(i)) {
                case 'i' -> 1;
                case 'v' -> 5;
                case 'x' -> 10;
                case 'l' -> 50;
                case 'c' -> 100;
                case 'd' -> 500;
                default -> 1000;
            };
            total += digit < previous ? -digit : digit;
            previous = Math.max(previous, digit);
        }
        return total;
    }

    private record ItemBody(List<String> lines, int next) {
    }

    /**
     * The lines of a list item whose marker is {@code markerWidth} characters wide. The item
     * text starts after the marker, following lines have to be indented to that column.
     */
    private static ItemBody itemBody(List<String> lines, int pos, int markerWidth) {
        String first = lines.get(pos);
        int textColumn = markerWidth;
        while (textColumn < first.length() && first.charAt(textColumn) == ' ') textColumn++;

        if (textColumn >= first.length()) {
            IndentedBlock rest = IndentedBlock.collect(lines, pos + 1, 1);
            if (rest == null) return new ItemBody(List.of(), pos + 1);
            return new ItemBody(rest.dedented(), rest.next());
        }
        List<String> body = new ArrayList<>();
        body.add(first.substring(textColumn));
        IndentedBlock rest = IndentedBlock.collect(lines, pos + 1, textColumn);
        if (rest == null) return new ItemBody(body, pos + 1);
        body.addAll(rest.dedent(textColumn));
        return new ItemBody(body, rest.next());
    }

    BlockMatch definitionList(List<String> lines, int pos) {
        if (!isDefinitionItem(lines, pos)) return null;
        List<DefinitionListItem> items = new ArrayList<>();
        int i = pos;
        int end;
        while (true) {
            IndentedBlock definition = IndentedBlock.collect(lines, i + 1, 1);
            items.add(new DefinitionListItem(blocks.parseInline(lines.get(i)), blocks.parseBlocks(definition.dedented())));
            end = definition.next();
            int candidate = skipBlankLines(lines, end);
            if (!isDefinitionItem(lines, candidate)) break;
            i = candidate;
        }
        return new BlockMatch(new DefinitionList(items), end);
    }

    private static boolean isDefinitionItem(List<String> lines, int pos) {
        if (pos + 1 >= lines.size()) return false;
        String term = lines.get(pos);
        String definition = lines.get(pos + 1);
        return !isBlank(term) && indentOf(term) == 0 && !isBlank(definition) && indentOf(definition) > 0;
    }

    private record LineEntry(int indent, String text) {
    }

    BlockMatch lineBlock(List<String> lines, int pos) {
        if (!isLineStart(lines.get(pos))) return null;
        List<LineEntry> entries = new ArrayList<>();
        int i = pos;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (isLineStart(line)) {
                String text = line.length() > 2 ? line.substring(2) : "";
                entries.add(new LineEntry(indentOf(text), text.strip()));
            } else if (!isBlank(line) && indentOf(line) > 0) {
                LineEntry last = entries.remove(entries.size() - 1);
                entries.add(new LineEntry(last.indent(), last.text() + "\n" + line.strip()));
            } else {
                break;
            }
            i++;
        }
        return new BlockMatch(buildLineBlock(entries, 1), i);
    }

    private static boolean isLineStart(String line) {
        return line.equals("|") || line.startsWith("| ");
    }

    /**
     * Lines at the smallest indentation become lines of the block, more deeply indented
     * runs become nested line blocks.
     */
    private LineBlock buildLineBlock(List<LineEntry> entries, int depth) {
        int base = entries.stream().mapToInt(LineEntry::indent).min().orElse(0);
        List<Block> content = new ArrayList<>();
        int i = 0;
        while (i < entries.size()) {
            LineEntry entry = entries.get(i);
            if (entry.indent() == base || depth >= RstBlockParsers.MAX_NESTING) {
                content.add(new Line(blocks.parseInline(entry.text())));
                i++;
            } else {
                int end = i;
                while (end < entries.size() && entries.get(end).indent() > base) end++;
                content.add(buildLineBlock(entries.subList(i, end), depth + 1));
                i = end;
            }
        }
        return new LineBlock(content);
    }

    BlockMatch fieldList(List<String> lines, int pos) {
        Matcher marker = FIELD_MARKER.matcher(lines.get(pos));
        if (!marker.find()) return null;
        List<Field> fields = new ArrayList<>();
        int i = pos;
        int end;
        while (true) {
            List<String> body = new ArrayList<>();
            String text = lines.get(i).substring(marker.end());
            if (!text.isBlank()) body.add(text);
            IndentedBlock rest = IndentedBlock.collect(lines, i + 1, 1);
            if (rest != null) body.addAll(rest.dedented());
            end = rest == null ? i + 1 : rest.next();
            fields.add(new Field(blocks.parseInline(marker.group(1)), blocks.parseBlocks(body)));

            int candidate = skipBlankLines(lines, end);
            if (candidate >= lines.size()) break;
            marker = FIELD_MARKER.matcher(lines.get(candidate));
            if (!marker.find()) break;
            i = candidate;
        }
        return new BlockMatch(new FieldList(fields), end);
    }

    private record OptionItem(OptionListItem item, int next) {
    }

    BlockMatch optionList(List<String> lines, int pos) {
        OptionItem first = optionListItem(lines, pos);
        if (first == null) return null;
        List<OptionListItem> items = new ArrayList<>();
        OptionItem current = first;
        int end;
        while (true) {
            items.add(current.item());
            end = current.next();
            int candidate = skipBlankLines(lines, end);
            if (candidate >= lines.size()) break;
            current = optionListItem(lines, candidate);
            if (current == null) break;
        }
        return new BlockMatch(new OptionList(items), end);
    }

    /**
     * Options separated by commas, followed by two spaces and the description or by the
     * description indented on the next lines.
     */
    private OptionItem optionListItem(List<String> lines, int pos) {
        Matcher matcher = OPTION_ITEM.matcher(lines.get(pos));
        if (!matcher.matches()) return null;
        List<String> body = new ArrayList<>();
        if (matcher.group(2) != null) body.add(matcher.group(2));
        IndentedBlock rest = IndentedBlock.collect(lines, pos + 1, 1);
        if (rest != null) body.addAll(rest.dedented());
        if (body.isEmpty()) return null;

        List<ProgramOption> options = new ArrayList<>();
        Matcher option = PROGRAM_OPTION.matcher(matcher.group(1));
        while (option.find()) {
            options.add(new ProgramOption(option.group(1), option.group(2), option.group(3)));
        }
        int next = rest == null ? pos + 1 : rest.next();
        return new OptionItem(new OptionListItem(options, blocks.parseBlocks(body)), next);
    }
}
