package org.dxworks.docframe.parser.rst;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * A run of lines indented at least to a minimum column, possibly with blank lines in between.
 *
 * @param lines  the lines as they appear in the input, without trailing blank lines
 * @param indent the smallest indentation of the non-blank lines
 * @param next   index of the first line after the block
 */
record IndentedBlock(List<String> lines, int indent, int next) {

    static boolean isBlank(String line) {
        return line.isBlank();
    }

    static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == ' ') i++;
        return i;
    }

    static int skipBlankLines(List<String> lines, int pos) {
        int i = pos;
        while (i < lines.size() && isBlank(lines.get(i))) i++;
        return i;
    }

    static IndentedBlock collect(List<String> lines, int start, int minIndent) {
        return collect(lines, start, minIndent, false, line -> false);
    }

    /**
     * @param stopAt tested with the stripped content of every line, ends the block before a matching line
     * @return the block, or {@code null} if there is no indented line at {@code start}
     */
    static IndentedBlock collect(List<String> lines, int start, int minIndent,
                                 boolean endsOnBlankLine, Predicate<String> stopAt) {
        int indent = Integer.MAX_VALUE;
        int last = -1;
        for (int i = start; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isBlank(line)) {
                if (endsOnBlankLine) break;
                continue;
            }
            int lineIndent = indentOf(line);
            if (lineIndent < minIndent || stopAt.test(line.strip())) break;
            indent = Math.min(indent, lineIndent);
            last = i;
        }
        if (last < 0) return null;
        return new IndentedBlock(List.copyOf(lines.subList(start, last + 1)), indent, last + 1);
    }

    List<String> dedented() {
        return dedent(indent);
    }

    List<String> dedent(int columns) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(isBlank(line) ? "" : line.substring(Math.min(columns, indentOf(line))));
        }
        return result;
    }
}
