package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.table.Cell;
import org.dxworks.docframe.model.table.CellType;
import org.dxworks.docframe.model.table.Columns;
import org.dxworks.docframe.model.table.Row;
import org.dxworks.docframe.model.table.Table;
import org.dxworks.docframe.model.table.TableBody;
import org.dxworks.docframe.model.table.TableHead;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.docframe.parser.rst.IndentedBlock.isBlank;

/**
 * Grid tables and simple tables. In simple tables the columns are defined by runs of {@code =}
 * in the top border and an optional second border separates the header rows. A line with an
 * empty first column continues the row above it.
 */
class TableParsers {

    private static final Pattern BORDER = Pattern.compile("=+( +=+)+");
    private static final Pattern COLUMN = Pattern.compile("=+");

    private final RstBlockParsers blocks;

    TableParsers(RstBlockParsers blocks) {
        this.blocks = blocks;
    }

    BlockMatch gridTable(List<String> lines, int pos) {
        if (!GridTableScanner.BORDER.matcher(lines.get(pos).stripTrailing()).matches()) return null;
        int end = pos;
        while (end < lines.size() && isGridLine(lines.get(end))) end++;
        List<String> tableLines = lines.subList(pos, end).stream().map(String::stripTrailing).toList();

        GridTableScanner.Grid grid = GridTableScanner.scan(tableLines);
        if (grid == null) {
            return new BlockMatch(RstBlockParsers.invalid("malformed grid table", String.join("\n", tableLines)), end);
        }
        List<List<Cell>> head = new ArrayList<>();
        List<List<Cell>> body = new ArrayList<>();
        for (int r = 0; r < grid.rowCount(); r++) {
            head.add(new ArrayList<>());
            body.add(new ArrayList<>());
        }
        for (GridTableScanner.GridCell cell : grid.cells()) {
            CellType type = cell.head() ? CellType.HEAD : CellType.BODY;
            Cell content = new Cell(type, cellContent(cell.lines()), cell.colspan(), cell.rowspan(), Options.NONE);
            (cell.head() ? head : body).get(cell.row()).add(content);
        }
        int headRows = (int) grid.cells().stream().filter(GridTableScanner.GridCell::head)
                .mapToInt(cell -> cell.row() + cell.rowspan()).max().orElse(0);
        return new BlockMatch(new Table(new TableHead(toRows(head.subList(0, headRows))),
                new TableBody(toRows(body.subList(headRows, body.size()))),
                Columns.options(noOptions(grid.columnCount())), Options.NONE), end);
    }

    private static boolean isGridLine(String line) {
        return !line.isEmpty() && (line.charAt(0) == '+' || line.charAt(0) == '|');
    }

    private static List<Row> toRows(List<List<Cell>> rows) {
        return rows.stream().map(Row::new).toList();
    }

    private record Section(List<List<List<String>>> rows, int border, boolean marginText) {
    }

    BlockMatch simpleTable(List<String> lines, int pos) {
        String top = lines.get(pos);
        if (!BORDER.matcher(top).matches()) return null;
        List<int[]> columns = columns(top);

        Section first = section(lines, pos + 1, columns);
        if (first == null || first.rows().isEmpty()) return null;
        int afterFirst = first.border() + 1;
        if (afterFirst >= lines.size() || isBlank(lines.get(afterFirst))) {
            if (first.marginText()) return marginText(lines, pos, afterFirst);
            return new BlockMatch(table(List.of(), first.rows(), columns.size()), afterFirst);
        }
        Section second = section(lines, afterFirst, columns);
        if (second == null) return null;
        int end = second.border() + 1;
        if (first.marginText() || second.marginText()) return marginText(lines, pos, end);
        return new BlockMatch(table(first.rows(), second.rows(), columns.size()), end);
    }

    private static BlockMatch marginText(List<String> lines, int pos, int end) {
        String source = String.join("\n", lines.subList(pos, end));
        return new BlockMatch(RstBlockParsers.invalid("text in column margin of simple table", source), end);
    }

    private static List<int[]> columns(String border) {
        List<int[]> columns = new ArrayList<>();
        Matcher matcher = COLUMN.matcher(border);
        while (matcher.find()) {
            columns.add(new int[]{matcher.start(), matcher.end()});
        }
        return columns;
    }

    /**
     * Reads rows up to the next border line.
     *
     * @return the rows with the lines of each cell, or {@code null} if no border follows
     */
    private static Section section(List<String> lines, int start, List<int[]> columns) {
        List<List<List<String>>> rows = new ArrayList<>();
        boolean marginText = false;
        for (int i = start; i < lines.size(); i++) {
            String line = lines.get(i);
            if (BORDER.matcher(line).matches()) return new Section(rows, i, marginText);
            if (isBlank(line)) continue;
            marginText |= hasMarginText(line, columns);

            List<String> cells = cellTexts(line, columns);
            if (cells.get(0).isBlank() && !rows.isEmpty()) {
                List<List<String>> previous = rows.get(rows.size() - 1);
                for (int c = 0; c < cells.size(); c++) {
                    previous.get(c).add(cells.get(c));
                }
            } else {
                List<List<String>> row = new ArrayList<>();
                cells.forEach(text -> row.add(new ArrayList<>(List.of(text))));
                rows.add(row);
            }
        }
        return null;
    }

    /**
     * Whether the line has text between two columns. The last column is open to the right.
     */
    private static boolean hasMarginText(String line, List<int[]> columns) {
        for (int c = 0; c < columns.size() - 1; c++) {
            int from = Math.min(columns.get(c)[1], line.length());
            int to = Math.min(columns.get(c + 1)[0], line.length());
            if (!line.substring(from, to).isBlank()) return true;
        }
        return false;
    }

    private static List<String> cellTexts(String line, List<int[]> columns) {
        List<String> texts = new ArrayList<>();
        for (int c = 0; c < columns.size(); c++) {
            int start = Math.min(columns.get(c)[0], line.length());
            int end = c == columns.size() - 1 ? line.length() : Math.min(columns.get(c)[1], line.length());
            texts.add(line.substring(start, end).stripTrailing());
        }
        return texts;
    }

    private Table table(List<List<List<String>>> head, List<List<List<String>>> body, int columnCount) {
        return new Table(new TableHead(rows(head, CellType.HEAD)), new TableBody(rows(body, CellType.BODY)),
                Columns.options(noOptions(columnCount)), Options.NONE);
    }

    private static Options[] noOptions(int columnCount) {
        Options[] columnOptions = new Options[columnCount];
        Arrays.fill(columnOptions, Options.NONE);
        return columnOptions;
    }

    private List<Row> rows(List<List<List<String>>> rows, CellType type) {
        List<Row> result = new ArrayList<>();
        for (List<List<String>> row : rows) {
            List<Cell> cells = new ArrayList<>();
            for (List<String> cellLines : row) {
                cells.add(new Cell(type, cellContent(cellLines)));
            }
            result.add(new Row(cells));
        }
        return result;
    }

    private List<Block> cellContent(List<String> cellLines) {
        IndentedBlock block = IndentedBlock.collect(cellLines, 0, 0);
        return block == null ? List.of() : blocks.parseBlocks(block.dedented());
    }
}
