package org.dxworks.docframe.parser.rst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Finds the cells of a grid table by walking the borders clockwise from every unvisited
 * top-left corner.
 */
final class GridTableScanner {

    static final Pattern BORDER = Pattern.compile("\\+(-+\\+)+");
    private static final Pattern HEAD_SEPARATOR = Pattern.compile("\\+(=+\\+)+");

    /**
     * @param lines the cell text, without the border characters
     */
    record GridCell(int row, int column, int rowspan, int colspan, boolean head, List<String> lines) {
    }

    record Grid(List<GridCell> cells, int rowCount, int columnCount) {
    }

    private record Corners(int top, int left, int bottom, int right) {
    }

    private final List<String> lines;
    private final int bottom;
    private final int right;
    private final int[] done;
    private final TreeSet<Integer> rowBoundaries = new TreeSet<>(List.of(0));
    private final TreeSet<Integer> columnBoundaries = new TreeSet<>(List.of(0));
    private final List<Corners> found = new ArrayList<>();

    private GridTableScanner(List<String> lines) {
        this.lines = lines;
        this.bottom = lines.size() - 1;
        this.right = lines.get(0).length() - 1;
        this.done = new int[right + 1];
        Arrays.fill(done, -1);
    }

    /**
     * @param lines the table lines, without trailing whitespace
     * @return the cells, or {@code null} if the lines are not a well-formed grid
     */
    static Grid scan(List<String> lines) {
        if (lines.size() < 3) return null;
        int width = lines.get(0).length();
        int headSeparator = -1;
        List<String> normalized = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.length() != width) return null;
            if (i > 0 && i < lines.size() - 1 && HEAD_SEPARATOR.matcher(line).matches()) {
                if (headSeparator >= 0) return null;
                headSeparator = i;
                line = line.replace('=', '-');
            }
            normalized.add(line);
        }
        if (!BORDER.matcher(normalized.get(normalized.size() - 1)).matches()) return null;

        GridTableScanner scanner = new GridTableScanner(normalized);
        if (!scanner.findCells()) return null;
        return scanner.grid(headSeparator);
    }

    private boolean findCells() {
        PriorityQueue<int[]> corners = new PriorityQueue<>(
                Comparator.<int[]>comparingInt(corner -> corner[0]).thenComparingInt(corner -> corner[1]));
        corners.add(new int[]{0, 0});
        while (!corners.isEmpty()) {
            int[] corner = corners.poll();
            int top = corner[0];
            int left = corner[1];
            if (top == bottom || left == right || top <= done[left]) continue;
            Corners cell = scanRight(top, left);
            if (cell == null) continue;
            if (!markDone(cell)) return false;
            found.add(cell);
            corners.add(new int[]{top, cell.right()});
            corners.add(new int[]{cell.bottom(), left});
        }
        for (int column = 0; column < right; column++) {
            if (done[column] != bottom - 1) return false;
        }
        return true;
    }

    private boolean markDone(Corners cell) {
        for (int column = cell.left(); column < cell.right(); column++) {
            if (done[column] != cell.top() - 1) return false;
            done[column] = cell.bottom() - 1;
        }
        return true;
    }

    private Corners scanRight(int top, int left) {
        List<Integer> columnMarks = new ArrayList<>();
        String line = lines.get(top);
        for (int i = left + 1; i <= right; i++) {
            char c = line.charAt(i);
            if (c == '+') {
                columnMarks.add(i);
                Corners cell = scanDown(top, left, i, columnMarks);
                if (cell != null) return cell;
            } else if (c != '-') {
                return null;
            }
        }
        return null;
    }

    private Corners scanDown(int top, int left, int cellRight, List<Integer> columnMarks) {
        List<Integer> rowMarks = new ArrayList<>();
        for (int i = top + 1; i <= bottom; i++) {
            char c = lines.get(i).charAt(cellRight);
            if (c == '+') {
                rowMarks.add(i);
                List<Integer> bottomMarks = scanLeft(left, i, cellRight);
                List<Integer> leftMarks = bottomMarks == null ? null : scanUp(top, left, i);
                if (leftMarks != null) {
                    rowBoundaries.addAll(rowMarks);
                    rowBoundaries.addAll(leftMarks);
                    columnBoundaries.addAll(columnMarks);
                    columnBoundaries.addAll(bottomMarks);
                    return new Corners(top, left, i, cellRight);
                }
            } else if (c != '|') {
                return null;
            }
        }
        return null;
    }

    private List<Integer> scanLeft(int left, int cellBottom, int cellRight) {
        List<Integer> marks = new ArrayList<>();
        String line = lines.get(cellBottom);
        for (int i = cellRight - 1; i > left; i--) {
            char c = line.charAt(i);
            if (c == '+') {
                marks.add(i);
            } else if (c != '-') {
                return null;
            }
        }
        return line.charAt(left) == '+' ? marks : null;
    }

    private List<Integer> scanUp(int top, int left, int cellBottom) {
        List<Integer> marks = new ArrayList<>();
        for (int i = cellBottom - 1; i > top; i--) {
            char c = lines.get(i).charAt(left);
            if (c == '+') {
                marks.add(i);
            } else if (c != '|') {
                return null;
            }
        }
        return marks;
    }

    private Grid grid(int headSeparator) {
        List<Integer> rows = new ArrayList<>(rowBoundaries);
        List<Integer> columns = new ArrayList<>(columnBoundaries);
        if (headSeparator >= 0 && !rowBoundaries.contains(headSeparator)) return null;

        int remaining = (rows.size() - 1) * (columns.size() - 1);
        List<GridCell> cells = new ArrayList<>();
        found.sort(Comparator.comparingInt(Corners::top).thenComparingInt(Corners::left));
        for (Corners cell : found) {
            int row = rows.indexOf(cell.top());
            int column = columns.indexOf(cell.left());
            int rowspan = rows.indexOf(cell.bottom()) - row;
            int colspan = columns.indexOf(cell.right()) - column;
            remaining -= rowspan * colspan;
            cells.add(new GridCell(row, column, rowspan, colspan, cell.top() < headSeparator, text(cell)));
        }
        return remaining == 0 ? new Grid(cells, rows.size() - 1, columns.size() - 1) : null;
    }

    private List<String> text(Corners cell) {
        List<String> text = new ArrayList<>();
        for (int i = cell.top() + 1; i < cell.bottom(); i++) {
            text.add(lines.get(i).substring(cell.left() + 1, cell.right()).stripTrailing());
        }
        return text;
    }
}
