package io.github.jbellis.wikimark.convert.table;

import io.github.jbellis.wikimark.convert.InlineHandlers;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link TableModel} as a pipe table. The first row is the header row.
 *
 * Every rendered row has the same number of cells: spanned cells are followed by empty fillers and
 * short rows are padded on the right.
 */
public final class TableRenderer {

    private TableRenderer() {
    }

    public static String render(TableModel model) {
        if (model.isEmpty()) {
            return "";
        }
        int columns = Math.max(1, model.columnCount());
        var lines = new ArrayList<String>();
        var rows = model.rows();
        for (int i = 0; i < rows.size(); i++) {
            lines.add(line(expand(rows.get(i), columns, model.firstColumnHeader())));
            if (i == 0) {
                lines.add(line(separator(columns)));
            }
        }
        return String.join("\n", lines) + "\n\n";
    }

    static List<String> expand(List<TableCell> row, int columns, boolean boldFirstColumn) {
        var cells = new ArrayList<String>(columns);
        for (var cell : row) {
            String content = cell.content();
            if (boldFirstColumn && cells.isEmpty()) {
                content = InlineHandlers.wrap(content, InlineHandlers.STRONG_MARKER);
            }
            cells.add(content);
            for (int i = 1; i < cell.span(); i++) {
                cells.add("");
            }
        }
        while (cells.size() < columns) {
            cells.add("");
        }
        return cells;
    }

    private static List<String> separator(int columns) {
        var cells = new ArrayList<String>(columns);
        for (int i = 0; i < columns; i++) {
            cells.add("---");
        }
        return cells;
    }

    private static String line(List<String> cells) {
        return "| " + String.join(" | ", cells) + " |";
    }
}
