package io.github.jbellis.wikimark.convert.table;

import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.text.Whitespace;
import io.github.jbellis.wikimark.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Rows of cells gathered from the body sections of a table.
 *
 * {@code firstColumnHeader} holds for the whole table or not at all: it is true only when the first
 * cell of every row is a header cell.
 */
public record TableModel(List<List<TableCell>> rows, boolean firstColumnHeader) {
    public TableModel {
        rows = rows.stream().map(List::copyOf).toList();
    }

    public static TableModel of(List<List<TableCell>> rows) {
        boolean firstColumnHeader = !rows.isEmpty()
                && rows.stream().allMatch(row -> !row.isEmpty() && row.get(0).header());
        return new TableModel(rows, firstColumnHeader);
    }

    /**
     * Collects the rows of every {@code tbody} of {@code table}, converting cell content through the context.
     */
    public static TableModel from(Node.Element table, ConversionContext context) {
        var rows = new ArrayList<List<TableCell>>();
        for (var section : table.childElements("tbody")) {
            for (var tr : section.childElements("tr")) {
                var cells = new ArrayList<TableCell>();
                for (var cell : tr.childElements()) {
                    if (cell.name().equals("td") || cell.name().equals("th")) {
                        cells.add(new TableCell(cellContent(cell, context), span(cell), cell.name().equals("th")));
                    }
                }
                rows.add(cells);
            }
        }
        return of(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Width of the widest row once spans are expanded.
     */
    public int columnCount() {
        return rows.stream()
                .mapToInt(row -> row.stream().mapToInt(TableCell::span).sum())
                .max()
                .orElse(0);
    }

    private static String cellContent(Node.Element cell, ConversionContext context) {
        return Whitespace.singleLine(context.convertChildrenInline(cell)).replace("|", "\\|");
    }

    private static int span(Node.Element cell) {
        try {
            return Math.max(1, Integer.parseInt(cell.attr("colspan").strip()));
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}
