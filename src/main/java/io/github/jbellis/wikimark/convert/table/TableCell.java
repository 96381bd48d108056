package io.github.jbellis.wikimark.convert.table;

/**
 * @param content rendered single-line cell content
 * @param span    number of columns the cell covers, at least 1
 * @param header  true for a semantic header cell ({@code th})
 */
public record TableCell(String content, int span, boolean header) {
    public TableCell {
        if (span < 1) {
            throw new IllegalArgumentException("span must be positive, got " + span);
        }
    }
}
