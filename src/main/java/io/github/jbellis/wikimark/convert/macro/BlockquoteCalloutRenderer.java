package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders a callout as quoted lines.
 *
 * The target dialect cannot put a fenced block inside a blockquote, so code fences produced while
 * rendering the body arrive wrapped in break-out markers (see {@link ConversionContext#standalone})
 * and are emitted between quoted segments instead. When this callout is itself quoted, the fences
 * are re-wrapped so the enclosing callout lifts them out as well.
 */
public class BlockquoteCalloutRenderer extends CalloutRenderer {

    @Override
    protected String render(int index, Optional<String> boldTitle, MacroNode macro, ConversionContext context) {
        String body;
        context.enterQuote();
        try {
            body = macro.richTextBody().map(context::convertChildren).orElse("");
        } finally {
            context.exitQuote();
        }

        var out = new StringBuilder();
        var quoted = new ArrayList<String>();
        boldTitle.ifPresent(quoted::add);

        int pos = 0;
        while (pos < body.length()) {
            int start = body.indexOf(ConversionContext.BREAKOUT_START, pos);
            if (start < 0) {
                addQuoted(quoted, body.substring(pos));
                break;
            }
            int end = body.indexOf(ConversionContext.BREAKOUT_END, start);
            if (end < 0) {
                // unbalanced marker, quote the rest as text
                addQuoted(quoted, body.substring(pos).replace(String.valueOf(ConversionContext.BREAKOUT_START), ""));
                break;
            }
            addQuoted(quoted, body.substring(pos, start));
            flush(quoted, out);
            out.append(context.standalone(body.substring(start + 1, end)));
            pos = end + 1;
        }
        flush(quoted, out);
        return out.toString();
    }

    private static void addQuoted(List<String> quoted, String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        boolean previousBlank = false;
        for (var line : trimmed.split("\n")) {
            boolean blank = line.isBlank();
            if (blank && previousBlank) {
                continue;
            }
            quoted.add(line.stripTrailing());
            previousBlank = blank;
        }
    }

    private static void flush(List<String> quoted, StringBuilder out) {
        if (quoted.isEmpty()) {
            return;
        }
        for (var line : quoted) {
            out.append(line.isEmpty() ? ">" : "> " + line).append('\n');
        }
        out.append('\n');
        quoted.clear();
    }
}
